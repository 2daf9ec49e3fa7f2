/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of EDGEMAP
 *
 * EDGEMAP is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * EDGEMAP is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with EDGEMAP.  If not, see <http://www.gnu.org/licenses/>.
 */
package edgemap.processing.convolution;

import edgemap.processing.neighborhood.SquareKernel;
import edgemap.processing.neighborhood.SquareMask;
import edgemap.test_utils.TestUtils;
import org.junit.Test;

import java.awt.image.BufferedImage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class GaussConvolutionTest {
    @Test
    public void testMask() {
        double sigma = 1.5;
        SquareMask<Double> mask = new GrayscaleGaussConvolution(sigma, SquareKernel.DEFAULT).newMask();
        int side = mask.getSide();
        assertEquals("side", 5, side);
        assertEquals("center weight", 1 / (2 * Math.PI * sigma * sigma), mask.getData(2, 2), 1e-12);
        for (int j = 0; j<side; ++j) {
            for (int i = 0; i<side; ++i) {
                assertTrue("positive weight", mask.getData(i, j)>0);
                assertTrue("center is maximal", mask.getData(i, j)<=mask.getData(2, 2));
                assertEquals("transposition symmetry", mask.getData(i, j), mask.getData(j, i), 0);
                assertEquals("horizontal symmetry", mask.getData(i, j), mask.getData(side - 1 - i, j), 0);
                assertEquals("vertical symmetry", mask.getData(i, j), mask.getData(i, side - 1 - j), 0);
            }
        }
    }

    @Test
    public void testGrayscaleSmoothing() {
        BufferedImage image = TestUtils.gray(5, 5, (x, y) -> 100);
        BufferedImage res = new GrayscaleGaussConvolution(1, SquareKernel.DEFAULT).convolve(image);
        assertEquals("type", BufferedImage.TYPE_BYTE_GRAY, res.getType());
        assertEquals("width", 5, res.getWidth());
        assertEquals("height", 5, res.getHeight());
        // weights are not normalized: their sum is ~0.98 for sigma = 1
        assertEquals("center value", 98, TestUtils.getGray(res, 2, 2));
        assertEquals("corner value", 48, TestUtils.getGray(res, 0, 0));
        assertEquals("source unchanged", 100, TestUtils.getGray(image, 2, 2));
    }

    @Test
    public void test16BitSmoothing() {
        BufferedImage image = new BufferedImage(5, 5, BufferedImage.TYPE_USHORT_GRAY);
        for (int y = 0; y<5; ++y) {
            for (int x = 0; x<5; ++x) image.getRaster().setSample(x, y, 0, 3000);
        }
        BufferedImage res = new GrayscaleGaussConvolution(1, SquareKernel.DEFAULT).convolve(image);
        assertEquals("type", BufferedImage.TYPE_USHORT_GRAY, res.getType());
        assertEquals("center value", 2945, TestUtils.getGray(res, 2, 2));
    }

    @Test
    public void testRGBSmoothing() {
        BufferedImage image = TestUtils.rgb(5, 5, (x, y) -> TestUtils.packRGB(200, 100, 50));
        BufferedImage res = new RGBGaussConvolution(1, SquareKernel.DEFAULT).apply(image);
        assertEquals("type", BufferedImage.TYPE_INT_ARGB, res.getType());
        int center = res.getRGB(2, 2);
        assertEquals("alpha", 0xff, (center >> 24) & 0xff);
        assertEquals("red", 196, (center >> 16) & 0xff);
        assertEquals("green", 98, (center >> 8) & 0xff);
        assertEquals("blue", 49, center & 0xff);
    }

    @Test
    public void testParallelConvolution() {
        BufferedImage image = TestUtils.gray(23, 17, (x, y) -> (x * 31 + y * 7) % 256);
        GrayscaleGaussConvolution gauss = new GrayscaleGaussConvolution(2, new SquareKernel(7));
        BufferedImage seq = gauss.convolve(image, false);
        BufferedImage par = gauss.convolve(image, true);
        for (int y = 0; y<17; ++y) {
            for (int x = 0; x<23; ++x) assertEquals("pixel "+x+";"+y, TestUtils.getGray(seq, x, y), TestUtils.getGray(par, x, y));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullSigma() {
        new RGBGaussConvolution(0, SquareKernel.DEFAULT);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNSigma() {
        new GrayscaleGaussConvolution(Double.NaN, SquareKernel.DEFAULT);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRGBSmoothingOfGrayImage() {
        new RGBGaussConvolution(1, SquareKernel.DEFAULT).convolve(TestUtils.gray(3, 3, (x, y) -> 1));
    }
}
