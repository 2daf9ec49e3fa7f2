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

import edgemap.image.GenericImage;
import edgemap.image.GridTraversal;
import edgemap.processing.neighborhood.SquareKernel;
import edgemap.test_utils.TestUtils;
import org.junit.Test;

import java.awt.image.BufferedImage;

import static org.junit.Assert.assertEquals;

/**
 *
 * @author Jean Ollion
 */
public class SobelOperatorTest {
    @Test
    public void testConstantImage() {
        BufferedImage image = TestUtils.gray(5, 5, (x, y) -> 100);
        GenericImage<Double> gx = SobelOperator.X.convolve(image);
        GenericImage<Double> gy = SobelOperator.Y.convolve(image);
        GridTraversal.loop(1, 1, 4, 4, (x, y) -> {
            assertEquals("interior X derivative", 0, gx.get(x, y), 0);
            assertEquals("interior Y derivative", 0, gy.get(x, y), 0);
        });
        // out of bounds pixels count as 0
        assertEquals("left border X derivative", 400, gx.get(0, 2), 0);
        assertEquals("top border Y derivative", 400, gy.get(2, 0), 0);
    }

    @Test
    public void testVerticalStep() {
        BufferedImage image = TestUtils.verticalStep(6, 5, 3);
        GenericImage<Double> gx = SobelOperator.X.convolve(image);
        GenericImage<Double> gy = SobelOperator.Y.convolve(image);
        assertEquals("width", 6, gx.getWidth());
        assertEquals("height", 5, gx.getHeight());
        assertEquals("before step", 0, gx.get(1, 2), 0);
        assertEquals("step", 1020, gx.get(2, 2), 0);
        assertEquals("step", 1020, gx.get(3, 2), 0);
        assertEquals("after step", 0, gx.get(4, 2), 0);
        assertEquals("Y derivative of vertical step", 0, gy.get(2, 2), 0);
    }

    @Test
    public void testHorizontalStep() {
        BufferedImage image = TestUtils.gray(5, 6, (x, y) -> y<3 ? 0 : 255);
        GenericImage<Double> gy = SobelOperator.Y.convolve(image);
        assertEquals("step", 1020, gy.get(2, 2), 0);
        assertEquals("X derivative of horizontal step", 0, SobelOperator.X.convolve(image).get(2, 2), 0);
    }

    @Test
    public void testParallel() {
        BufferedImage image = TestUtils.gray(13, 11, (x, y) -> (x * y * 17) % 256);
        GenericImage<Double> seq = SobelOperator.X.convolve(image, false);
        GenericImage<Double> par = SobelOperator.X.convolve(image, true);
        GridTraversal.loop(13, 11, (x, y) -> assertEquals("pixel "+x+";"+y, seq.get(x, y), par.get(x, y)));
    }

    @Test
    public void testKernel() {
        assertEquals("kernel", SquareKernel.SOBEL, SobelOperator.X.getKernel());
        assertEquals("mask corner", -1, SobelOperator.X.newMask().getData(0, 0), 0);
        assertEquals("mask", 2, SobelOperator.X.newMask().getData(2, 1), 0);
        assertEquals("mask", 2, SobelOperator.Y.newMask().getData(1, 2), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testColorImage() {
        SobelOperator.X.convolve(TestUtils.rgb(3, 3, (x, y) -> 0));
    }
}
