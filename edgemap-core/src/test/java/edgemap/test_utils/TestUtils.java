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
package edgemap.test_utils;

import edgemap.image.GenericImage;

import java.awt.image.BufferedImage;
import java.util.function.IntBinaryOperator;

/**
 *
 * @author Jean Ollion
 */
public class TestUtils {
    public static BufferedImage gray(int width, int height, IntBinaryOperator value) {
        BufferedImage res = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y<height; ++y) {
            for (int x = 0; x<width; ++x) res.getRaster().setSample(x, y, 0, value.applyAsInt(x, y));
        }
        return res;
    }

    public static BufferedImage rgb(int width, int height, IntBinaryOperator packedRGB) {
        BufferedImage res = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y<height; ++y) {
            for (int x = 0; x<width; ++x) res.setRGB(x, y, packedRGB.applyAsInt(x, y));
        }
        return res;
    }

    public static int packRGB(int r, int g, int b) {
        return (r << 16) | (g << 8) | b;
    }

    /**
     *
     * @return gray image with 0 on columns x < {@param xEdge} and 255 elsewhere
     */
    public static BufferedImage verticalStep(int width, int height, int xEdge) {
        return gray(width, height, (x, y) -> x<xEdge ? 0 : 255);
    }

    public static int getGray(BufferedImage image, int x, int y) {
        return image.getRaster().getSample(x, y, 0);
    }

    /**
     *
     * @return x coordinate of the maximal value of row {@param y} within [{@param xMin}; {@param xMax}], first one in case of ties
     */
    public static int argMaxInRow(GenericImage<Double> image, int y, int xMin, int xMax) {
        int res = xMin;
        for (int x = xMin+1; x<=xMax; ++x) if (image.get(x, y)>image.get(res, y)) res = x;
        return res;
    }
}
