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
import edgemap.processing.neighborhood.SquareKernel;
import edgemap.processing.neighborhood.SquareMask;

/**
 * 3x3 Sobel derivative of single band images. Result is a gradient field of the size of the input
 * @author Jean Ollion
 */
public class SobelOperator extends Convolution<SinglePixel<Double>, Double, GenericImage<Double>> {
    private static final Double[] SOBEL_X_DATA = new Double[] {
            -1.0, 0.0, 1.0,
            -2.0, 0.0, 2.0,
            -1.0, 0.0, 1.0};
    private static final Double[] SOBEL_Y_DATA = new Double[] {
            -1.0, -2.0, -1.0,
             0.0,  0.0,  0.0,
             1.0,  2.0,  1.0};

    /** derivative along the X-axis: positive when intensity increases to the right */
    public static final SobelOperator X = new SobelOperator("SobelX", SOBEL_X_DATA);
    /** derivative along the Y-axis: positive when intensity increases downwards */
    public static final SobelOperator Y = new SobelOperator("SobelY", SOBEL_Y_DATA);

    private final String name;
    private final SquareMask<Double> mask;

    private SobelOperator(String name, Double[] data) {
        super(SquareKernel.SOBEL, SinglePixelOps.DOUBLE, new GradientFieldWriter());
        this.name = name;
        this.mask = new SquareMask<>(SquareKernel.SOBEL.getSide(), data, Numeric.DOUBLE);
    }

    /**
     *
     * @return the constant mask of this operator (masks are immutable)
     */
    @Override
    public SquareMask<Double> newMask() {
        return mask;
    }

    @Override
    public String toString() {
        return name;
    }
}
