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

/**
 * Gaussian smoothing of single band images. The result is a gray image with the sample depth of the source (8 or 16 bits), see {@link GrayImageWriter}
 * @author Jean Ollion
 */
public class GrayscaleGaussConvolution extends GaussConvolution<SinglePixel<Double>> {
    public GrayscaleGaussConvolution(double sigma, SquareKernel kernel) {
        super(sigma, kernel, SinglePixelOps.DOUBLE, new GrayImageWriter());
    }
}
