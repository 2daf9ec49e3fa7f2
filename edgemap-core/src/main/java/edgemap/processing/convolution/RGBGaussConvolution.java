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
 * Gaussian smoothing of three band images. The result is an opaque ARGB image
 * @author Jean Ollion
 */
public class RGBGaussConvolution extends GaussConvolution<TriPixel<Double>> {
    public RGBGaussConvolution(double sigma, SquareKernel kernel) {
        super(sigma, kernel, TriPixelOps.DOUBLE, new ArgbImageWriter());
    }
}
