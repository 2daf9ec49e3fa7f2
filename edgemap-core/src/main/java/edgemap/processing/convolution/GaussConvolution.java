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

import java.awt.image.BufferedImage;

/**
 * Gaussian smoothing. Weights are 1 / (2 pi sigma^2) * exp(-(dx^2 + dy^2) / (2 sigma^2)) with dx, dy the absolute offsets of the cell from the center of the kernel. Weights are not normalized.
 * @author Jean Ollion
 * @param <P> pixel type
 */
public abstract class GaussConvolution<P extends PixelVector<P, Double>> extends Convolution<P, Double, BufferedImage> {
    protected final double sigma;

    protected GaussConvolution(double sigma, SquareKernel kernel, VectorOps<P, Double> ops, CanvasWriter<P, BufferedImage> writer) {
        super(kernel, ops, writer);
        if (!(sigma>0)) throw new IllegalArgumentException("Gaussian convolution requires sigma > 0 (was: "+sigma+")");
        this.sigma = sigma;
    }

    public double getSigma() {
        return sigma;
    }

    public static double gauss(int dx, int dy, double sigma) {
        double sigma2 = sigma * sigma;
        return 1.0 / (2.0 * Math.PI * sigma2) * Math.exp( - (dx * dx + dy * dy) / (2.0 * sigma2) );
    }

    @Override
    public SquareMask<Double> newMask() {
        int mid = kernel.getMid();
        return kernel.computeMask((i, j) -> gauss(Math.abs(i - mid), Math.abs(j - mid), sigma), Numeric.DOUBLE);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()+"[sigma: "+sigma+" kernel: "+kernel.getSide()+"]";
    }
}
