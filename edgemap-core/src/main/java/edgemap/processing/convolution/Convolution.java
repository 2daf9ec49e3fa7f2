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

import edgemap.image.GridTraversal;
import edgemap.processing.neighborhood.SquareKernel;
import edgemap.processing.neighborhood.SquareMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Applies a mask on every pixel of an image. Allocation of the result and write back of each aggregated pixel are delegated to a {@link CanvasWriter}.
 * Instances hold no state between calls.
 * @author Jean Ollion
 * @param <V> pixel vector type
 * @param <N> numeric type
 * @param <R> result type
 */
public abstract class Convolution<V, N, R> {
    public final static Logger logger = LoggerFactory.getLogger(Convolution.class);
    protected final SquareKernel kernel;
    protected final VectorOps<V, N> ops;
    protected final CanvasWriter<V, R> writer;

    protected Convolution(SquareKernel kernel, VectorOps<V, N> ops, CanvasWriter<V, R> writer) {
        this.kernel = kernel;
        this.ops = ops;
        this.writer = writer;
    }

    public SquareKernel getKernel() {
        return kernel;
    }

    public VectorOps<V, N> getOps() {
        return ops;
    }

    public abstract SquareMask<N> newMask();

    public R apply(BufferedImage image) {
        return convolve(image);
    }

    public R convolve(BufferedImage image) {
        return convolve(image, false);
    }

    /**
     *
     * @param image source image, not modified
     * @param parallel if true, rows of the result are computed on several threads. The result is identical to the sequential one
     * @return new result allocated by the {@link CanvasWriter}
     */
    public R convolve(BufferedImage image, boolean parallel) {
        long t0 = System.currentTimeMillis();
        R canvas = writer.allocate(image);
        SquareMask<N> mask = newMask();
        GridTraversal.loop(writer.widthOf(canvas), writer.heightOf(canvas), (x, y) -> writer.writeBack(x, y, mask.evaluate(x, y, image, ops), canvas), parallel);
        if (logger.isDebugEnabled()) logger.debug("{} on {}x{} image: {}ms", getClass().getSimpleName(), image.getWidth(), image.getHeight(), System.currentTimeMillis() - t0);
        return canvas;
    }
}
