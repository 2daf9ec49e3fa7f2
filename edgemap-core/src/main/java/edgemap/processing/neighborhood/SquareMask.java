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
package edgemap.processing.neighborhood;

import edgemap.image.GridTraversal;
import edgemap.processing.convolution.Numeric;
import edgemap.processing.convolution.VectorOps;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Square kernel with weights. Weights are stored in row order: weight of cell (i, j) is at index j * side + i
 * @author Jean Ollion
 * @param <N> numeric type of the weights
 */
public class SquareMask<N> {
    private final int side;
    private final int mid;
    private final Object[] data;
    private final Numeric<N> numeric;

    public SquareMask(int side, Object[] data, Numeric<N> numeric) {
        if (side<=0) throw new IllegalArgumentException("SquareMask requires positive side");
        if (data.length != side * side) throw new IllegalArgumentException("SquareMask: data length ("+data.length+") should be side * side ("+side*side+")");
        this.side = side;
        this.mid = side / 2;
        this.data = Arrays.copyOf(data, data.length);
        this.numeric = numeric;
    }

    public int getSide() {
        return side;
    }

    public int getMid() {
        return mid;
    }

    public Numeric<N> getNumeric() {
        return numeric;
    }

    public N getData(int i, int j) {
        return (N)data[j * side + i];
    }

    /**
     * Weighted sum of the pixels around ({@param x}, {@param y}). Cell (i, j) is applied to pixel (i - mid + x, j - mid + y).
     * Pixels outside the image contribute {@link VectorOps#unit()} (zero padding)
     * @param x X-axis coordinate of the center
     * @param y Y-axis coordinate of the center
     * @param image image to sample
     * @param ops pixel operations
     * @return sum accumulated in row order of the mask cells, starting from {@link VectorOps#unit()}
     */
    public <V> V evaluate(int x, int y, BufferedImage image, VectorOps<V, N> ops) {
        int width = image.getWidth();
        int height = image.getHeight();
        Object[] acc = new Object[]{ops.unit()};
        GridTraversal.loop(side, side, (i, j) -> {
            int curX = i - mid + x;
            int curY = j - mid + y;
            if (curX<0 || curX>=width || curY<0 || curY>=height) acc[0] = ops.add((V)acc[0], ops.unit());
            else acc[0] = ops.add((V)acc[0], ops.scale(ops.fromImage(curX, curY, image), getData(i, j)));
        });
        return (V)acc[0];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SquareMask ").append(side).append('x').append(side).append(": [");
        for (int j = 0; j<side; ++j) {
            if (j>0) sb.append("; ");
            for (int i = 0; i<side; ++i) {
                if (i>0) sb.append(", ");
                sb.append(getData(i, j));
            }
        }
        return sb.append(']').toString();
    }
}
