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

import java.util.List;

/**
 * Geometry of an odd-sized square neighborhood. Holds no weight: see {@link #computeMask(MaskGenerator, Numeric)}
 * @author Jean Ollion
 */
public class SquareKernel {
    /** 5x5 kernel */
    public static final SquareKernel DEFAULT = new SquareKernel(5);
    /** 3x3 kernel */
    public static final SquareKernel SOBEL = new SquareKernel(3);

    private final int side;

    public SquareKernel(int side) {
        if (side<=0) throw new IllegalArgumentException("SquareKernel requires positive side");
        this.side = side;
    }

    public int getSide() {
        return side;
    }

    public int getMid() {
        return side / 2;
    }

    /**
     *
     * @param generator evaluated on each cell (i, j) of [0; side)^2 in row order
     * @param numeric numeric type of the weights
     * @return mask with weight(i, j) = generator(i, j)
     */
    public <N> SquareMask<N> computeMask(MaskGenerator<N> generator, Numeric<N> numeric) {
        List<N> data = GridTraversal.map(side, side, generator::weight);
        return new SquareMask<>(side, data.toArray(), numeric);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SquareKernel)) return false;
        return side == ((SquareKernel) o).side;
    }

    @Override
    public int hashCode() {
        return side;
    }

    @Override
    public String toString() {
        return "SquareKernel: "+side+"x"+side;
    }
}
