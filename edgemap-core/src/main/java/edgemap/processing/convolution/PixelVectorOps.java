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

/**
 *
 * @author Jean Ollion
 */
public abstract class PixelVectorOps<P extends PixelVector<P, N>, N> implements VectorOps<P, N> {
    protected final Numeric<N> numeric;

    protected PixelVectorOps(Numeric<N> numeric) {
        this.numeric = numeric;
    }

    @Override
    public P scale(P element, N factor) {
        return element.scale(factor);
    }

    @Override
    public P add(P lhs, P rhs) {
        return lhs.add(rhs);
    }

    @Override
    public Numeric<N> numeric() {
        return numeric;
    }
}
