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
 * Pixel sample seen as a vector: it can be scaled by a number and added to a sample of the same shape.
 * The set of shapes is closed: {@link SinglePixel} (one channel) and {@link TriPixel} (red, green, blue).
 * @author Jean Ollion
 * @param <P> concrete pixel type
 * @param <N> numeric type of the channels
 */
public abstract class PixelVector<P extends PixelVector<P, N>, N> {
    protected final Numeric<N> numeric;

    PixelVector(Numeric<N> numeric) {
        this.numeric = numeric;
    }

    public Numeric<N> numeric() {
        return numeric;
    }

    public abstract P scale(N factor);

    public abstract P add(P other);
}
