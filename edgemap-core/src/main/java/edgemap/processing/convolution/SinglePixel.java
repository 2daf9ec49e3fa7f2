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

import java.util.Objects;

/**
 * Single channel pixel
 * @author Jean Ollion
 * @param <N> numeric type
 */
public final class SinglePixel<N> extends PixelVector<SinglePixel<N>, N> {
    public final N value;

    public SinglePixel(N value, Numeric<N> numeric) {
        super(numeric);
        this.value = value;
    }

    @Override
    public SinglePixel<N> scale(N factor) {
        return new SinglePixel<>(numeric.multiply(value, factor), numeric);
    }

    @Override
    public SinglePixel<N> add(SinglePixel<N> other) {
        return new SinglePixel<>(numeric.add(value, other.value), numeric);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SinglePixel)) return false;
        return Objects.equals(value, ((SinglePixel<?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "SinglePixel("+value+")";
    }
}
