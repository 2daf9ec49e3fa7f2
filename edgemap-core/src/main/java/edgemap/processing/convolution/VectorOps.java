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

import java.awt.image.BufferedImage;

/**
 * Vector space operations on a pixel type, and sampling of that pixel type from an image.
 * Implementations must satisfy: add is commutative and associative with {@link #unit()} as identity, scale distributes over add and scaling {@link #unit()} gives {@link #unit()}.
 * @author Jean Ollion
 * @param <V> pixel vector type
 * @param <N> numeric type
 */
public interface VectorOps<V, N> {
    /**
     * @return additive identity (black pixel)
     */
    V unit();
    V fromImage(int x, int y, BufferedImage image);
    V scale(V element, N factor);
    V add(V lhs, V rhs);
    Numeric<N> numeric();
}
