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
 * Output policy of a {@link Convolution}: allocation of the result and write back of each aggregated pixel
 * @author Jean Ollion
 * @param <V> pixel vector type
 * @param <R> result type
 */
public interface CanvasWriter<V, R> {
    R allocate(BufferedImage source);
    void writeBack(int x, int y, V value, R canvas);
    int widthOf(R canvas);
    int heightOf(R canvas);
}
