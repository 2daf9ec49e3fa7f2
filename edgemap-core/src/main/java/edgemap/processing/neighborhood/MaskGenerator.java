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

/**
 * Weight of a mask cell
 * @param <N> numeric type
 */
@FunctionalInterface
public interface MaskGenerator<N> {
    /**
     *
     * @param i column of the cell within the kernel, in [0; side)
     * @param j row of the cell within the kernel, in [0; side)
     * @return weight of cell (i, j)
     */
    N weight(int i, int j);
}
