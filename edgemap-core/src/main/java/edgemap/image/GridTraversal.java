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
package edgemap.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Iteration over rectangular regions of a 2D grid.
 * All sequential loops scan in row order: row 0 from left to right, then row 1, etc.
 * @author Jean Ollion
 */
public interface GridTraversal {
    Logger logger = LoggerFactory.getLogger(GridTraversal.class);

    @FunctionalInterface
    interface LoopFunction {
        void loop(int x, int y);
    }
    @FunctionalInterface
    interface LoopPredicate {
        boolean test(int x, int y);
    }
    @FunctionalInterface
    interface IndexFunction<T> {
        T apply(int x, int y);
    }

    /**
     *
     * @param width number of columns
     * @param height number of rows
     * @param function run on each coordinate, in row order
     */
    static void loop(int width, int height, LoopFunction function) {
        loop(0, 0, width, height, function);
    }

    /**
     * Loops over the rectangle [{@param xMin}; {@param xMaxExcl}) x [{@param yMin}; {@param yMaxExcl})
     * @param xMin included
     * @param yMin included
     * @param xMaxExcl excluded
     * @param yMaxExcl excluded
     * @param function run on each coordinate, in row order
     */
    static void loop(int xMin, int yMin, int xMaxExcl, int yMaxExcl, LoopFunction function) {
        for (int y = yMin; y<yMaxExcl; ++y) {
            for (int x = xMin; x<xMaxExcl; ++x) {
                function.loop(x, y);
            }
        }
    }

    /**
     *
     * @param width number of columns
     * @param height number of rows
     * @param function : function to run on each pixel. When {@param parallel} is true it must only write to the coordinate it receives
     * @param parallel rows are distributed among threads, each row is scanned from left to right
     */
    static void loop(int width, int height, LoopFunction function, boolean parallel) {
        if (!parallel || height<=1) {
            loop(width, height, function);
            return;
        }
        IntStream.range(0, height).parallel().forEach(y -> {
            for (int x = 0; x<width; ++x) function.loop(x, y);
        });
    }

    /**
     *
     * @return values of {@param function} for each coordinate, in row order
     */
    static <T> List<T> map(int width, int height, IndexFunction<T> function) {
        List<T> res = new ArrayList<>(Math.max(0, width * height));
        loop(width, height, (x, y) -> res.add(function.apply(x, y)));
        return res;
    }

    static int count(int width, int height, LoopPredicate predicate) {
        int[] count = new int[1];
        loop(width, height, (x, y) -> {
            if (predicate.test(x, y)) ++count[0];
        });
        return count[0];
    }
}
