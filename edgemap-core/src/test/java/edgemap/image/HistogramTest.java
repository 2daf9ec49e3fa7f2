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

import org.junit.Test;

import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

import static org.junit.Assert.assertEquals;

/**
 *
 * @author Jean Ollion
 */
public class HistogramTest {
    private static Histogram uniform() {
        return HistogramFactory.getHistogram(IntStream.range(0, 100).asDoubleStream(), 100);
    }

    @Test
    public void testUniformHistogram() {
        Histogram h = uniform();
        assertEquals("count", 100, h.count());
        assertEquals("bin size", 0.99, h.getBinSize(), 1e-9);
        for (int i = 0; i<100; ++i) assertEquals("bin count "+i, 1, h.getData()[i]);
        assertEquals("min value", 0, h.getMinValue(), 1e-9);
        assertEquals("max value", 99, h.getMaxValue(), 1e-9);
    }

    @Test
    public void testQuantile() {
        Histogram h = uniform();
        assertEquals("quantile 0", 0, h.getQuantile(0), 1e-9);
        assertEquals("quantile 0.9", 89.1, h.getQuantile(0.9), 1e-6);
        assertEquals("quantile 1", 99, h.getQuantile(1), 1e-9);
    }

    @Test
    public void testBounds() {
        Histogram h = HistogramFactory.getHistogram(DoubleStream.of(2, 2, 5, 10), 1, 10, 0);
        assertEquals("min value", 2, h.getMinValue(), 0);
        assertEquals("max value in last bin", 1, h.getData()[9]);
        assertEquals("max value", 10, h.getMaxValue(), 0);
        assertEquals("value of index", 6, h.getValueFromIdx(6), 0);
    }

    @Test
    public void testConstantValues() {
        Histogram h = HistogramFactory.getHistogram(DoubleStream.of(3, 3, 3), 8);
        assertEquals("bin size", 1, h.getBinSize(), 0);
        assertEquals("count in first bin", 3, h.getData()[0]);
        assertEquals("quantile", 3.5, h.getQuantile(0.5), 1e-9);
    }

    @Test
    public void testEmpty() {
        Histogram h = HistogramFactory.getHistogram(DoubleStream.empty(), 16);
        assertEquals("count", 0, h.count());
        assertEquals("bin count", 16, h.getData().length);
        assertEquals("quantile of empty histogram", 0, h.getQuantile(0.5), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBinNumber() {
        HistogramFactory.getHistogram(DoubleStream.of(1, 2), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBinSize() {
        new Histogram(new long[4], 0, 0);
    }
}
