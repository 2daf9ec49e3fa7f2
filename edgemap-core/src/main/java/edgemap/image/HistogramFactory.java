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

import java.util.DoubleSummaryStatistics;
import java.util.function.ObjDoubleConsumer;
import java.util.function.Supplier;
import java.util.stream.DoubleStream;

/**
 *
 * @author Jean Ollion
 */
public class HistogramFactory {
    public final static Logger logger = LoggerFactory.getLogger(HistogramFactory.class);
    public static final int DEFAULT_N_BINS = 256;

    /**
     *
     * @param values values to count. The stream is buffered, it is consumed only once
     * @param nBins number of bins
     * @return histogram whose bins span [min; max] of {@param values}. When all values are equal the bin size is 1
     */
    public static Histogram getHistogram(DoubleStream values, int nBins) {
        if (nBins<=0) throw new IllegalArgumentException("Number of bins must be > 0");
        double[] v = values.toArray();
        if (v.length==0) return new Histogram(new long[nBins], 1, 0);
        DoubleSummaryStatistics stats = DoubleStream.of(v).summaryStatistics();
        double binSize = getBinSize(stats.getMin(), stats.getMax(), nBins);
        return getHistogram(DoubleStream.of(v), binSize, nBins, stats.getMin());
    }

    public static Histogram getHistogram(DoubleStream values, double binSize, int nBins, double min) {
        double coeff = 1 / binSize;
        ObjDoubleConsumer<long[]> cons = (long[] histo, double v) -> {
            int idx = (int) ((v - min) * coeff);
            if (idx>=0 && idx<nBins) histo[idx]++;
            else if (idx==nBins) histo[nBins-1]++; // maximal value
        };
        Supplier<long[]> supplier = () -> new long[nBins];
        long[] histo = values.collect(supplier, cons, (h1, h2) -> {
            for (int i = 0; i<nBins; ++i) h1[i]+=h2[i];
        });
        return new Histogram(histo, binSize, min);
    }

    public static double getBinSize(double min, double max, int nBins) {
        if (max<=min) return 1;
        return (max - min) / nBins;
    }
}
