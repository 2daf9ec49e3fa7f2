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

import java.util.stream.LongStream;

/**
 * Counts of values over bins of constant size. Bin i covers [min + i * binSize; min + (i+1) * binSize)
 * @author Jean Ollion
 */
public class Histogram {
    private final long[] counts;
    private final double min;
    private final double binSize;

    public Histogram(long[] counts, double binSize, double min) {
        if (counts.length==0) throw new IllegalArgumentException("Histogram requires at least one bin");
        if (!(binSize>0)) throw new IllegalArgumentException("Bin size must be > 0");
        this.counts = counts;
        this.binSize = binSize;
        this.min = min;
    }

    public long[] getData() {
        return counts;
    }

    public double getMin() {
        return min;
    }

    public double getBinSize() {
        return binSize;
    }

    public long count() {
        return LongStream.of(counts).sum();
    }

    public double getValueFromIdx(double idx) {
        return min + idx * binSize;
    }

    /**
     *
     * @return lower bound of the first non-empty bin, or min if the histogram is empty
     */
    public double getMinValue() {
        for (int i = 0; i<counts.length; ++i) if (counts[i]>0) return getValueFromIdx(i);
        return min;
    }

    /**
     *
     * @return upper bound of the last non-empty bin, or min if the histogram is empty
     */
    public double getMaxValue() {
        for (int i = counts.length-1; i>=0; --i) if (counts[i]>0) return getValueFromIdx(i+1);
        return min;
    }

    /**
     * Value below which a fraction {@param quantile} of the counts lie. Counts are summed from the highest bin down until they reach (1 - quantile) * count(); the value is linearly interpolated inside that bin
     * @param quantile fraction in [0;1]. 0 gives {@link #getMinValue()} and 1 gives {@link #getMaxValue()}
     * @return the quantile value, min if the histogram is empty
     */
    public double getQuantile(double quantile) {
        if (quantile<=0) return getMinValue();
        if (quantile>=1) return getMaxValue();
        long total = count();
        if (total==0) return min;
        double above = total * (1 - quantile);
        int idx = counts.length - 1;
        long cumulated = counts[idx];
        while (cumulated < above && idx > 0) cumulated += counts[--idx];
        double inBin = counts[idx]==0 ? 0 : (cumulated - above) / counts[idx];
        return getValueFromIdx(idx + inBin);
    }

    @Override
    public String toString() {
        return "Histogram[bins: "+counts.length+" min: "+min+" binSize: "+binSize+" count: "+count()+"]";
    }
}
