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

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.util.Arrays;
import java.util.Comparator;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.stream.IntStream;

/**
 * Dense 2D image with elements of any type, stored in a flat row-major buffer (index = y * width + x).
 * Zero-sized images are valid; negative dimensions are not.
 * {@link #get(int, int)} and {@link #set(int, int, Object)} perform no bounds checking: accessing a coordinate outside [0;width) x [0;height) is a programming error with unspecified outcome.
 * @author Jean Ollion
 * @param <T> element type
 */
public class GenericImage<T> {
    public final static Logger logger = LoggerFactory.getLogger(GenericImage.class);
    protected final int width, height;
    private final Object[] buffer;

    public GenericImage(int width, int height) {
        if (width<0) throw new IllegalArgumentException("width must be >= 0");
        if (height<0) throw new IllegalArgumentException("height must be >= 0");
        this.width = width;
        this.height = height;
        this.buffer = new Object[width * height];
    }

    public static GenericImage<Double> fromArray(int width, int height, double[] values) {
        if (values.length!=width*height) throw new IllegalArgumentException("Array length ("+values.length+") differs from width * height ("+width*height+")");
        GenericImage<Double> res = new GenericImage<>(width, height);
        for (int i = 0; i<values.length; ++i) res.buffer[i] = values[i];
        return res;
    }

    /**
     *
     * @param image source image
     * @param band index of the band to read
     * @return samples of {@param band} as doubles
     */
    public static GenericImage<Double> fromRaster(BufferedImage image, int band) {
        Raster raster = image.getRaster();
        if (band<0 || band>=raster.getNumBands()) throw new IllegalArgumentException("Band "+band+" out of range: image has "+raster.getNumBands()+" bands");
        GenericImage<Double> res = new GenericImage<>(image.getWidth(), image.getHeight());
        GridTraversal.loop(res.width, res.height, (x, y) -> res.set(x, y, raster.getSampleDouble(x, y, band)));
        return res;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public final T get(int x, int y) {
        return (T)buffer[y * width + x];
    }

    public final void set(int x, int y, T value) {
        buffer[y * width + x] = value;
    }

    public GenericImage<T> fill(T value) {
        Arrays.fill(buffer, value);
        return this;
    }

    public boolean isEmpty() {
        return width==0 || height==0;
    }

    public boolean sameDimensions(GenericImage<?> other) {
        return width==other.width && height==other.height;
    }

    public GenericImage<T> duplicate() {
        return map(Function.identity());
    }

    public <U, R> GenericImage<R> combine(GenericImage<U> other, BiFunction<? super T, ? super U, ? extends R> function) {
        if (!sameDimensions(other)) throw new IllegalArgumentException("Combine: images must have same dimensions (this: "+width+"x"+height+" other: "+other.width+"x"+other.height+")");
        GenericImage<R> res = new GenericImage<>(width, height);
        GridTraversal.loop(width, height, (x, y) -> res.set(x, y, function.apply(get(x, y), other.get(x, y))));
        return res;
    }

    public <U> GenericImage<U> map(Function<? super T, ? extends U> function) {
        return mapWithIndex((x, y, e) -> function.apply(e));
    }

    public <U> GenericImage<U> mapWithIndex(IndexedFunction<? super T, ? extends U> function) {
        GenericImage<U> res = new GenericImage<>(width, height);
        GridTraversal.loop(width, height, (x, y) -> res.set(x, y, function.apply(x, y, get(x, y))));
        return res;
    }

    /**
     * Left fold in row order (same order as {@link #foreach(Consumer)})
     * @param init initial value of the accumulator
     * @param function accumulation function
     * @return the accumulated value
     */
    public <B> B foldNatural(B init, BiFunction<B, ? super T, B> function) {
        Object[] acc = new Object[]{init};
        foreach(e -> acc[0] = function.apply((B)acc[0], e));
        return (B)acc[0];
    }

    public T max(Comparator<? super T> comparator) {
        if (isEmpty()) throw new UnsupportedOperationException("Image is empty");
        return foldNatural(get(0, 0), (maxSoFar, e) -> comparator.compare(e, maxSoFar)>0 ? e : maxSoFar);
    }

    public T min(Comparator<? super T> comparator) {
        if (isEmpty()) throw new UnsupportedOperationException("Image is empty");
        return foldNatural(get(0, 0), (minSoFar, e) -> comparator.compare(e, minSoFar)<0 ? e : minSoFar);
    }

    public static <C extends Comparable<? super C>> C max(GenericImage<C> image) {
        return image.max(Comparator.naturalOrder());
    }

    public static <C extends Comparable<? super C>> C min(GenericImage<C> image) {
        return image.min(Comparator.naturalOrder());
    }

    public void foreachWithIndex(IndexedConsumer<? super T> function) {
        GridTraversal.loop(width, height, (x, y) -> function.accept(x, y, get(x, y)));
    }

    public void foreach(Consumer<? super T> function) {
        foreachWithIndex((x, y, e) -> function.accept(e));
    }

    public int count(Predicate<? super T> predicate) {
        return countWithIndex((x, y, e) -> predicate.test(e));
    }

    public int countWithIndex(IndexedPredicate<? super T> predicate) {
        return GridTraversal.count(width, height, (x, y) -> predicate.test(x, y, get(x, y)));
    }

    /**
     *
     * @param rowGenerator creates an array of the requested length
     * @return copy of the buffer: one array per row
     */
    public T[][] to2DArray(IntFunction<T[]> rowGenerator) {
        T[] first = rowGenerator.apply(width);
        T[][] res = (T[][])java.lang.reflect.Array.newInstance(first.getClass(), height);
        for (int y = 0; y<height; ++y) {
            T[] row = y==0 ? first : rowGenerator.apply(width);
            System.arraycopy(buffer, y * width, row, 0, width);
            res[y] = row;
        }
        return res;
    }

    /**
     *
     * @param generator creates an array of the requested length
     * @return copy of the buffer in row order
     */
    public T[] toArray(IntFunction<T[]> generator) {
        T[] res = generator.apply(buffer.length);
        System.arraycopy(buffer, 0, res, 0, buffer.length);
        return res;
    }

    public double[] toDoubleArray(ToDoubleFunction<? super T> toDouble) {
        return IntStream.range(0, buffer.length).mapToDouble(i -> toDouble.applyAsDouble((T)buffer[i])).toArray();
    }

    public Histogram histogram(ToDoubleFunction<? super T> toDouble, int nBins) {
        return HistogramFactory.getHistogram(IntStream.range(0, buffer.length).mapToDouble(i -> toDouble.applyAsDouble((T)buffer[i])), nBins);
    }

    /**
     * Returns a slice of this image from ({@param xUpper}, {@param yUpper}) to ({@param xLower}, {@param yLower}).
     * Both corners must lie within the image. The size of the returned image is (xLower - xUpper) x (yLower - yUpper): column xLower and row yLower are not part of the slice.
     * @return new image, element (i, j) is element (xUpper + i, yUpper + j) of this image
     */
    public GenericImage<T> subregion(int xUpper, int yUpper, int xLower, int yLower) {
        if (!containsX(xUpper) || !containsX(xLower)) throw new IllegalArgumentException("Subregion: x out of bounds: ["+xUpper+"; "+xLower+"] width: "+width);
        if (!containsY(yUpper) || !containsY(yLower)) throw new IllegalArgumentException("Subregion: y out of bounds: ["+yUpper+"; "+yLower+"] height: "+height);
        if (xUpper>xLower || yUpper>yLower) throw new IllegalArgumentException("Subregion: upper corner ("+xUpper+", "+yUpper+") must precede lower corner ("+xLower+", "+yLower+")");
        GenericImage<T> res = new GenericImage<>(xLower - xUpper, yLower - yUpper);
        GridTraversal.loop(res.width, res.height, (x, y) -> res.set(x, y, get(x + xUpper, y + yUpper)));
        return res;
    }

    private boolean containsX(int x) {
        return x>=0 && x<width;
    }

    private boolean containsY(int y) {
        return y>=0 && y<height;
    }

    @Override
    public String toString() {
        return "GenericImage["+width+"x"+height+"]";
    }

    @FunctionalInterface
    public interface IndexedFunction<E, U> {
        U apply(int x, int y, E element);
    }
    @FunctionalInterface
    public interface IndexedConsumer<E> {
        void accept(int x, int y, E element);
    }
    @FunctionalInterface
    public interface IndexedPredicate<E> {
        boolean test(int x, int y, E element);
    }
}
