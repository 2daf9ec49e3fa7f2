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
 * Three channel (red, green, blue) pixel
 * @author Jean Ollion
 * @param <N> numeric type
 */
public final class TriPixel<N> extends PixelVector<TriPixel<N>, N> {
    public final N r, g, b;

    public TriPixel(N r, N g, N b, Numeric<N> numeric) {
        super(numeric);
        this.r = r;
        this.g = g;
        this.b = b;
    }

    /**
     *
     * @param rgb packed pixel as returned by {@link java.awt.image.BufferedImage#getRGB(int, int)}. Alpha is ignored
     * @return pixel with channel values in [0;255]
     */
    public static <N> TriPixel<N> fromIntRepr(int rgb, Numeric<N> numeric) {
        return new TriPixel<>(numeric.fromInt((rgb >> 16) & 0xff), numeric.fromInt((rgb >> 8) & 0xff), numeric.fromInt(rgb & 0xff), numeric);
    }

    /**
     *
     * @return opaque ARGB packed value. Each channel is truncated to an integer and clamped to [0;255]
     */
    public int toIntRepr() {
        return toByte(b) | (toByte(g) << 8) | (toByte(r) << 16) | (0xff << 24);
    }

    private int toByte(N channel) {
        return Math.max(0, Math.min(255, numeric.toInt(channel)));
    }

    @Override
    public TriPixel<N> scale(N factor) {
        return new TriPixel<>(numeric.multiply(r, factor), numeric.multiply(g, factor), numeric.multiply(b, factor), numeric);
    }

    @Override
    public TriPixel<N> add(TriPixel<N> other) {
        return new TriPixel<>(numeric.add(r, other.r), numeric.add(g, other.g), numeric.add(b, other.b), numeric);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TriPixel)) return false;
        TriPixel<?> other = (TriPixel<?>) o;
        return Objects.equals(r, other.r) && Objects.equals(g, other.g) && Objects.equals(b, other.b);
    }

    @Override
    public int hashCode() {
        return Objects.hash(r, g, b);
    }

    @Override
    public String toString() {
        return "TriPixel("+r+", "+g+", "+b+")";
    }
}
