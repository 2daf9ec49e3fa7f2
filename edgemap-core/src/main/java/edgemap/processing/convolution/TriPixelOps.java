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
 * Samples red, green and blue channels of three band images
 * @author Jean Ollion
 */
public class TriPixelOps<N> extends PixelVectorOps<TriPixel<N>, N> {
    public static final TriPixelOps<Double> DOUBLE = new TriPixelOps<>(Numeric.DOUBLE);
    private final TriPixel<N> unit;

    public TriPixelOps(Numeric<N> numeric) {
        super(numeric);
        this.unit = new TriPixel<>(numeric.zero(), numeric.zero(), numeric.zero(), numeric);
    }

    @Override
    public TriPixel<N> unit() {
        return unit;
    }

    @Override
    public TriPixel<N> fromImage(int x, int y, BufferedImage image) {
        if (image.getRaster().getNumBands()!=3) throw new IllegalArgumentException("Tri pixel sampling: image has "+image.getRaster().getNumBands()+" bands, expected 3");
        return TriPixel.fromIntRepr(image.getRGB(x, y), numeric);
    }
}
