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
 * Samples band 0 of single band images
 * @author Jean Ollion
 */
public class SinglePixelOps<N> extends PixelVectorOps<SinglePixel<N>, N> {
    public static final SinglePixelOps<Double> DOUBLE = new SinglePixelOps<>(Numeric.DOUBLE);
    private final SinglePixel<N> unit;

    public SinglePixelOps(Numeric<N> numeric) {
        super(numeric);
        this.unit = new SinglePixel<>(numeric.zero(), numeric);
    }

    @Override
    public SinglePixel<N> unit() {
        return unit;
    }

    @Override
    public SinglePixel<N> fromImage(int x, int y, BufferedImage image) {
        if (image.getRaster().getNumBands()!=1) throw new IllegalArgumentException("Single pixel sampling: image has "+image.getRaster().getNumBands()+" bands, expected 1");
        return new SinglePixel<>(numeric.fromInt(image.getRaster().getSample(x, y, 0)), numeric);
    }
}
