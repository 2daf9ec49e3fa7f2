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

import edgemap.image.GenericImage;

import java.awt.image.BufferedImage;

/**
 * Writes single channel values to a scalar field of the size of the source
 * @author Jean Ollion
 */
public class GradientFieldWriter implements CanvasWriter<SinglePixel<Double>, GenericImage<Double>> {
    @Override
    public GenericImage<Double> allocate(BufferedImage source) {
        return new GenericImage<>(source.getWidth(), source.getHeight());
    }

    @Override
    public void writeBack(int x, int y, SinglePixel<Double> value, GenericImage<Double> canvas) {
        canvas.set(x, y, value.value);
    }

    @Override
    public int widthOf(GenericImage<Double> canvas) {
        return canvas.getWidth();
    }

    @Override
    public int heightOf(GenericImage<Double> canvas) {
        return canvas.getHeight();
    }
}
