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
 * Writes tri-channel pixels to an opaque {@link BufferedImage#TYPE_INT_ARGB} image of the size of the source
 * @author Jean Ollion
 */
public class ArgbImageWriter implements CanvasWriter<TriPixel<Double>, BufferedImage> {
    @Override
    public BufferedImage allocate(BufferedImage source) {
        return new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
    }

    @Override
    public void writeBack(int x, int y, TriPixel<Double> value, BufferedImage canvas) {
        canvas.setRGB(x, y, value.toIntRepr());
    }

    @Override
    public int widthOf(BufferedImage canvas) {
        return canvas.getWidth();
    }

    @Override
    public int heightOf(BufferedImage canvas) {
        return canvas.getHeight();
    }
}
