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
 * Writes single channel pixels to a gray image of the size of the source. 16-bit gray sources give a {@link BufferedImage#TYPE_USHORT_GRAY} image, other sources a {@link BufferedImage#TYPE_BYTE_GRAY} image.
 * Values are truncated and clamped to the sample range of the result
 * @author Jean Ollion
 */
public class GrayImageWriter implements CanvasWriter<SinglePixel<Double>, BufferedImage> {
    @Override
    public BufferedImage allocate(BufferedImage source) {
        int type = source.getType() == BufferedImage.TYPE_USHORT_GRAY ? BufferedImage.TYPE_USHORT_GRAY : BufferedImage.TYPE_BYTE_GRAY;
        return new BufferedImage(source.getWidth(), source.getHeight(), type);
    }

    @Override
    public void writeBack(int x, int y, SinglePixel<Double> value, BufferedImage canvas) {
        int maxValue = (1 << canvas.getSampleModel().getSampleSize(0)) - 1;
        canvas.getRaster().setSample(x, y, 0, Math.max(0, Math.min(maxValue, value.value.intValue())));
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
