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
package edgemap.processing;

import edgemap.image.GenericImage;
import edgemap.image.HistogramFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Renders a scalar field as an 8-bit gray image
 * @author Jean Ollion
 */
public class ImageVisualizer {
    public final static Logger logger = LoggerFactory.getLogger(ImageVisualizer.class);
    final double saturation;
    final boolean invert;

    public ImageVisualizer() {
        this(0, false);
    }

    public ImageVisualizer(EdgeDetectionParameters parameters) {
        this(parameters.getSaturation(), parameters.isInvert());
    }

    /**
     *
     * @param saturation fraction of the highest values that are mapped to 255, in [0;1). 0 maps the maximum to 255
     * @param invert if true, high values are dark
     */
    public ImageVisualizer(double saturation, boolean invert) {
        if (!(saturation>=0 && saturation<1)) throw new IllegalArgumentException("saturation must be in [0;1)");
        this.saturation = saturation;
        this.invert = invert;
    }

    /**
     * Linear mapping of [min; upper] to [0; 255]. Values above upper are mapped to 255. A constant field is mapped to 0 (255 when inverted)
     * @param field values to render
     * @return {@link BufferedImage#TYPE_BYTE_GRAY} image of the size of {@param field}
     * @throws UnsupportedOperationException if {@param field} is empty
     */
    public BufferedImage visualize(GenericImage<Double> field) {
        double min = GenericImage.min(field);
        double upper = getUpperBound(field, min);
        double scale = upper > min ? 255d / (upper - min) : 0;
        logger.debug("visualize {}: range [{}; {}]", field, min, upper);
        BufferedImage res = new BufferedImage(field.getWidth(), field.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = res.getRaster();
        field.foreachWithIndex((x, y, v) -> {
            int gray = Math.max(0, Math.min(255, (int)Math.round((v - min) * scale)));
            raster.setSample(x, y, 0, invert ? 255 - gray : gray);
        });
        return res;
    }

    double getUpperBound(GenericImage<Double> field, double min) {
        if (saturation == 0) return GenericImage.max(field);
        double upper = field.histogram(Double::doubleValue, HistogramFactory.DEFAULT_N_BINS).getQuantile(1 - saturation);
        return Math.max(min, upper);
    }
}
