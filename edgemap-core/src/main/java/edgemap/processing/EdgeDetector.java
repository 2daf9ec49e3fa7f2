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
import edgemap.image.GridTraversal;
import edgemap.processing.convolution.GrayscaleGaussConvolution;
import edgemap.processing.convolution.RGBGaussConvolution;
import edgemap.processing.convolution.SobelOperator;
import edgemap.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Edge map of an image: gaussian smoothing, then Sobel derivatives along X and Y, combined into the gradient magnitude
 * @author Jean Ollion
 */
public class EdgeDetector {
    public final static Logger logger = LoggerFactory.getLogger(EdgeDetector.class);
    final EdgeDetectionParameters parameters;

    public EdgeDetector() {
        this(new EdgeDetectionParameters());
    }

    public EdgeDetector(EdgeDetectionParameters parameters) {
        this.parameters = parameters;
    }

    public EdgeDetectionParameters getParameters() {
        return parameters;
    }

    /**
     *
     * @param image source image, not modified
     * @return gradient magnitude sqrt(gx^2 + gy^2), same size as {@param image}
     */
    public GenericImage<Double> detectEdges(BufferedImage image) {
        return computeGradients(image).getMagnitude();
    }

    public Gradients computeGradients(BufferedImage image) {
        long t0 = System.currentTimeMillis();
        BufferedImage smoothed = smooth(image);
        long t1 = System.currentTimeMillis();
        List<GenericImage<Double>> derivatives = Utils.parallel(Stream.of(SobelOperator.X, SobelOperator.Y), parameters.isParallel())
                .map(op -> op.convolve(smoothed, parameters.isParallel()))
                .collect(Collectors.toList());
        long t2 = System.currentTimeMillis();
        logger.debug("gradients of {}x{} image: smoothing: {}ms, derivatives: {}ms", image.getWidth(), image.getHeight(), t1 - t0, t2 - t1);
        return new Gradients(derivatives.get(0), derivatives.get(1));
    }

    /**
     *
     * @param image any image
     * @return single band smoothed image. Gray images keep their sample depth. Other images are smoothed in color and then converted to gray
     */
    public BufferedImage smooth(BufferedImage image) {
        if (isGray(image)) return new GrayscaleGaussConvolution(parameters.getSigma(), parameters.getKernel()).convolve(image, parameters.isParallel());
        if (!isRGB(image)) {
            logger.debug("image of type {} with {} bands converted to RGB", image.getType(), image.getRaster().getNumBands());
            image = toRGB(image);
        }
        BufferedImage smoothed = new RGBGaussConvolution(parameters.getSigma(), parameters.getKernel()).convolve(image, parameters.isParallel());
        return toGray(smoothed);
    }

    /**
     *
     * @return true if samples of {@param image} are intensities: 8 or 16 bit gray without palette
     */
    public static boolean isGray(BufferedImage image) {
        if (image.getColorModel() instanceof IndexColorModel) return false;
        return image.getType() == BufferedImage.TYPE_BYTE_GRAY || image.getType() == BufferedImage.TYPE_USHORT_GRAY;
    }

    /**
     *
     * @return true if {@param image} has exactly the three color bands and no palette
     */
    public static boolean isRGB(BufferedImage image) {
        return !(image.getColorModel() instanceof IndexColorModel) && image.getRaster().getNumBands() == 3;
    }

    public static BufferedImage toRGB(BufferedImage image) {
        BufferedImage res = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = res.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return res;
    }

    /**
     * Luminance conversion: 0.299 r + 0.587 g + 0.114 b, rounded
     * @param image image readable by {@link BufferedImage#getRGB(int, int)}
     * @return {@link BufferedImage#TYPE_BYTE_GRAY} image
     */
    public static BufferedImage toGray(BufferedImage image) {
        BufferedImage res = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        GridTraversal.loop(image.getWidth(), image.getHeight(), (x, y) -> {
            int rgb = image.getRGB(x, y);
            double lum = 0.299 * ((rgb >> 16) & 0xff) + 0.587 * ((rgb >> 8) & 0xff) + 0.114 * (rgb & 0xff);
            res.getRaster().setSample(x, y, 0, Math.max(0, Math.min(255, (int)Math.round(lum))));
        });
        return res;
    }

    /**
     * Derivatives of an image along X and Y
     */
    public static class Gradients {
        final GenericImage<Double> gx, gy;
        GenericImage<Double> magnitude, orientation;

        public Gradients(GenericImage<Double> gx, GenericImage<Double> gy) {
            if (!gx.sameDimensions(gy)) throw new IllegalArgumentException("Gradients must have same dimensions");
            this.gx = gx;
            this.gy = gy;
        }

        public GenericImage<Double> getGx() {
            return gx;
        }

        public GenericImage<Double> getGy() {
            return gy;
        }

        public synchronized GenericImage<Double> getMagnitude() {
            if (magnitude == null) magnitude = gx.combine(gy, (dx, dy) -> Math.sqrt(dx * dx + dy * dy));
            return magnitude;
        }

        /**
         *
         * @return atan2(gy, gx) in radians, in [-pi; pi]
         */
        public synchronized GenericImage<Double> getOrientation() {
            if (orientation == null) orientation = gx.combine(gy, (dx, dy) -> Math.atan2(dy, dx));
            return orientation;
        }
    }
}
