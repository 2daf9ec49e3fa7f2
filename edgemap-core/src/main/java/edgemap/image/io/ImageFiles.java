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
package edgemap.image.io;

import edgemap.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reading and writing of images through {@link ImageIO}
 * @author Jean Ollion
 */
public class ImageFiles {
    public final static Logger logger = LoggerFactory.getLogger(ImageFiles.class);
    public static final String DEFAULT_FORMAT = "png";

    public static BufferedImage read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) throw new IOException("File not found: "+path);
        BufferedImage res = ImageIO.read(path.toFile());
        if (res == null) throw new IOException("Unsupported image format: "+path);
        logger.debug("read image: {} ({}x{}, {} bands)", path, res.getWidth(), res.getHeight(), res.getRaster().getNumBands());
        return res;
    }

    /**
     * Writes {@param image} in the format given by the extension of {@param path}, or in png if there is no extension
     * @throws IOException if no writer is available for the format or if writing fails
     */
    public static void write(BufferedImage image, Path path) throws IOException {
        String format = getExtension(path);
        if (format == null) {
            logger.warn("No extension found for output file: {}, will use {}", path, DEFAULT_FORMAT);
            format = DEFAULT_FORMAT;
        }
        if (!ImageIO.write(image, format, path.toFile())) throw new IOException("No image writer for format: "+format);
        logger.debug("wrote image: {}", path);
    }

    /**
     *
     * @return lower-case extension of the file name of {@param path}, null if there is none
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return null;
        String ext = Utils.getExtension(fileName.toString());
        return ext == null ? null : ext.toLowerCase();
    }
}
