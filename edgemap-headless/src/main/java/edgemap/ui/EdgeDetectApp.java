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
package edgemap.ui;

import edgemap.image.GenericImage;
import edgemap.image.io.ImageFiles;
import edgemap.processing.EdgeDetectionParameters;
import edgemap.processing.EdgeDetector;
import edgemap.processing.ImageVisualizer;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: reads an image, computes its edge map and writes it
 * @author Jean Ollion
 */
public class EdgeDetectApp {
    public final static org.slf4j.Logger logger = LoggerFactory.getLogger(EdgeDetectApp.class);
    public static final String USAGE = "[USAGE] EdgeDetectApp [in file] [out file] [parameters.json (optional)]";

    public static void main(String[] args) {
        Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.INFO);
        System.exit(run(args));
    }

    /**
     *
     * @param args input file, output file and optionally a JSON parameter file
     * @return exit status: 0 on success, 1 on usage or processing error
     */
    public static int run(String[] args) {
        if (args.length<2 || args.length>3) {
            System.err.println(USAGE);
            return 1;
        }
        try {
            EdgeDetectionParameters parameters = args.length==3 ? EdgeDetectionParameters.fromJSONFile(Paths.get(args[2])) : new EdgeDetectionParameters();
            process(Paths.get(args[0]), Paths.get(args[1]), parameters);
            return 0;
        } catch (IOException | RuntimeException e) {
            logger.error("Error while computing edge map of: "+args[0], e);
            return 1;
        }
    }

    public static void process(Path input, Path output, EdgeDetectionParameters parameters) throws IOException {
        logger.info("Parameters: {}", parameters);
        long t0 = System.currentTimeMillis();
        BufferedImage image = ImageFiles.read(input);
        GenericImage<Double> edges = new EdgeDetector(parameters).detectEdges(image);
        BufferedImage edgeMap = new ImageVisualizer(parameters).visualize(edges);
        ImageFiles.write(edgeMap, output);
        logger.info("Edge map of {} written to {} in {}ms", input, output, System.currentTimeMillis() - t0);
    }
}
