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

import edgemap.processing.neighborhood.SquareKernel;
import edgemap.utils.JSONUtils;
import org.json.simple.parser.ParseException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class EdgeDetectionParametersTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDefaults() {
        EdgeDetectionParameters p = new EdgeDetectionParameters();
        assertEquals("sigma", 1, p.getSigma(), 0);
        assertEquals("kernel size", 5, p.getKernelSize());
        assertSame("kernel", SquareKernel.DEFAULT, p.getKernel());
        assertEquals("saturation", 0, p.getSaturation(), 0);
        assertFalse("invert", p.isInvert());
        assertFalse("parallel", p.isParallel());
    }

    @Test
    public void testJSON() throws ParseException {
        EdgeDetectionParameters p = new EdgeDetectionParameters().setSigma(2.5).setKernelSize(7).setSaturation(0.05).setInvert(true).setParallel(true);
        EdgeDetectionParameters p2 = new EdgeDetectionParameters();
        p2.initFromJSONEntry(JSONUtils.parse(p.toJSONEntry().toJSONString()));
        assertEquals("sigma", 2.5, p2.getSigma(), 0);
        assertEquals("kernel size", 7, p2.getKernelSize());
        assertEquals("kernel", new SquareKernel(7), p2.getKernel());
        assertEquals("saturation", 0.05, p2.getSaturation(), 0);
        assertTrue("invert", p2.isInvert());
        assertTrue("parallel", p2.isParallel());
    }

    @Test
    public void testPartialJSON() throws ParseException {
        EdgeDetectionParameters p = new EdgeDetectionParameters();
        p.initFromJSONEntry(JSONUtils.parse("{\"sigma\": 3, \"unknown\": \"ignored\"}"));
        assertEquals("sigma", 3, p.getSigma(), 0);
        assertEquals("kernel size", 5, p.getKernelSize());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidSigma() throws ParseException {
        new EdgeDetectionParameters().initFromJSONEntry(JSONUtils.parse("{\"sigma\": -1}"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongType() throws ParseException {
        new EdgeDetectionParameters().initFromJSONEntry(JSONUtils.parse("{\"invert\": \"yes\"}"));
    }

    @Test
    public void testFromFile() throws IOException {
        Path file = folder.newFile("parameters.json").toPath();
        Files.write(file, "{\"kernelSize\": 3, \"invert\": true}".getBytes(StandardCharsets.UTF_8));
        EdgeDetectionParameters p = EdgeDetectionParameters.fromJSONFile(file);
        assertEquals("kernel size", 3, p.getKernelSize());
        assertTrue("invert", p.isInvert());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidFile() throws IOException {
        Path file = folder.newFile("parameters.json").toPath();
        Files.write(file, "{\"kernelSize\": ".getBytes(StandardCharsets.UTF_8));
        EdgeDetectionParameters.fromJSONFile(file);
    }

    @Test(expected = IOException.class)
    public void testMissingFile() throws IOException {
        EdgeDetectionParameters.fromJSONFile(folder.getRoot().toPath().resolve("missing.json"));
    }
}
