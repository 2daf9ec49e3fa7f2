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
import edgemap.utils.JSONSerializable;
import edgemap.utils.JSONUtils;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parameters of the edge map pipeline. Stored as a JSON object; missing keys keep their default value and unknown keys are ignored
 * @author Jean Ollion
 */
public class EdgeDetectionParameters implements JSONSerializable {
    public static final String SIGMA = "sigma", KERNEL_SIZE = "kernelSize", SATURATION = "saturation", INVERT = "invert", PARALLEL = "parallel";
    double sigma = 1.0;
    int kernelSize = SquareKernel.DEFAULT.getSide();
    double saturation = 0;
    boolean invert = false;
    boolean parallel = false;

    public double getSigma() {
        return sigma;
    }

    public EdgeDetectionParameters setSigma(double sigma) {
        if (!(sigma>0)) throw new IllegalArgumentException("sigma must be > 0");
        this.sigma = sigma;
        return this;
    }

    public int getKernelSize() {
        return kernelSize;
    }

    public EdgeDetectionParameters setKernelSize(int kernelSize) {
        if (kernelSize<=0) throw new IllegalArgumentException("kernel size must be > 0");
        this.kernelSize = kernelSize;
        return this;
    }

    public SquareKernel getKernel() {
        return kernelSize == SquareKernel.DEFAULT.getSide() ? SquareKernel.DEFAULT : new SquareKernel(kernelSize);
    }

    public double getSaturation() {
        return saturation;
    }

    /**
     *
     * @param saturation fraction of the brightest values mapped to 255 by {@link ImageVisualizer}, in [0;1)
     * @return this instance
     */
    public EdgeDetectionParameters setSaturation(double saturation) {
        if (!(saturation>=0 && saturation<1)) throw new IllegalArgumentException("saturation must be in [0;1)");
        this.saturation = saturation;
        return this;
    }

    public boolean isInvert() {
        return invert;
    }

    public EdgeDetectionParameters setInvert(boolean invert) {
        this.invert = invert;
        return this;
    }

    public boolean isParallel() {
        return parallel;
    }

    public EdgeDetectionParameters setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    public static EdgeDetectionParameters fromJSONFile(Path file) throws IOException {
        JSONObject json;
        try {
            json = JSONUtils.parse(file);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid parameter file: "+file, e);
        }
        EdgeDetectionParameters res = new EdgeDetectionParameters();
        res.initFromJSONEntry(json);
        return res;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put(SIGMA, sigma);
        res.put(KERNEL_SIZE, kernelSize);
        res.put(SATURATION, saturation);
        res.put(INVERT, invert);
        res.put(PARALLEL, parallel);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof JSONObject)) throw new IllegalArgumentException("Parameters should be a JSON object");
        JSONObject json = (JSONObject)jsonEntry;
        setSigma(JSONUtils.getDouble(json, SIGMA, sigma));
        setKernelSize(JSONUtils.getInt(json, KERNEL_SIZE, kernelSize));
        setSaturation(JSONUtils.getDouble(json, SATURATION, saturation));
        setInvert(JSONUtils.getBoolean(json, INVERT, invert));
        setParallel(JSONUtils.getBoolean(json, PARALLEL, parallel));
    }

    @Override
    public String toString() {
        return toJSONEntry().toJSONString();
    }
}
