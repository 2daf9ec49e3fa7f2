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

/**
 * Arithmetic on an abstract numeric type, used by pixel vectors and masks.
 * @author Jean Ollion
 * @param <N> numeric type
 */
public interface Numeric<N> {
    N zero();
    N add(N a, N b);
    N multiply(N a, N b);
    N fromInt(int value);
    double toDouble(N value);
    default int toInt(N value) {
        return (int)toDouble(value);
    }

    Numeric<Double> DOUBLE = new Numeric<Double>() {
        @Override public Double zero() {return 0d;}
        @Override public Double add(Double a, Double b) {return a + b;}
        @Override public Double multiply(Double a, Double b) {return a * b;}
        @Override public Double fromInt(int value) {return (double)value;}
        @Override public double toDouble(Double value) {return value;}
        @Override public String toString() {return "Double";}
    };

    Numeric<Float> FLOAT = new Numeric<Float>() {
        @Override public Float zero() {return 0f;}
        @Override public Float add(Float a, Float b) {return a + b;}
        @Override public Float multiply(Float a, Float b) {return a * b;}
        @Override public Float fromInt(int value) {return (float)value;}
        @Override public double toDouble(Float value) {return value;}
        @Override public String toString() {return "Float";}
    };
}
