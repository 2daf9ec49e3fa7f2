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
package edgemap.utils;

import java.util.stream.Stream;

/**
 *
 * @author Jean Ollion
 */
public class Utils {
    public static <T> Stream<T> parallel(Stream<T> stream, boolean parallel) {
        if (parallel) return stream.parallel();
        else return stream.sequential();
    }
    public static String getExtension(String fileName) {
        int i = fileName.lastIndexOf('.');
        if (i<=0 || i==fileName.length()-1) return null;
        String ext = fileName.substring(i+1);
        return ext.matches("\\w+") ? ext : null;
    }
}
