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

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 *
 * @author Jean Ollion
 */
public class JSONUtils {
    public final static Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static JSONObject parse(String s) throws ParseException {
        Object res= new JSONParser().parse(s);
        if (!(res instanceof JSONObject)) throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, res);
        return (JSONObject)res;
    }
    public static JSONObject parse(Path file) throws IOException, ParseException {
        return parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }
    public static double getDouble(JSONObject o, String key, double defaultValue) {
        Object v = o.get(key);
        if (v==null) return defaultValue;
        if (!(v instanceof Number)) throw new IllegalArgumentException("Entry "+key+" should be a number, found: "+v);
        return ((Number)v).doubleValue();
    }
    public static int getInt(JSONObject o, String key, int defaultValue) {
        Object v = o.get(key);
        if (v==null) return defaultValue;
        if (!(v instanceof Number)) throw new IllegalArgumentException("Entry "+key+" should be a number, found: "+v);
        return ((Number)v).intValue();
    }
    public static boolean getBoolean(JSONObject o, String key, boolean defaultValue) {
        Object v = o.get(key);
        if (v==null) return defaultValue;
        if (!(v instanceof Boolean)) throw new IllegalArgumentException("Entry "+key+" should be a boolean, found: "+v);
        return (Boolean)v;
    }
}
