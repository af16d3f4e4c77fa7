package org.transparentclassroom.client.rest.parser;

import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses JSON format HTTP responses with json-path.
 *
 * <p>Objects materialize as {@code net.minidev.json.JSONObject} (a {@code Map}) and arrays
 * as {@code net.minidev.json.JSONArray} (a {@code List}).</p>
 */
public class JsonResponseParser implements ResponseParser {

    @Override
    public Object parse(String httpResponse) throws ParseException {
        if (StringUtils.isBlank(httpResponse)) {
            throw new ParseException("Empty JSON response");
        }
        try {
            return JsonPath.parse(httpResponse).json();
        } catch (InvalidJsonException e) {
            throw new ParseException("Failed to parse JSON response", e);
        }
    }
}
