package org.transparentclassroom.client.rest.parser;

/**
 * Interface for turning HTTP response bodies into materialized JSON values.
 *
 * <p>Implementations produce the plain value tree the mapping layer consumes:
 * {@code Map} for objects, {@code List} for arrays, and {@code String}, {@code Number},
 * {@code Boolean} or {@code null} for scalars.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ResponseParser parser = new JsonResponseParser();
 * Object children = parser.parse(httpResponse);
 * }</pre>
 */
public interface ResponseParser {

    /**
     * Parses a response body.
     *
     * @param httpResponse raw HTTP response body as string
     * @return materialized value tree
     * @throws ParseException if parsing fails
     */
    Object parse(String httpResponse) throws ParseException;

    /**
     * Exception thrown when response parsing fails.
     */
    class ParseException extends Exception {
        public ParseException(String message) {
            super(message);
        }

        public ParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
