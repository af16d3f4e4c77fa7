package org.transparentclassroom.client.freemarker.exception;

/**
 * A template compiled but could not be rendered, typically because a route parameter
 * it references was not supplied.
 */
public class FreeMarkerFormatException extends FreeMarkerException {

    public FreeMarkerFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public FreeMarkerFormatException(String message) {
        super(message);
    }
}
