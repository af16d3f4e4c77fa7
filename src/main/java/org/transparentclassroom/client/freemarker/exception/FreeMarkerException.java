package org.transparentclassroom.client.freemarker.exception;

/**
 * Failure creating or evaluating a FreeMarker template, such as a route URL template
 * that does not parse.
 */
public class FreeMarkerException extends RuntimeException {
    /** Human-readable error message for the exception. */
    private String message;

    public FreeMarkerException(String message, Throwable cause) {
        super(message, cause);
        this.message = message;
    }

    public FreeMarkerException(String message) {
        super(message);
        this.message = message;
    }

    /**
     * Returns the custom error message if set; otherwise, standard string representation.
     */
    @Override
    public String toString() {
        return message != null ? message : super.toString();
    }
}
