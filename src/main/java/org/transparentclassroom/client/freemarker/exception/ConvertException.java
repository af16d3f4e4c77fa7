package org.transparentclassroom.client.freemarker.exception;

/**
 * A Java value could not be wrapped as a FreeMarker {@code TemplateModel}.
 */
public class ConvertException extends RuntimeException {

    public ConvertException(Throwable cause) {
        super(cause);
    }

    /**
     * Static factory for consistent exception wrapping.
     *
     * @param cause The root cause.
     * @return      New instance of ConvertException wrapping the cause.
     */
    public static ConvertException buildConvertException(Throwable cause) {
        return new ConvertException(cause);
    }

}
