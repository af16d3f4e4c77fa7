package org.transparentclassroom.client.rest.exception;

import lombok.Getter;

import java.io.IOException;

/**
 * The API answered with a non-successful HTTP status.
 */
@Getter
public class ApiRequestException extends IOException {

    /** HTTP status code of the response */
    private final int statusCode;

    public ApiRequestException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

}
