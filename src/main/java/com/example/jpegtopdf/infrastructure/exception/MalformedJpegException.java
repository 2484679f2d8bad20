package com.example.jpegtopdf.infrastructure.exception;

/**
 * Raised when the marker structure of a JPEG file cannot be split into segments.
 */
public class MalformedJpegException extends InfrastructureException {

    public MalformedJpegException(String message, Throwable cause) {
        super(message, cause);
    }
}
