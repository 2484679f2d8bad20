package com.example.jpegtopdf.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals an uploaded image could not be read into memory.
 */
public class ImageUploadException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from the servlet layer.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level IO exception
	 */
    public ImageUploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
