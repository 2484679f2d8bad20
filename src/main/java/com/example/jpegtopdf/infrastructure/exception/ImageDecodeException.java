package com.example.jpegtopdf.infrastructure.exception;

/**
 * Infrastructure-layer exception raised when a JPEG frame header cannot be decoded.
 */
public class ImageDecodeException extends InfrastructureException {

    public ImageDecodeException(String message) {
        super(message);
    }

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level metadata-extractor exception
	 */
    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
