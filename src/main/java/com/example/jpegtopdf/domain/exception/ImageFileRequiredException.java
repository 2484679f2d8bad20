package com.example.jpegtopdf.domain.exception;

/**
 * Raised when a conversion request arrives without any JPEG file attached.
 */
public class ImageFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public ImageFileRequiredException() {
        super("Please choose at least one JPEG image to convert.");
    }
}
