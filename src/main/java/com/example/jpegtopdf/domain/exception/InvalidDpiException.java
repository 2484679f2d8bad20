package com.example.jpegtopdf.domain.exception;

/**
 * Raised when the requested resolution cannot be used to size pages.
 */
public class InvalidDpiException extends DomainException {

	/**
	 * @param dpi rejected value
	 */
    public InvalidDpiException(double dpi) {
        super("DPI must be a positive number: " + dpi);
    }
}
