package com.example.jpegtopdf.application.exception;

import com.example.jpegtopdf.domain.model.FailureCause;

/**
 * Signals that a single image could not be turned into a page.
 * The document builder adds the image index before the failure leaves the application layer.
 */
public class PageCompositionException extends ApplicationException {

    private final FailureCause failure;

	/**
	 * @param failure category of the failed step
	 * @param cause   exception raised by the collaborator
	 */
    public PageCompositionException(FailureCause failure, Throwable cause) {
        super(describe(failure, cause), cause);
        this.failure = failure;
    }

    public FailureCause failure() {
        return failure;
    }

    static String describe(FailureCause failure, Throwable cause) {
        if (cause == null || cause.getMessage() == null) {
            return failure.description();
        }
        return failure.description() + ": " + cause.getMessage();
    }
}
