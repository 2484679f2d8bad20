package com.example.jpegtopdf.application.exception;

import com.example.jpegtopdf.domain.model.FailureCause;

/**
 * Raised when building a PDF from JPEGs fails.
 * Carries the zero-based index of the offending image. Failures while writing the finished document
 * use index {@code 0} since no single image is to blame at that point; see {@link #documentWriteFailure(Throwable)}.
 */
public class JpegConversionException extends ApplicationException {

    private final int index;
    private final FailureCause failure;

	/**
	 * @param index   zero-based position of the image that failed
	 * @param failure category of the failed step
	 * @param cause   exception raised by the collaborator
	 */
    public JpegConversionException(int index, FailureCause failure, Throwable cause) {
        this("error with JPEG index " + index + ": " + PageCompositionException.describe(failure, cause),
                index, failure, cause);
    }

    private JpegConversionException(String message, int index, FailureCause failure, Throwable cause) {
        super(message, cause);
        this.index = index;
        this.failure = failure;
    }

    /**
     * Failure to serialize the finished document or to copy it to the caller's stream.
     *
     * @param cause exception raised while writing
     * @return exception with index {@code 0} and a message that names no image
     */
    public static JpegConversionException documentWriteFailure(Throwable cause) {
        return new JpegConversionException(PageCompositionException.describe(FailureCause.PDF_WRITE, cause),
                0, FailureCause.PDF_WRITE, cause);
    }

    public int index() {
        return index;
    }

    public FailureCause failure() {
        return failure;
    }
}
