package com.example.jpegtopdf.domain.model;

/**
 * Reasons a conversion can stop.
 */
public enum FailureCause {
    IMAGE_INFO_DECODE("failed to read image info"),
    MISSING_IMAGE_INFO("unexpectedly failed to read image info"),
    IMAGE_SECTIONS("failed to read image sections"),
    PDF_WRITE("failed to write PDF");

    private final String description;

    FailureCause(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
