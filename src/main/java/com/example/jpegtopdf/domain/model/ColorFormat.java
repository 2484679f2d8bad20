package com.example.jpegtopdf.domain.model;

import java.util.Optional;

/**
 * Color layout of a baseline or progressive JPEG frame, derived from its component count.
 */
public enum ColorFormat {
    GRAYSCALE(1),
    RGB(3),
    CMYK(4);

    private final int components;

    ColorFormat(int components) {
        this.components = components;
    }

    public int components() {
        return components;
    }

    /**
     * Maps the component count of a JPEG frame header onto a color format.
     *
     * @param components number of components declared by the SOF segment
     * @return matching format or empty when the count is not supported
     */
    public static Optional<ColorFormat> fromComponentCount(int components) {
        for (ColorFormat format : values()) {
            if (format.components == components) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
