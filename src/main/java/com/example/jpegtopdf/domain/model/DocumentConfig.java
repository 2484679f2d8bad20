package com.example.jpegtopdf.domain.model;

import com.example.jpegtopdf.domain.exception.InvalidDpiException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of everything needed to build one document.
 * The list order is the page order.
 *
 * @param images           raw JPEG buffers in page order
 * @param dpi              pixels per inch used to size pages
 * @param stripExif        whether EXIF segments are removed from the embedded payloads
 * @param title            document title, empty when unset
 * @param creationDate     creation timestamp written to the document
 * @param modificationDate modification timestamp written to the document
 */
public record DocumentConfig(
        List<byte[]> images,
        double dpi,
        boolean stripExif,
        String title,
        Instant creationDate,
        Instant modificationDate
) {

    public static final double DEFAULT_DPI = 300.0;

    public DocumentConfig {
        if (Double.isNaN(dpi) || Double.isInfinite(dpi) || dpi <= 0) {
            throw new InvalidDpiException(dpi);
        }
        images = List.copyOf(images);
        title = title != null ? title : "";
        Objects.requireNonNull(creationDate, "creationDate");
        Objects.requireNonNull(modificationDate, "modificationDate");
    }
}
