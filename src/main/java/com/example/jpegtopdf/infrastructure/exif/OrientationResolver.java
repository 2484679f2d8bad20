package com.example.jpegtopdf.infrastructure.exif;

import com.drew.lang.ByteArrayReader;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifReader;
import com.example.jpegtopdf.domain.model.Orientation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the orientation tag out of a raw EXIF block with metadata-extractor.
 * Every missing or unusable value falls back to {@link Orientation#DEFAULT_CODE}, so resolving never fails.
 * Out-of-range codes are returned as-is.
 */
@Component
public class OrientationResolver {

    private static final Logger log = LoggerFactory.getLogger(OrientationResolver.class);

    /**
     * @param exif TIFF-structured EXIF block or {@code null}
     * @return orientation code
     */
    public int resolve(byte[] exif) {
        if (exif == null || exif.length == 0) {
            return Orientation.DEFAULT_CODE;
        }

        Metadata metadata = new Metadata();
        new ExifReader().extract(new ByteArrayReader(exif), metadata);
        ExifIFD0Directory directory = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        if (directory == null) {
            log.debug("EXIF block has no IFD0 directory, using default orientation");
            return Orientation.DEFAULT_CODE;
        }
        if (directory.hasErrors()) {
            log.debug("EXIF block could not be parsed cleanly: {}", directory.getErrors());
        }
        if (!directory.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
            return Orientation.DEFAULT_CODE;
        }
        return toCode(directory.getObject(ExifIFD0Directory.TAG_ORIENTATION));
    }

    private int toCode(Object value) {
        if (value instanceof Integer number && number >= 0) {
            return number;
        }
        if (value instanceof Long number && number >= 0) {
            return (int) Math.min(number, Integer.MAX_VALUE);
        }
        if (value instanceof int[] numbers && numbers.length > 0 && numbers[0] >= 0) {
            return numbers[0];
        }
        log.debug("Orientation tag holds a non-integer value {}, using default orientation", value);
        return Orientation.DEFAULT_CODE;
    }
}
