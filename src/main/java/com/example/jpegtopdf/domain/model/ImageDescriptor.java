package com.example.jpegtopdf.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Domain DTO describing one decoded JPEG frame header together with the bytes that will be embedded.
 * Produced once per page and discarded after the page has been composed. Byte arrays are copied on the
 * way in and on the way out.
 *
 * @param width       stored pixel width
 * @param height      stored pixel height
 * @param colorFormat color layout of the frame
 * @param payload     compressed bytes to embed, possibly with the EXIF segment removed
 * @param exif        raw EXIF block or {@code null} when the image carries none
 */
public record ImageDescriptor(
        int width,
        int height,
        ColorFormat colorFormat,
        byte[] payload,
        byte[] exif
) {

    public ImageDescriptor {
        Objects.requireNonNull(colorFormat, "colorFormat");
        payload = Objects.requireNonNull(payload, "payload").clone();
        exif = exif != null ? exif.clone() : null;
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public byte[] exif() {
        return exif != null ? exif.clone() : null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        ImageDescriptor that = (ImageDescriptor) other;
        return width == that.width
                && height == that.height
                && colorFormat == that.colorFormat
                && Arrays.equals(payload, that.payload)
                && Arrays.equals(exif, that.exif);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(width, height, colorFormat);
        result = 31 * result + Arrays.hashCode(payload);
        return 31 * result + Arrays.hashCode(exif);
    }

    @Override
    public String toString() {
        return "ImageDescriptor[width=" + width + ", height=" + height + ", colorFormat=" + colorFormat
                + ", payload=" + payload.length + " bytes, exif=" + (exif != null ? exif.length + " bytes" : "none") + "]";
    }
}
