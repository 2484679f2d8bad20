package com.example.jpegtopdf.domain.model;

/**
 * Domain value object that turns an EXIF orientation code and the stored pixel dimensions into the
 * geometry needed to show the image upright without touching its pixels.
 * <p>
 * EXIF orientation records how the camera was held, not how the pixels are stored. Instead of
 * transcoding, the page composition applies a mirror, a rotation and a translation to the untouched
 * image. Codes outside {@code 1..8} behave like {@link #DEFAULT_CODE}.
 * <p>
 * The derived offsets are in pixels. A value of {@code 0} means no offset, {@code 0.0} degrees means
 * no rotation and a mirror factor of {@code 1.0} means no mirroring.
 *
 * @param code   EXIF orientation code as read from the image
 * @param width  stored pixel width
 * @param height stored pixel height
 */
public record Orientation(int code, int width, int height) {

    /**
     * Orientation code used whenever an image carries no usable orientation tag.
     */
    public static final int DEFAULT_CODE = 1;

    /**
     * @return width of the upright image, swapped with the height for codes 5 to 8
     */
    public int displayWidth() {
        return swapsAxes() ? height : width;
    }

    /**
     * @return height of the upright image, swapped with the width for codes 5 to 8
     */
    public int displayHeight() {
        return swapsAxes() ? width : height;
    }

    /**
     * @return horizontal offset applied after rotation, in pixels
     */
    public int translateX() {
        return switch (code) {
            case 2, 3 -> width;
            case 5, 8 -> height;
            default -> 0;
        };
    }

    /**
     * @return vertical offset applied after rotation, in pixels
     */
    public int translateY() {
        return switch (code) {
            case 3, 4 -> height;
            case 5, 6 -> width;
            default -> 0;
        };
    }

    /**
     * Rotation in degrees, counter-clockwise as PDF measures angles.
     *
     * @return one of {@code 0}, {@code 90}, {@code 180} or {@code 270}
     */
    public double rotation() {
        return switch (code) {
            case 3, 4 -> 180.0;
            case 5, 8 -> 90.0;
            case 6, 7 -> 270.0;
            default -> 0.0;
        };
    }

    /**
     * Horizontal scale applied before rotation.
     *
     * @return {@code -1.0} for the mirrored codes, {@code 1.0} otherwise
     */
    public double mirror() {
        return switch (code) {
            case 2, 4, 5, 7 -> -1.0;
            default -> 1.0;
        };
    }

    /**
     * @return {@code true} when the code is one of the eight defined EXIF orientations
     */
    public boolean isDefined() {
        return code >= 1 && code <= 8;
    }

    private boolean swapsAxes() {
        return code >= 5 && code <= 8;
    }
}
