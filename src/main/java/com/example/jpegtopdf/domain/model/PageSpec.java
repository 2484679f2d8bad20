package com.example.jpegtopdf.domain.model;

/**
 * Page size in PDF points for one composed image.
 *
 * @param width  page width in points
 * @param height page height in points
 */
public record PageSpec(float width, float height) {

    /**
     * Points per inch in PDF user space.
     */
    public static final double POINTS_PER_INCH = 72.0;

    /**
     * Sizes the page to the upright image at the given resolution.
     *
     * @param orientation geometry of the image
     * @param dpi         pixels per inch
     * @return page size in points
     */
    public static PageSpec of(Orientation orientation, double dpi) {
        return new PageSpec(
                toPoints(orientation.displayWidth(), dpi),
                toPoints(orientation.displayHeight(), dpi)
        );
    }

    /**
     * Converts a pixel distance into points.
     *
     * @param pixels distance in pixels
     * @param dpi    pixels per inch
     * @return distance in points
     */
    public static float toPoints(double pixels, double dpi) {
        return (float) (pixels * POINTS_PER_INCH / dpi);
    }
}
