package com.example.jpegtopdf.domain.model;

/**
 * Where and how an image is drawn on its page, in points.
 * <p>
 * The image is scaled to its size at {@code dpi}, mirrored by {@code scaleX}, rotated
 * counter-clockwise about the origin by {@code rotation} degrees, then moved by the translation.
 *
 * @param translateX  horizontal offset in points
 * @param translateY  vertical offset in points
 * @param rotation    counter-clockwise rotation in degrees
 * @param scaleX      horizontal scale factor, negative when mirrored
 * @param scaleY      vertical scale factor
 * @param imageWidth  width of the unrotated image in points
 * @param imageHeight height of the unrotated image in points
 * @param dpi         resolution the image is placed at
 */
public record ImagePlacement(
        float translateX,
        float translateY,
        double rotation,
        double scaleX,
        double scaleY,
        float imageWidth,
        float imageHeight,
        double dpi
) {

    /**
     * Derives the placement of an image from its orientation geometry.
     *
     * @param orientation geometry of the image
     * @param dpi         pixels per inch
     * @return placement in points
     */
    public static ImagePlacement of(Orientation orientation, double dpi) {
        return new ImagePlacement(
                PageSpec.toPoints(orientation.translateX(), dpi),
                PageSpec.toPoints(orientation.translateY(), dpi),
                orientation.rotation(),
                orientation.mirror(),
                1.0,
                PageSpec.toPoints(orientation.width(), dpi),
                PageSpec.toPoints(orientation.height(), dpi),
                dpi
        );
    }
}
