package com.example.jpegtopdf.infrastructure.jpeg;

import com.example.jpegtopdf.domain.model.ColorFormat;

/**
 * Dimensions and color layout read from a JPEG start-of-frame segment.
 *
 * @param width       pixel width
 * @param height      pixel height
 * @param colorFormat color layout derived from the component count
 */
public record JpegFrameHeader(int width, int height, ColorFormat colorFormat) {
}
