package com.example.jpegtopdf.infrastructure.jpeg;

import com.example.jpegtopdf.domain.model.ColorFormat;
import com.example.jpegtopdf.infrastructure.exception.ImageDecodeException;
import com.example.jpegtopdf.support.JpegFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for reading JPEG frame headers through metadata-extractor.
 */
class JpegHeaderDecoderTest {

    private final JpegHeaderDecoder decoder = new JpegHeaderDecoder();

    @Test
    void readsRgbFrame() {
        assertThat(decoder.decode(JpegFixtures.rgbJpeg(64, 32)))
                .contains(new JpegFrameHeader(64, 32, ColorFormat.RGB));
    }

    @Test
    void readsGrayscaleFrame() {
        assertThat(decoder.decode(JpegFixtures.grayscaleJpeg(17, 9)))
                .contains(new JpegFrameHeader(17, 9, ColorFormat.GRAYSCALE));
    }

    @Test
    void readsFourComponentFrameAsCmyk() {
        assertThat(decoder.decode(JpegFixtures.cmykJpeg(25, 12)))
                .contains(new JpegFrameHeader(25, 12, ColorFormat.CMYK));
    }

    @Test
    void ignoresExifWhileReadingFrame() {
        byte[] jpeg = JpegFixtures.withExif(JpegFixtures.rgbJpeg(30, 10), new byte[]{1, 2, 3});

        assertThat(decoder.decode(jpeg)).contains(new JpegFrameHeader(30, 10, ColorFormat.RGB));
    }

    @Test
    void leavesInputUntouched() {
        byte[] jpeg = JpegFixtures.rgbJpeg(30, 10);
        byte[] copy = jpeg.clone();

        decoder.decode(jpeg);

        assertThat(jpeg).isEqualTo(copy);
    }

    @Test
    void rejectsNonJpegData() {
        assertThrows(ImageDecodeException.class, () -> decoder.decode("definitely not a jpeg".getBytes()));
    }

    @Test
    void reportsMissingFrameAsEmpty() {
        byte[] scanWithoutFrame = {
                (byte) 0xFF, (byte) 0xD8,
                (byte) 0xFF, (byte) 0xDA, 0x00, 0x02,
                (byte) 0xFF, (byte) 0xD9
        };

        assertThat(decoder.decode(scanWithoutFrame)).isEmpty();
    }
}
