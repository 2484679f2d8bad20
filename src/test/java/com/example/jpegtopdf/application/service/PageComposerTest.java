package com.example.jpegtopdf.application.service;

import com.example.jpegtopdf.application.exception.PageCompositionException;
import com.example.jpegtopdf.domain.model.ColorFormat;
import com.example.jpegtopdf.domain.model.FailureCause;
import com.example.jpegtopdf.domain.model.ImageDescriptor;
import com.example.jpegtopdf.domain.model.ImagePlacement;
import com.example.jpegtopdf.domain.model.Orientation;
import com.example.jpegtopdf.domain.model.PageSpec;
import com.example.jpegtopdf.infrastructure.exif.OrientationResolver;
import com.example.jpegtopdf.infrastructure.jpeg.JpegFrameHeader;
import com.example.jpegtopdf.infrastructure.jpeg.JpegHeaderDecoder;
import com.example.jpegtopdf.support.JpegFixtures;
import com.example.jpegtopdf.support.PdfTestSupport;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.color.PDDeviceCMYK;
import org.apache.pdfbox.pdmodel.graphics.color.PDDeviceGray;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.util.Matrix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.awt.geom.Point2D;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests covering per-image page composition.
 */
class PageComposerTest {

    private final PageComposer composer = new PageComposer(new JpegHeaderDecoder(), new OrientationResolver());

    /**
     * Every orientation must map the image exactly onto the page box.
     */
    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 8})
    void placementCoversPageExactly(int code) {
        Orientation orientation = new Orientation(code, 400, 300);
        PageSpec page = PageSpec.of(orientation, 72.0);
        Matrix matrix = PageComposer.toMatrix(ImagePlacement.of(orientation, 72.0));

        List<Point2D.Float> corners = List.of(
                matrix.transformPoint(0, 0),
                matrix.transformPoint(1, 0),
                matrix.transformPoint(0, 1),
                matrix.transformPoint(1, 1)
        );

        assertThat(corners.stream().mapToDouble(Point2D.Float::getX).min().orElseThrow()).isCloseTo(0.0, within(0.01));
        assertThat(corners.stream().mapToDouble(Point2D.Float::getY).min().orElseThrow()).isCloseTo(0.0, within(0.01));
        assertThat(corners.stream().mapToDouble(Point2D.Float::getX).max().orElseThrow()).isCloseTo(page.width(), within(0.01));
        assertThat(corners.stream().mapToDouble(Point2D.Float::getY).max().orElseThrow()).isCloseTo(page.height(), within(0.01));
    }

    /**
     * Ensures the page is sized to the upright image and the stream is embedded untouched.
     *
     * @throws Exception when PDFBox fails
     */
    @Test
    void composeEmbedsOriginalStreamOnOrientedPage() throws Exception {
        byte[] jpeg = JpegFixtures.withOrientation(JpegFixtures.rgbJpeg(600, 300), 6);

        try (PDDocument document = new PDDocument()) {
            composer.compose(document, jpeg, 300.0, false);

            assertThat(document.getNumberOfPages()).isEqualTo(1);
            PDPage page = document.getPage(0);
            assertThat(page.getMediaBox().getWidth()).isCloseTo(72f, within(0.01f));
            assertThat(page.getMediaBox().getHeight()).isCloseTo(144f, within(0.01f));

            PDImageXObject image = PdfTestSupport.imageOf(page);
            assertThat(image.getWidth()).isEqualTo(600);
            assertThat(image.getHeight()).isEqualTo(300);
            assertThat(image.getBitsPerComponent()).isEqualTo(8);
            assertThat(image.getCOSObject().getItem(COSName.FILTER)).isEqualTo(COSName.DCT_DECODE);
            assertThat(PdfTestSupport.rawStream(image)).isEqualTo(jpeg);
        }
    }

    @Test
    void composeMapsGrayscaleToDeviceGray() throws Exception {
        try (PDDocument document = new PDDocument()) {
            composer.compose(document, JpegFixtures.grayscaleJpeg(20, 10), 72.0, false);

            PDImageXObject image = PdfTestSupport.imageOf(document.getPage(0));
            assertThat(image.getColorSpace()).isEqualTo(PDDeviceGray.INSTANCE);
        }
    }

    @Test
    void composeMapsFourComponentsToDeviceCmyk() throws Exception {
        byte[] jpeg = JpegFixtures.cmykJpeg(30, 15);

        try (PDDocument document = new PDDocument()) {
            composer.compose(document, jpeg, 72.0, false);

            PDImageXObject image = PdfTestSupport.imageOf(document.getPage(0));
            assertThat(image.getColorSpace()).isEqualTo(PDDeviceCMYK.INSTANCE);
            assertThat(image.getWidth()).isEqualTo(30);
            assertThat(image.getHeight()).isEqualTo(15);
            assertThat(PdfTestSupport.rawStream(image)).isEqualTo(jpeg);
        }
    }

    @Test
    void describeStripsExifButKeepsScan() {
        byte[] plain = JpegFixtures.rgbJpeg(40, 20);
        byte[] jpeg = JpegFixtures.withOrientation(plain, 3);

        ImageDescriptor kept = composer.describe(jpeg, false);
        ImageDescriptor stripped = composer.describe(jpeg, true);

        assertThat(kept.payload()).isEqualTo(jpeg);
        assertThat(kept.exif()).isNotNull();
        assertThat(stripped.exif()).isEqualTo(kept.exif());
        assertThat(stripped.payload()).isEqualTo(plain);
        assertThat(stripped.colorFormat()).isEqualTo(ColorFormat.RGB);
    }

    @Test
    void describeReportsUndecodableHeader() {
        PageCompositionException ex = assertThrows(PageCompositionException.class,
                () -> composer.describe("broken".getBytes(), false));

        assertThat(ex.failure()).isEqualTo(FailureCause.IMAGE_INFO_DECODE);
        assertThat(ex.getMessage()).startsWith("failed to read image info");
    }

    @Test
    void describeReportsMissingHeader() {
        JpegHeaderDecoder decoder = mock(JpegHeaderDecoder.class);
        when(decoder.decode(any())).thenReturn(Optional.empty());
        PageComposer composerWithoutHeader = new PageComposer(decoder, new OrientationResolver());

        PageCompositionException ex = assertThrows(PageCompositionException.class,
                () -> composerWithoutHeader.describe(JpegFixtures.rgbJpeg(10, 10), false));

        assertThat(ex.failure()).isEqualTo(FailureCause.MISSING_IMAGE_INFO);
        assertThat(ex.getMessage()).isEqualTo("unexpectedly failed to read image info");
    }

    @Test
    void describeReportsMalformedSections() {
        JpegHeaderDecoder decoder = mock(JpegHeaderDecoder.class);
        when(decoder.decode(any())).thenReturn(Optional.of(new JpegFrameHeader(10, 10, ColorFormat.RGB)));
        PageComposer lenientComposer = new PageComposer(decoder, new OrientationResolver());
        byte[] jpeg = JpegFixtures.rgbJpeg(10, 10);
        byte[] truncated = Arrays.copyOf(jpeg, JpegFixtures.indexOfStartOfScan(jpeg));

        PageCompositionException ex = assertThrows(PageCompositionException.class,
                () -> lenientComposer.describe(truncated, false));

        assertThat(ex.failure()).isEqualTo(FailureCause.IMAGE_SECTIONS);
    }

    @Test
    void failedImageAddsNoPage() throws Exception {
        try (PDDocument document = new PDDocument()) {
            assertThrows(PageCompositionException.class,
                    () -> composer.compose(document, "broken".getBytes(), 300.0, false));

            assertThat(document.getNumberOfPages()).isZero();
        }
    }
}
