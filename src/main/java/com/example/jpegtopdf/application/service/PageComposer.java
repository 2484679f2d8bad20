package com.example.jpegtopdf.application.service;

import com.example.jpegtopdf.application.exception.PageCompositionException;
import com.example.jpegtopdf.domain.model.ColorFormat;
import com.example.jpegtopdf.domain.model.FailureCause;
import com.example.jpegtopdf.domain.model.ImageDescriptor;
import com.example.jpegtopdf.domain.model.ImagePlacement;
import com.example.jpegtopdf.domain.model.Orientation;
import com.example.jpegtopdf.domain.model.PageSpec;
import com.example.jpegtopdf.infrastructure.exception.ImageDecodeException;
import com.example.jpegtopdf.infrastructure.exception.MalformedJpegException;
import com.example.jpegtopdf.infrastructure.exif.OrientationResolver;
import com.example.jpegtopdf.infrastructure.jpeg.JpegContainer;
import com.example.jpegtopdf.infrastructure.jpeg.JpegFrameHeader;
import com.example.jpegtopdf.infrastructure.jpeg.JpegHeaderDecoder;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.color.PDColorSpace;
import org.apache.pdfbox.pdmodel.graphics.color.PDDeviceCMYK;
import org.apache.pdfbox.pdmodel.graphics.color.PDDeviceGray;
import org.apache.pdfbox.pdmodel.graphics.color.PDDeviceRGB;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.util.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Application-layer service that turns one JPEG into one page.
 * The compressed stream is embedded with the {@code DCTDecode} filter as-is; orientation is
 * expressed purely through the page size and the placement matrix.
 */
@Service
public class PageComposer {

    private static final Logger log = LoggerFactory.getLogger(PageComposer.class);
    private static final int BITS_PER_COMPONENT = 8;

    private final JpegHeaderDecoder headerDecoder;
    private final OrientationResolver orientationResolver;

    /**
     * Creates the composer with its JPEG collaborators.
     *
     * @param headerDecoder       reads pixel dimensions and color layout
     * @param orientationResolver reads the EXIF orientation code
     */
    public PageComposer(JpegHeaderDecoder headerDecoder, OrientationResolver orientationResolver) {
        this.headerDecoder = headerDecoder;
        this.orientationResolver = orientationResolver;
    }

    /**
     * Appends a page showing the given JPEG upright.
     * Nothing is added to the document when the image cannot be read.
     *
     * @param document  document under construction
     * @param jpeg      complete JPEG file contents
     * @param dpi       pixels per inch used to size the page
     * @param stripExif whether the EXIF segment is removed from the embedded stream
     * @throws PageCompositionException when any step fails
     */
    public void compose(PDDocument document, byte[] jpeg, double dpi, boolean stripExif) {
        ImageDescriptor image = describe(jpeg, stripExif);
        Orientation orientation = new Orientation(
                orientationResolver.resolve(image.exif()),
                image.width(),
                image.height()
        );
        PageSpec pageSpec = PageSpec.of(orientation, dpi);
        ImagePlacement placement = ImagePlacement.of(orientation, dpi);

        try {
            PDPage page = new PDPage(new PDRectangle(pageSpec.width(), pageSpec.height()));
            document.addPage(page);

            PDImageXObject imageObject = new PDImageXObject(
                    document,
                    new ByteArrayInputStream(image.payload()),
                    COSName.DCT_DECODE,
                    image.width(),
                    image.height(),
                    BITS_PER_COMPONENT,
                    toColorSpace(image.colorFormat())
            );
            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.drawImage(imageObject, toMatrix(placement));
            }
        } catch (IOException ex) {
            throw new PageCompositionException(FailureCause.PDF_WRITE, ex);
        }

        log.debug("Composed {}x{} {} image with orientation {} onto a {}x{}pt page",
                image.width(), image.height(), image.colorFormat(), orientation.code(),
                pageSpec.width(), pageSpec.height());
    }

    /**
     * Reads the frame header and the container structure and picks the payload to embed.
     *
     * @param jpeg      complete JPEG file contents
     * @param stripExif whether the EXIF segment is removed from the payload
     * @return descriptor of the image
     */
    ImageDescriptor describe(byte[] jpeg, boolean stripExif) {
        JpegFrameHeader header;
        try {
            header = headerDecoder.decode(jpeg)
                    .orElseThrow(() -> new PageCompositionException(FailureCause.MISSING_IMAGE_INFO, null));
        } catch (ImageDecodeException ex) {
            throw new PageCompositionException(FailureCause.IMAGE_INFO_DECODE, ex);
        }

        byte[] exif;
        byte[] payload;
        try {
            JpegContainer container = JpegContainer.parse(jpeg);
            exif = container.exif().orElse(null);
            payload = stripExif ? container.withoutExif() : jpeg;
        } catch (MalformedJpegException ex) {
            throw new PageCompositionException(FailureCause.IMAGE_SECTIONS, ex);
        }
        return new ImageDescriptor(header.width(), header.height(), header.colorFormat(), payload, exif);
    }

    /**
     * Builds the matrix mapping the image's unit square onto the page: scale and mirror first,
     * then rotate about the origin, then translate.
     *
     * @param placement placement in points
     * @return matrix for {@link PDPageContentStream#drawImage(PDImageXObject, Matrix)}
     */
    static Matrix toMatrix(ImagePlacement placement) {
        Matrix matrix = Matrix.getTranslateInstance(placement.translateX(), placement.translateY());
        if (placement.rotation() != 0.0) {
            matrix.rotate(Math.toRadians(placement.rotation()));
        }
        matrix.scale(
                (float) (placement.imageWidth() * placement.scaleX()),
                (float) (placement.imageHeight() * placement.scaleY())
        );
        return matrix;
    }

    private static PDColorSpace toColorSpace(ColorFormat colorFormat) {
        return switch (colorFormat) {
            case GRAYSCALE -> PDDeviceGray.INSTANCE;
            case RGB -> PDDeviceRGB.INSTANCE;
            case CMYK -> PDDeviceCMYK.INSTANCE;
        };
    }
}
