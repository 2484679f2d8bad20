package com.example.jpegtopdf.application.service;

import com.example.jpegtopdf.application.exception.JpegConversionException;
import com.example.jpegtopdf.application.exception.PageCompositionException;
import com.example.jpegtopdf.domain.model.DocumentConfig;
import com.example.jpegtopdf.infrastructure.exif.OrientationResolver;
import com.example.jpegtopdf.infrastructure.jpeg.JpegHeaderDecoder;
import com.example.jpegtopdf.infrastructure.pdf.PdfBoxDocumentWriter;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds a PDF with one page per JPEG, in the order the images were added.
 * <p>
 * Conversion is fail-fast: the first image that cannot be composed aborts the build with a
 * {@link JpegConversionException} naming its index, and nothing is written to the output.
 * An empty builder produces a valid document without pages.
 * <p>
 * Instances are not thread-safe; use one builder per document.
 */
public class DocumentBuilder {

    private static final Logger log = LoggerFactory.getLogger(DocumentBuilder.class);

    private final PageComposer pageComposer;
    private final PdfBoxDocumentWriter documentWriter;
    private final Clock clock;

    private final List<byte[]> images = new ArrayList<>();
    private double dpi = DocumentConfig.DEFAULT_DPI;
    private boolean stripExif;
    private String title = "";
    private Instant creationDate;
    private Instant modificationDate;

    /**
     * Creates a builder with the default collaborators and the system clock.
     */
    public DocumentBuilder() {
        this(new PageComposer(new JpegHeaderDecoder(), new OrientationResolver()),
                new PdfBoxDocumentWriter(),
                Clock.systemUTC());
    }

    /**
     * @param pageComposer   composes each page
     * @param documentWriter serializes the finished document
     * @param clock          source of the default timestamps
     */
    public DocumentBuilder(PageComposer pageComposer, PdfBoxDocumentWriter documentWriter, Clock clock) {
        this.pageComposer = pageComposer;
        this.documentWriter = documentWriter;
        this.clock = clock;
    }

    /**
     * Creates a PDF from the given JPEGs with default settings.
     *
     * @param jpegs JPEG files in page order
     * @param out   destination of the PDF bytes
     * @param dpi   pixels per inch, {@code null} for {@value DocumentConfig#DEFAULT_DPI}
     * @throws JpegConversionException when an image or the output fails
     * @deprecated use {@link #DocumentBuilder()} with {@link #addImages(Collection)} and {@link #createPdf(OutputStream)}
     */
    @Deprecated
    public static void createPdfFromJpegs(List<byte[]> jpegs, OutputStream out, Double dpi) {
        new DocumentBuilder()
                .addImages(jpegs)
                .setDpi(dpi != null ? dpi : DocumentConfig.DEFAULT_DPI)
                .createPdf(out);
    }

    public DocumentBuilder addImage(byte[] jpeg) {
        images.add(jpeg);
        return this;
    }

    public DocumentBuilder addImages(Collection<byte[]> jpegs) {
        images.addAll(jpegs);
        return this;
    }

    public DocumentBuilder setDpi(double dpi) {
        this.dpi = dpi;
        return this;
    }

    /**
     * @param stripExif whether EXIF segments are removed from the embedded image streams
     * @return this builder
     */
    public DocumentBuilder stripExif(boolean stripExif) {
        this.stripExif = stripExif;
        return this;
    }

    public DocumentBuilder setTitle(String title) {
        this.title = title;
        return this;
    }

    public DocumentBuilder setCreationDate(Instant creationDate) {
        this.creationDate = creationDate;
        return this;
    }

    public DocumentBuilder setModificationDate(Instant modificationDate) {
        this.modificationDate = modificationDate;
        return this;
    }

    /**
     * Snapshots the current settings. Unset timestamps default to now.
     *
     * @return immutable configuration
     */
    public DocumentConfig toConfig() {
        Instant now = clock.instant();
        return new DocumentConfig(
                images,
                dpi,
                stripExif,
                title,
                creationDate != null ? creationDate : now,
                modificationDate != null ? modificationDate : now
        );
    }

    /**
     * Composes every image and writes the PDF to {@code out}.
     *
     * @param out destination of the PDF bytes
     * @throws JpegConversionException when an image or the output fails
     */
    public void createPdf(OutputStream out) {
        byte[] pdf = build(toConfig());
        try {
            out.write(pdf);
            out.flush();
        } catch (IOException ex) {
            throw JpegConversionException.documentWriteFailure(ex);
        }
    }

    /**
     * Composes every image of the configuration into a serialized PDF.
     *
     * @param config document configuration
     * @return PDF bytes
     * @throws JpegConversionException when an image or the serialization fails
     */
    public byte[] build(DocumentConfig config) {
        List<byte[]> jpegs = config.images();
        try (PDDocument document = new PDDocument()) {
            for (int index = 0; index < jpegs.size(); index++) {
                try {
                    pageComposer.compose(document, jpegs.get(index), config.dpi(), config.stripExif());
                } catch (PageCompositionException ex) {
                    log.warn("Aborting conversion at JPEG index {}: {}", index, ex.getMessage());
                    throw new JpegConversionException(index, ex.failure(), ex.getCause());
                }
            }
            byte[] pdf = documentWriter.write(document, config);
            log.info("Created PDF with {} page(s) at {} dpi ({} bytes)", jpegs.size(), config.dpi(), pdf.length);
            return pdf;
        } catch (IOException ex) {
            throw JpegConversionException.documentWriteFailure(ex);
        }
    }
}
