package com.example.jpegtopdf.application.service;

import com.example.jpegtopdf.application.exception.JpegConversionException;
import com.example.jpegtopdf.config.JpegToPdfProperties;
import com.example.jpegtopdf.domain.exception.ImageFileRequiredException;
import com.example.jpegtopdf.domain.exception.InvalidDpiException;
import com.example.jpegtopdf.infrastructure.exception.ImageUploadException;
import com.example.jpegtopdf.infrastructure.pdf.PdfBoxDocumentWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer service that converts uploaded JPEGs into a PDF.
 * It validates the upload, applies the configured defaults and hands the images to a fresh
 * {@link DocumentBuilder} per request.
 */
@Service
public class JpegToPdfService {

    private static final Logger log = LoggerFactory.getLogger(JpegToPdfService.class);

    private final PageComposer pageComposer;
    private final PdfBoxDocumentWriter documentWriter;
    private final JpegToPdfProperties properties;
    private final Clock clock;

    /**
     * Creates the service with the composition collaborators and configured defaults.
     *
     * @param pageComposer   composes each page
     * @param documentWriter serializes the document
     * @param properties     conversion defaults
     */
    public JpegToPdfService(PageComposer pageComposer,
                            PdfBoxDocumentWriter documentWriter,
                            JpegToPdfProperties properties) {
        this.pageComposer = pageComposer;
        this.documentWriter = documentWriter;
        this.properties = properties;
        this.clock = Clock.systemUTC();
    }

    /**
     * Converts the uploaded images in the order they were submitted.
     *
     * @param files     uploaded JPEG files; empty parts are ignored
     * @param dpi       pixels per inch or {@code null} for the configured default
     * @param stripExif whether to strip EXIF or {@code null} for the configured default
     * @param title     document title or {@code null} for the configured default
     * @return PDF bytes
     * @throws ImageFileRequiredException when no non-empty file was uploaded
     * @throws InvalidDpiException        when the resolution cannot be used
     * @throws ImageUploadException       when an upload cannot be read
     * @throws JpegConversionException    when an image cannot be converted
     */
    public byte[] convert(List<MultipartFile> files, Double dpi, Boolean stripExif, String title) {
        List<byte[]> images = readImages(files);

        DocumentBuilder builder = new DocumentBuilder(pageComposer, documentWriter, clock)
                .addImages(images)
                .setDpi(dpi != null ? dpi : properties.getDefaultDpi())
                .stripExif(stripExif != null ? stripExif : properties.isStripExif())
                .setTitle(title != null && !title.isBlank() ? title.trim() : properties.getDefaultTitle());

        log.debug("Converting {} uploaded image(s)", images.size());
        return builder.build(builder.toConfig());
    }

    public String downloadFileName() {
        return properties.getDownloadFileName();
    }

    private List<byte[]> readImages(List<MultipartFile> files) {
        List<byte[]> images = new ArrayList<>();
        if (files != null) {
            for (MultipartFile file : files) {
                if (file == null || file.isEmpty()) {
                    continue;
                }
                try {
                    images.add(file.getBytes());
                } catch (IOException ex) {
                    throw new ImageUploadException("Unable to read the uploaded image " + file.getOriginalFilename(), ex);
                }
            }
        }
        if (images.isEmpty()) {
            throw new ImageFileRequiredException();
        }
        return images;
    }
}
