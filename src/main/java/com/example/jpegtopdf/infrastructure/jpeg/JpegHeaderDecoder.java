package com.example.jpegtopdf.infrastructure.jpeg;

import com.drew.imaging.jpeg.JpegMetadataReader;
import com.drew.imaging.jpeg.JpegProcessingException;
import com.drew.imaging.jpeg.JpegSegmentMetadataReader;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.jpeg.JpegDirectory;
import com.drew.metadata.jpeg.JpegReader;
import com.example.jpegtopdf.domain.model.ColorFormat;
import com.example.jpegtopdf.infrastructure.exception.ImageDecodeException;

import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Reads the frame header of a JPEG through metadata-extractor without decoding any pixels.
 * Only the start-of-frame segments are handed to the reader so EXIF or ICC blocks cannot fail the decode.
 */
@Component
public class JpegHeaderDecoder {

    private static final List<JpegSegmentMetadataReader> FRAME_READERS = List.of(new JpegReader());

    /**
     * Decodes the frame header of the given JPEG.
     *
     * @param jpeg complete JPEG file contents, left untouched
     * @return frame header or empty when the stream has no start-of-frame segment
     * @throws ImageDecodeException when the stream is not a readable JPEG
     */
    public Optional<JpegFrameHeader> decode(byte[] jpeg) {
        Metadata metadata;
        try {
            metadata = JpegMetadataReader.readMetadata(new ByteArrayInputStream(jpeg), FRAME_READERS);
        } catch (JpegProcessingException | IOException ex) {
            throw new ImageDecodeException(messageOf(ex), ex);
        }

        JpegDirectory directory = metadata.getFirstDirectoryOfType(JpegDirectory.class);
        if (directory == null) {
            return Optional.empty();
        }
        try {
            int width = directory.getImageWidth();
            int height = directory.getImageHeight();
            int components = directory.getNumberOfComponents();
            if (width <= 0 || height <= 0) {
                throw new ImageDecodeException("invalid image dimensions " + width + "x" + height);
            }
            ColorFormat colorFormat = ColorFormat.fromComponentCount(components)
                    .orElseThrow(() -> new ImageDecodeException("unsupported number of components: " + components));
            return Optional.of(new JpegFrameHeader(width, height, colorFormat));
        } catch (MetadataException ex) {
            throw new ImageDecodeException(messageOf(ex), ex);
        }
    }

    private String messageOf(Exception ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
