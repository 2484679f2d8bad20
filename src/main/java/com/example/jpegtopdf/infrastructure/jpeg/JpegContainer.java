package com.example.jpegtopdf.infrastructure.jpeg;

import com.drew.imaging.jpeg.JpegProcessingException;
import com.drew.imaging.jpeg.JpegSegmentData;
import com.drew.imaging.jpeg.JpegSegmentReader;
import com.drew.imaging.jpeg.JpegSegmentType;
import com.drew.lang.SequentialByteArrayReader;
import com.drew.metadata.exif.ExifReader;
import com.example.jpegtopdf.infrastructure.exception.MalformedJpegException;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Segment-level view of a JPEG file.
 * The header segments are read with metadata-extractor's {@link JpegSegmentReader}; the EXIF segment is
 * removed with Commons Imaging's {@link ExifRewriter}, which copies every other segment and the scan as-is.
 */
public final class JpegContainer {

    private static final byte[] EXIF_PREAMBLE = ExifReader.JPEG_SEGMENT_PREAMBLE.getBytes(StandardCharsets.ISO_8859_1);

    private final byte[] data;
    private final JpegSegmentData segmentData;

    private JpegContainer(byte[] data, JpegSegmentData segmentData) {
        this.data = data;
        this.segmentData = segmentData;
    }

    /**
     * Reads the header segments of a JPEG file up to its start of scan.
     *
     * @param data complete JPEG file contents
     * @return parsed container
     * @throws MalformedJpegException when the marker structure is broken
     */
    public static JpegContainer parse(byte[] data) {
        try {
            JpegSegmentData segmentData = JpegSegmentReader.readSegments(new SequentialByteArrayReader(data), null);
            return new JpegContainer(data.clone(), segmentData);
        } catch (JpegProcessingException | IOException ex) {
            throw new MalformedJpegException("Unable to read JPEG segments: " + ex.getMessage(), ex);
        }
    }

    /**
     * Returns the TIFF-structured EXIF block of the first EXIF APP1 segment, without its preamble.
     *
     * @return EXIF bytes or empty when the file carries none
     */
    public Optional<byte[]> exif() {
        for (byte[] segment : segmentData.getSegments(JpegSegmentType.APP1)) {
            if (isExif(segment)) {
                return Optional.of(Arrays.copyOfRange(segment, EXIF_PREAMBLE.length, segment.length));
            }
        }
        return Optional.empty();
    }

    /**
     * @return payloads of every segment of the given type, in file order
     */
    public List<byte[]> segments(JpegSegmentType type) {
        List<byte[]> copies = new ArrayList<>();
        for (byte[] segment : segmentData.getSegments(type)) {
            copies.add(segment.clone());
        }
        return copies;
    }

    /**
     * Rewrites the file without its EXIF APP1 segment. Other APP1 blocks such as XMP are kept.
     *
     * @return JPEG bytes without EXIF
     * @throws MalformedJpegException when the rewriter cannot split the file
     */
    public byte[] withoutExif() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);
        try {
            new ExifRewriter().removeExifMetadata(data, out);
        } catch (IOException ex) {
            throw new MalformedJpegException("Unable to remove EXIF segment: " + ex.getMessage(), ex);
        }
        return out.toByteArray();
    }

    private static boolean isExif(byte[] segment) {
        return segment.length >= EXIF_PREAMBLE.length
                && Arrays.equals(segment, 0, EXIF_PREAMBLE.length, EXIF_PREAMBLE, 0, EXIF_PREAMBLE.length);
    }
}
