package com.example.jpegtopdf.infrastructure.pdf;

import com.example.jpegtopdf.domain.model.DocumentConfig;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.AdobePDFSchema;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.XmpSerializer;
import org.springframework.stereotype.Component;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Calendar;
import java.util.GregorianCalendar;

/**
 * Infrastructure service that stamps document metadata and serializes a composed {@link PDDocument}.
 * Writes both the legacy info dictionary and an XMP packet so readers of either see the same values.
 */
@Component
public class PdfBoxDocumentWriter {

    static final String PRODUCER = "jpeg-to-pdf";

    /**
     * Applies title and timestamps, then serializes the document into memory.
     *
     * @param document composed document
     * @param config   configuration carrying title and timestamps
     * @return complete PDF bytes
     * @throws IOException when PDFBox cannot serialize the document
     */
    public byte[] write(PDDocument document, DocumentConfig config) throws IOException {
        Calendar created = toCalendar(config.creationDate());
        Calendar modified = toCalendar(config.modificationDate());

        PDDocumentInformation info = document.getDocumentInformation();
        info.setTitle(config.title());
        info.setProducer(PRODUCER);
        info.setCreationDate(created);
        info.setModificationDate(modified);

        PDMetadata metadata = new PDMetadata(document);
        metadata.importXMPMetadata(buildXmp(config.title(), created, modified));
        document.getDocumentCatalog().setMetadata(metadata);

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        document.save(outputStream);
        return outputStream.toByteArray();
    }

    /**
     * Builds the XMP packet mirroring the info dictionary.
     *
     * @param title    document title
     * @param created  creation timestamp
     * @param modified modification timestamp
     * @return serialized XMP packet
     * @throws IOException when the packet cannot be serialized
     */
    private byte[] buildXmp(String title, Calendar created, Calendar modified) throws IOException {
        XMPMetadata xmp = XMPMetadata.createXMPMetadata();

        DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
        if (!title.isEmpty()) {
            dc.setTitle(title);
        }

        XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
        basic.setCreateDate(created);
        basic.setModifyDate(modified);
        basic.setMetadataDate(modified);
        basic.setCreatorTool(PRODUCER);

        AdobePDFSchema pdf = xmp.createAndAddAdobePDFSchema();
        pdf.setProducer(PRODUCER);

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try {
            new XmpSerializer().serialize(xmp, outputStream, true);
        } catch (TransformerException ex) {
            throw new IOException("Unable to serialize XMP metadata", ex);
        }
        return outputStream.toByteArray();
    }

    private Calendar toCalendar(Instant instant) {
        return GregorianCalendar.from(instant.atZone(ZoneOffset.UTC));
    }
}
