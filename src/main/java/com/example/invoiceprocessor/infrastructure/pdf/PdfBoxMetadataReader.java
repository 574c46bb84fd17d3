package com.example.invoiceprocessor.infrastructure.pdf;

import com.example.invoiceprocessor.domain.model.PdfDocumentProperties;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Infrastructure service that reads the descriptive properties of a loaded PDF.
 * ERP exports frequently put the invoice number into the title or subject, so these strings are a
 * fallback when the page text carries none.
 */
@Service
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);

    /**
     * Reads the info dictionary and the XMP title of an already opened document.
     *
     * @param document opened PDF document
     * @return properties, never {@code null}
     */
    public PdfDocumentProperties readProperties(PDDocument document) {
        PDDocumentInformation info = document.getDocumentInformation();
        return new PdfDocumentProperties(
                info != null ? info.getTitle() : null,
                info != null ? info.getSubject() : null,
                info != null ? info.getKeywords() : null,
                readXmpTitle(document.getDocumentCatalog()),
                document.getNumberOfPages(),
                document.isEncrypted()
        );
    }

    /**
     * Extracts the Dublin Core title from the XMP packet.
     *
     * @param catalog document catalog supplied by PDFBox
     * @return title or {@code null} if missing/invalid
     */
    private String readXmpTitle(PDDocumentCatalog catalog) {
        if (catalog == null) {
            return null;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        if (pdMetadata == null) {
            return null;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return null;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            return dc != null ? dc.getTitle() : null;
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return null;
        }
    }
}
