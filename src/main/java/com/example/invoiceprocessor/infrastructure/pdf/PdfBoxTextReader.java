package com.example.invoiceprocessor.infrastructure.pdf;

import com.example.invoiceprocessor.domain.model.PdfDocumentProperties;
import com.example.invoiceprocessor.domain.model.PdfTextContent;
import com.example.invoiceprocessor.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Loads PDF bytes with PDFBox and returns the text of every page, concatenated in page order.
 * Scanned PDFs come back with empty text; there is no OCR step.
 */
@Service
public class PdfBoxTextReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextReader.class);

    private final PdfBoxMetadataReader metadataReader;

    public PdfBoxTextReader(PdfBoxMetadataReader metadataReader) {
        this.metadataReader = metadataReader;
    }

    /**
     * Reads the text layer of a PDF.
     *
     * @param bytes    PDF bytes
     * @param fileName logical name used in log and error messages
     * @return page text and document properties; text is empty when the document forbids extraction
     * @throws PdfProcessingException when PDFBox cannot load the bytes or the document needs a password
     */
    public PdfTextContent read(byte[] bytes, String fileName) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PdfDocumentProperties properties = metadataReader.readProperties(document);
            if (document.isEncrypted() && !document.getCurrentAccessPermission().canExtractContent()) {
                log.warn("PDF {} is encrypted and does not permit text extraction.", fileName);
                return new PdfTextContent("", properties);
            }
            return new PdfTextContent(extractPages(document), properties);
        } catch (InvalidPasswordException e) {
            throw new PdfProcessingException("PDF " + fileName + " is password protected.", e);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read PDF " + fileName + ".", e);
        }
    }

    /**
     * Strips each page separately and joins the results, keeping page order.
     *
     * @param document loaded PDF document
     * @return concatenated page text
     * @throws IOException when PDFBox cannot read the page content
     */
    private String extractPages(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setLineSeparator("\n");
        stripper.setSortByPosition(true);
        StringBuilder text = new StringBuilder();
        int pageCount = document.getNumberOfPages();
        for (int page = 1; page <= pageCount; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            String pageText = stripper.getText(document);
            if (!pageText.isBlank()) {
                text.append(pageText.strip()).append('\n');
            }
        }
        log.debug("Extracted {} characters from {} page(s).", text.length(), pageCount);
        return text.toString().strip();
    }
}
