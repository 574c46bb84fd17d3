package com.example.invoiceprocessor.application.extraction;

import com.example.invoiceprocessor.domain.model.ExtractionResult;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.PdfDocumentProperties;
import com.example.invoiceprocessor.domain.model.PdfTextContent;
import com.example.invoiceprocessor.domain.model.ProcessingWarning;
import com.example.invoiceprocessor.infrastructure.exception.PdfProcessingException;
import com.example.invoiceprocessor.infrastructure.pdf.PdfBoxTextReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the text layer of a PDF and runs the free-text patterns over it.
 * Corrupt, locked and text-less PDFs produce no rows and an extraction warning.
 */
@Service
public final class PdfTextExtractor implements FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    private final PdfBoxTextReader textReader;
    private final UnstructuredTextExtractor textExtractor;

    public PdfTextExtractor(PdfBoxTextReader textReader, UnstructuredTextExtractor textExtractor) {
        this.textReader = textReader;
        this.textExtractor = textExtractor;
    }

    @Override
    public Set<InputFormat> supportedFormats() {
        return EnumSet.of(InputFormat.PDF_TEXT);
    }

    @Override
    public ExtractionResult extract(InvoiceFile file, InputFormat format) {
        PdfTextContent content;
        try {
            content = textReader.read(file.content(), file.fileName());
        } catch (PdfProcessingException e) {
            log.warn("Skipping PDF {}: {}", file.fileName(), e.getMessage());
            return ExtractionResult.failed(file.fileName(), format, e.getMessage());
        }

        String metadataInvoice = invoiceFromProperties(content.properties()).orElse(null);
        if (!content.hasText()) {
            String reason = content.properties().encrypted()
                    ? "PDF is encrypted and does not permit text extraction."
                    : "PDF has no extractable text (scanned documents are not OCR'd).";
            return new ExtractionResult(file.fileName(), format, List.of(), List.of(), 0,
                    List.of(ProcessingWarning.extraction(file.fileName(), reason)),
                    metadataInvoice);
        }
        log.debug("PDF {} has {} page(s)", file.fileName(), content.properties().pageCount());
        return textExtractor.extractFromText(file.fileName(), format, content.text(), metadataInvoice);
    }

    private static Optional<String> invoiceFromProperties(PdfDocumentProperties properties) {
        return properties.descriptiveTexts()
                .map(FieldPatternCatalog::findInvoiceNumber)
                .flatMap(Optional::stream)
                .findFirst();
    }
}
