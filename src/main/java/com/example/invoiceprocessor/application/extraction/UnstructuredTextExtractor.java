package com.example.invoiceprocessor.application.extraction;

import com.example.invoiceprocessor.domain.model.CanonicalField;
import com.example.invoiceprocessor.domain.model.ExtractionResult;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.RawRow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pattern-based extraction for free-form text. Fields are matched independently across the whole
 * document, so a document yields at most one row: free text has no reliable row delimiter.
 */
@Service
public final class UnstructuredTextExtractor implements FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(UnstructuredTextExtractor.class);

    @Override
    public Set<InputFormat> supportedFormats() {
        return EnumSet.of(InputFormat.UNSTRUCTURED_TEXT);
    }

    @Override
    public ExtractionResult extract(InvoiceFile file, InputFormat format) {
        return extractFromText(file.fileName(), format, TextContentDecoder.decode(file.content()), null);
    }

    /**
     * Runs the field patterns over already decoded text. Shared with the PDF extractor.
     *
     * @param fileName        original file name
     * @param format          format reported on the result
     * @param text            whole document text
     * @param fallbackInvoice invoice number to use when the text carries none, may be {@code null}
     * @return zero or one raw row
     */
    ExtractionResult extractFromText(String fileName, InputFormat format, String text, String fallbackInvoice) {
        Map<String, String> fields = FieldPatternCatalog.extract(text);
        String invoiceKey = CanonicalField.INVOICE_NUMBER.attributeName();
        if (!fields.containsKey(invoiceKey) && fallbackInvoice != null) {
            fields.put(invoiceKey, fallbackInvoice);
        }
        String invoiceHint = fields.get(invoiceKey);
        if (fields.isEmpty()) {
            log.info("No invoice fields recognised in {}", fileName);
            return new ExtractionResult(fileName, format, List.of(), List.of(), 0, List.of(), invoiceHint);
        }
        log.debug("Matched fields {} in {}", fields.keySet(), fileName);
        return new ExtractionResult(fileName, format, List.copyOf(fields.keySet()), List.of(new RawRow(fields)),
                0, List.of(), invoiceHint);
    }
}
