package com.example.invoiceprocessor.application.extraction;

import com.example.invoiceprocessor.domain.model.ExtractionResult;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.ProcessingWarning;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches extraction to the extractor registered for the detected format.
 */
@Component
public class FieldExtractorRegistry {

    private final Map<InputFormat, FieldExtractor> extractors = new EnumMap<>(InputFormat.class);

    public FieldExtractorRegistry(List<FieldExtractor> extractors) {
        for (FieldExtractor extractor : extractors) {
            for (InputFormat format : extractor.supportedFormats()) {
                FieldExtractor previous = this.extractors.put(format, extractor);
                if (previous != null) {
                    throw new IllegalStateException("Two extractors registered for " + format);
                }
            }
        }
        for (InputFormat format : InputFormat.values()) {
            if (!this.extractors.containsKey(format)) {
                throw new IllegalStateException("No extractor registered for " + format);
            }
        }
    }

    /**
     * Extracts raw rows and flags files that produced none.
     *
     * @param file   upload tuple
     * @param format detected format
     * @return extraction result, with an extraction warning when no rows came out
     */
    public ExtractionResult extract(InvoiceFile file, InputFormat format) {
        ExtractionResult result = extractors.get(format).extract(file, format);
        boolean alreadyFlagged = result.warnings().stream()
                .anyMatch(warning -> warning.kind() == ProcessingWarning.Kind.EXTRACTION);
        if (result.rows().isEmpty() && !alreadyFlagged) {
            return result.withWarning(ProcessingWarning.extraction(file.fileName(), "No rows could be extracted."));
        }
        return result;
    }
}
