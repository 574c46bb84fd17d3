package com.example.invoiceprocessor.application.extraction;

import com.example.invoiceprocessor.domain.model.ExtractionResult;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;

import java.util.Set;

/**
 * Per-format strategy turning file content into raw rows. The set of variants is closed; the
 * {@link FieldExtractorRegistry} dispatches on the detected {@link InputFormat}.
 */
public sealed interface FieldExtractor permits StructuredTextExtractor, UnstructuredTextExtractor, PdfTextExtractor {

    /**
     * @return formats this extractor is responsible for
     */
    Set<InputFormat> supportedFormats();

    /**
     * Extracts raw rows. Implementations report unreadable content as warnings instead of throwing.
     *
     * @param file   upload tuple
     * @param format detected format, one of {@link #supportedFormats()}
     * @return extracted rows and per-file warnings
     */
    ExtractionResult extract(InvoiceFile file, InputFormat format);
}
