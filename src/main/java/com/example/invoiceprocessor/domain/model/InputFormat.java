package com.example.invoiceprocessor.domain.model;

/**
 * Layout family of an uploaded file as classified by the format detector.
 * Each value is handled by exactly one field extractor.
 */
public enum InputFormat {
    STRUCTURED_TEXT,
    UNSTRUCTURED_TEXT,
    PDF_TEXT,
    CSV;

    /**
     * @return tag stamped on line items parsed from a file of this format
     */
    public SourceTag sourceTag() {
        return switch (this) {
            case PDF_TEXT -> SourceTag.PDF;
            case CSV -> SourceTag.CSV;
            case STRUCTURED_TEXT, UNSTRUCTURED_TEXT -> SourceTag.TXT;
        };
    }
}
