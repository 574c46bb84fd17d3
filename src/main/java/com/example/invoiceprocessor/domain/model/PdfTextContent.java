package com.example.invoiceprocessor.domain.model;

/**
 * Text of every page of a PDF, concatenated in page order, with the document properties.
 */
public record PdfTextContent(String text, PdfDocumentProperties properties) {

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
