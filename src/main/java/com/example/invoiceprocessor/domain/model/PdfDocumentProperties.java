package com.example.invoiceprocessor.domain.model;

import java.util.stream.Stream;

/**
 * Descriptive PDF properties gathered from the info dictionary and XMP packet.
 * Used as a fallback source for the invoice number when the page text carries none.
 */
public record PdfDocumentProperties(
        String title,
        String subject,
        String keywords,
        String xmpTitle,
        int pageCount,
        boolean encrypted
) {

    /**
     * @return non-blank descriptive strings, info dictionary first
     */
    public Stream<String> descriptiveTexts() {
        return Stream.of(title, subject, keywords, xmpTitle)
                .filter(value -> value != null && !value.isBlank());
    }
}
