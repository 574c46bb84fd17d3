package com.example.invoiceprocessor.domain.model;

/**
 * Origin of a {@link LineItem}. {@link #COMBINED} marks rows produced by merging a PDF/text pair.
 */
public enum SourceTag {
    PDF,
    TXT,
    CSV,
    COMBINED
}
