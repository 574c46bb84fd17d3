package com.example.invoiceprocessor.domain.model;

/**
 * Proposed pairing of a PDF with the text file believed to describe the same shipment.
 *
 * @param pdf   PDF upload
 * @param txt   companion text/CSV upload
 * @param score filename similarity in {@code [0, 1]} that produced the pairing
 */
public record FilePair(InvoiceFile pdf, InvoiceFile txt, double score) {
}
