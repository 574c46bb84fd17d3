package com.example.invoiceprocessor.domain.exception;

/**
 * Raised when a processing or pairing request arrives without any file.
 */
public class InvoiceFilesRequiredException extends DomainException {

    public InvoiceFilesRequiredException() {
        super("Please choose at least one invoice file (.pdf, .txt or .csv).");
    }
}
