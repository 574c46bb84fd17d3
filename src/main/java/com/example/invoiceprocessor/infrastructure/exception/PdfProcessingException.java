package com.example.invoiceprocessor.infrastructure.exception;

/**
 * Signals that PDFBox could not load a PDF or strip its text.
 * The PDF extractor turns it into an extraction warning.
 */
public class PdfProcessingException extends InfrastructureException {

    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
