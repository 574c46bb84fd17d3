package com.example.invoiceprocessor.application.exception;

/**
 * Thrown when a preview is requested for a file that carries nothing to show.
 */
public class PreviewValidationException extends UseCaseValidationException {

    /**
     * @param message validation message suitable for display
     */
    public PreviewValidationException(String message) {
        super(message);
    }
}
