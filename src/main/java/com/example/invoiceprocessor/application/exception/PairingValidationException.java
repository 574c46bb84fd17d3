package com.example.invoiceprocessor.application.exception;

/**
 * Thrown when a caller-confirmed pairing names files that were not uploaded or cannot pair.
 */
public class PairingValidationException extends UseCaseValidationException {

    /**
     * @param message validation message suitable for display
     */
    public PairingValidationException(String message) {
        super(message);
    }
}
