package com.example.invoiceprocessor.infrastructure.exception;

/**
 * Raised when an export file cannot be written to the output directory.
 */
public class CsvWriteException extends InfrastructureException {

    /**
     * @param message description of the target file
     * @param cause   underlying IO failure
     */
    public CsvWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
