package com.example.invoiceprocessor.infrastructure.exception;

/**
 * Raised by the HTTP adapter when the bytes of a multipart upload cannot be read.
 */
public class UploadReadException extends InfrastructureException {

    public UploadReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
