package com.example.invoiceprocessor.application.exception;

/**
 * Base unchecked exception for failures in the application layer.
 * Application services throw subclasses of this type to signal use-case errors without
 * coupling to the transport layer.
 */
public abstract class ApplicationException extends RuntimeException {

    /**
     * @param message human readable error description suitable for surfacing to the caller
     */
    protected ApplicationException(String message) {
        super(message);
    }
}
