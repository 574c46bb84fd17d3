package com.example.invoiceprocessor.domain.exception;

/**
 * Base type for request-level failures of the invoice engine.
 * Only conditions that leave nothing to process are raised; per-file and per-row problems are
 * returned as warnings instead.
 */
public abstract class DomainException extends RuntimeException {

    /**
     * Creates a domain exception with a descriptive failure message.
     *
     * @param message explanation of why the request cannot be processed
     */
    protected DomainException(String message) {
        super(message);
    }
}
