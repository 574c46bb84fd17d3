package com.example.invoiceprocessor.domain.model;

import java.util.List;

/**
 * Output of the pairing resolver: accepted pairs in resolution order plus every file left alone.
 */
public record PairingResult(List<FilePair> pairs, List<InvoiceFile> unmatched) {

    public PairingResult {
        pairs = pairs == null ? List.of() : List.copyOf(pairs);
        unmatched = unmatched == null ? List.of() : List.copyOf(unmatched);
    }
}
