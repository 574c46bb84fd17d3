package com.example.invoiceprocessor.domain.model;

import java.util.List;

/**
 * Line items produced from a batch of raw rows.
 *
 * @param items        normalized rows, source order preserved
 * @param skippedRows  rows dropped for lacking both SKU and HTS code
 * @param filteredRows rows excluded by the invoice-number filter (not errors)
 */
public record NormalizationResult(List<LineItem> items, int skippedRows, int filteredRows) {

    public NormalizationResult {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
