package com.example.invoiceprocessor.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one processing request (partial-success model: warnings travel with the data).
 *
 * @param lineItems          final line items in output order
 * @param aggregatedItems    the same rows grouped by SKU
 * @param summary            aggregate statistics over {@code lineItems}
 * @param csvPath            written canonical CSV
 * @param aggregatedCsvPath  written SKU-aggregated CSV
 * @param skippedRowCount    structural skips plus rows without identity
 * @param filteredRowCount   rows excluded by the invoice-number filter
 * @param warnings           per-file warnings
 * @param combined           whether at least one PDF/text pair was merged
 */
public record ProcessingResult(
        List<LineItem> lineItems,
        List<LineItem> aggregatedItems,
        InvoiceSummary summary,
        Path csvPath,
        Path aggregatedCsvPath,
        int skippedRowCount,
        int filteredRowCount,
        List<ProcessingWarning> warnings,
        boolean combined
) {

    public ProcessingResult {
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
        aggregatedItems = aggregatedItems == null ? List.of() : List.copyOf(aggregatedItems);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
