package com.example.invoiceprocessor.interfaces.api;

import com.example.invoiceprocessor.domain.model.InvoiceSummary;
import com.example.invoiceprocessor.domain.model.LineItem;
import com.example.invoiceprocessor.domain.model.ProcessingResult;
import com.example.invoiceprocessor.domain.model.ProcessingWarning;

import java.nio.file.Path;
import java.util.List;

/**
 * JSON view of a processing run. Output files are reported by name only.
 */
public record ProcessingResponse(
        List<LineItem> lineItems,
        List<LineItem> aggregatedItems,
        InvoiceSummary summary,
        String csvFile,
        String aggregatedCsvFile,
        int skippedRowCount,
        int filteredRowCount,
        List<ProcessingWarning> warnings,
        boolean combined
) {

    public static ProcessingResponse from(ProcessingResult result) {
        return new ProcessingResponse(
                result.lineItems(),
                result.aggregatedItems(),
                result.summary(),
                fileName(result.csvPath()),
                fileName(result.aggregatedCsvPath()),
                result.skippedRowCount(),
                result.filteredRowCount(),
                result.warnings(),
                result.combined()
        );
    }

    private static String fileName(Path path) {
        return path == null ? null : path.getFileName().toString();
    }
}
