package com.example.invoiceprocessor.domain.model;

import java.util.List;

/**
 * Raw structure of a single file, shown before the caller commits to processing it.
 */
public record PreviewResult(
        String fileName,
        InputFormat format,
        List<String> columns,
        List<RawRow> sampleRows,
        int totalRows,
        int skippedRows,
        List<ProcessingWarning> warnings
) {

    public PreviewResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        sampleRows = sampleRows == null ? List.of() : List.copyOf(sampleRows);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
