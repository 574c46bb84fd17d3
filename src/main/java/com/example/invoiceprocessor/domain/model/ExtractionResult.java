package com.example.invoiceprocessor.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw rows pulled out of one file by a field extractor, before normalization.
 *
 * @param fileName           original file name
 * @param format             detected input format
 * @param columns            source column names in first-seen order
 * @param rows               extracted rows
 * @param skippedRows        rows dropped because their token count did not match the header
 * @param warnings           per-file warnings raised during extraction
 * @param invoiceNumberHint  invoice number spotted in free text or PDF metadata, or {@code null}
 */
public record ExtractionResult(
        String fileName,
        InputFormat format,
        List<String> columns,
        List<RawRow> rows,
        int skippedRows,
        List<ProcessingWarning> warnings,
        String invoiceNumberHint
) {

    public ExtractionResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Builds an empty result carrying a single extraction warning.
     */
    public static ExtractionResult failed(String fileName, InputFormat format, String message) {
        return new ExtractionResult(fileName, format, List.of(), List.of(), 0,
                List.of(ProcessingWarning.extraction(fileName, message)), null);
    }

    /**
     * Returns a copy with an extra warning appended.
     */
    public ExtractionResult withWarning(ProcessingWarning warning) {
        List<ProcessingWarning> merged = new ArrayList<>(warnings);
        merged.add(warning);
        return new ExtractionResult(fileName, format, columns, rows, skippedRows, merged, invoiceNumberHint);
    }
}
