package com.example.invoiceprocessor.application.service;

import java.nio.file.Path;

/**
 * Tunable constants of the processing pipeline, bound from {@code invoice.*} properties.
 *
 * @param outputDirectory     directory receiving generated CSV files
 * @param minMatchingColumns  known header tokens a tab-separated text file needs to count as structured
 * @param pairingThreshold    minimum filename similarity for a PDF/text pair
 * @param topHtsLimit         number of HTS codes kept in the summary ranking
 * @param previewSampleRows   rows returned by a preview
 */
public record ProcessingSettings(
        Path outputDirectory,
        int minMatchingColumns,
        double pairingThreshold,
        int topHtsLimit,
        int previewSampleRows
) {

    public static final int DEFAULT_MIN_MATCHING_COLUMNS = 3;
    public static final double DEFAULT_PAIRING_THRESHOLD = 0.6;
    public static final int DEFAULT_TOP_HTS_LIMIT = 10;
    public static final int DEFAULT_PREVIEW_SAMPLE_ROWS = 5;

    public ProcessingSettings {
        if (minMatchingColumns < 1) {
            throw new IllegalArgumentException("minMatchingColumns must be positive");
        }
        if (pairingThreshold < 0 || pairingThreshold > 1) {
            throw new IllegalArgumentException("pairingThreshold must be within [0, 1]");
        }
        if (topHtsLimit < 1 || previewSampleRows < 1) {
            throw new IllegalArgumentException("topHtsLimit and previewSampleRows must be positive");
        }
    }

    public static ProcessingSettings defaults(Path outputDirectory) {
        return new ProcessingSettings(outputDirectory, DEFAULT_MIN_MATCHING_COLUMNS, DEFAULT_PAIRING_THRESHOLD,
                DEFAULT_TOP_HTS_LIMIT, DEFAULT_PREVIEW_SAMPLE_ROWS);
    }
}
