package com.example.invoiceprocessor.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only aggregate over a final line-item collection. Map iteration order is meaningful:
 * {@code countries} and {@code quantityBySku} follow first appearance, {@code topHtsCodes} is ranked.
 */
public record InvoiceSummary(
        String invoiceNumber,
        int totalLines,
        BigDecimal totalQuantity,
        BigDecimal totalNetWeight,
        BigDecimal totalGrossWeight,
        BigDecimal totalValue,
        int uniqueHtsCodes,
        int uniqueSkus,
        Map<String, Integer> countries,
        Map<String, BigDecimal> topHtsCodes,
        Map<String, BigDecimal> quantityBySku
) {

    public InvoiceSummary {
        countries = freeze(countries);
        topHtsCodes = freeze(topHtsCodes);
        quantityBySku = freeze(quantityBySku);
    }

    private static <V> Map<String, V> freeze(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
