package com.example.invoiceprocessor.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Canonical invoice line item shared by the aggregator and the CSV exporter.
 * <p>
 * {@code value} is always derived from {@code quantity * unitPrice} (HALF_UP, two decimals); whatever
 * the caller passes for it is replaced. Text fields are never {@code null}, numeric fields never
 * negative, and {@code qtyUnit} defaults to {@value #DEFAULT_QTY_UNIT}.
 */
public record LineItem(
        String sku,
        String description,
        String htsCode,
        String countryOfOrigin,
        int packageCount,
        BigDecimal quantity,
        BigDecimal netWeightKg,
        BigDecimal grossWeightKg,
        BigDecimal unitPrice,
        BigDecimal value,
        String qtyUnit,
        String invoiceNumber,
        SourceTag sourceTag
) {

    public static final String DEFAULT_QTY_UNIT = "EA";
    public static final int MONEY_SCALE = 2;

    public LineItem {
        sku = text(sku);
        description = text(description);
        htsCode = text(htsCode);
        countryOfOrigin = text(countryOfOrigin);
        packageCount = Math.max(packageCount, 0);
        quantity = nonNegative(quantity);
        netWeightKg = nonNegative(netWeightKg);
        grossWeightKg = nonNegative(grossWeightKg);
        unitPrice = nonNegative(unitPrice);
        value = computeValue(quantity, unitPrice);
        qtyUnit = qtyUnit == null || qtyUnit.isBlank() ? DEFAULT_QTY_UNIT : qtyUnit.trim().toUpperCase(Locale.ROOT);
        invoiceNumber = text(invoiceNumber);
        sourceTag = sourceTag == null ? SourceTag.TXT : sourceTag;
    }

    /**
     * Builds a line item without a value argument; the value is derived.
     */
    public static LineItem of(String sku,
                              String description,
                              String htsCode,
                              String countryOfOrigin,
                              int packageCount,
                              BigDecimal quantity,
                              BigDecimal netWeightKg,
                              BigDecimal grossWeightKg,
                              BigDecimal unitPrice,
                              String qtyUnit,
                              String invoiceNumber,
                              SourceTag sourceTag) {
        return new LineItem(sku, description, htsCode, countryOfOrigin, packageCount, quantity,
                netWeightKg, grossWeightKg, unitPrice, null, qtyUnit, invoiceNumber, sourceTag);
    }

    public static BigDecimal computeValue(BigDecimal quantity, BigDecimal unitPrice) {
        return nonNegative(quantity).multiply(nonNegative(unitPrice)).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public LineItem withSourceTag(SourceTag tag) {
        if (tag == sourceTag) {
            return this;
        }
        return new LineItem(sku, description, htsCode, countryOfOrigin, packageCount, quantity,
                netWeightKg, grossWeightKg, unitPrice, value, qtyUnit, invoiceNumber, tag);
    }

    /**
     * @return this item, or a copy whose missing gross weight is taken from the net weight
     */
    public LineItem withGrossWeightFromNet() {
        if (grossWeightKg.signum() != 0 || netWeightKg.signum() == 0) {
            return this;
        }
        return new LineItem(sku, description, htsCode, countryOfOrigin, packageCount, quantity,
                netWeightKg, netWeightKg, unitPrice, value, qtyUnit, invoiceNumber, sourceTag);
    }

    /**
     * @return {@code true} when neither a SKU nor an HTS code identifies the row
     */
    public boolean lacksIdentity() {
        return sku.isEmpty() && htsCode.isEmpty();
    }

    private static String text(String value) {
        return value == null ? "" : value.trim();
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value;
    }
}
