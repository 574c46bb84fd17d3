package com.example.invoiceprocessor.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Attributes of the canonical line-item schema every source converges to.
 * The declaration order of the exported fields is the CSV column order.
 */
public enum CanonicalField {
    SKU("SKU"),
    DESCRIPTION("DESCRIPTION"),
    HTS_CODE("HTS"),
    COUNTRY_OF_ORIGIN("COUNTRY OF ORIGIN"),
    PACKAGE_COUNT("NO. OF PACKAGE"),
    QUANTITY("QUANTITY"),
    NET_WEIGHT_KG("NET WEIGHT"),
    GROSS_WEIGHT_KG("GROSS WEIGHT"),
    UNIT_PRICE("UNIT PRICE"),
    VALUE("VALUE"),
    QTY_UNIT("QTY UNIT"),
    INVOICE_NUMBER(null);

    private static final List<CanonicalField> EXPORT_COLUMNS = Arrays.stream(values())
            .filter(field -> field.csvHeader != null)
            .toList();

    private final String csvHeader;

    CanonicalField(String csvHeader) {
        this.csvHeader = csvHeader;
    }

    /**
     * @return header text used in the CSV export, {@code null} for fields that are not exported
     */
    public String csvHeader() {
        return csvHeader;
    }

    /**
     * @return snake-case attribute name, e.g. {@code net_weight_kg}
     */
    public String attributeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return exported fields in CSV column order
     */
    public static List<CanonicalField> exportColumns() {
        return EXPORT_COLUMNS;
    }
}
