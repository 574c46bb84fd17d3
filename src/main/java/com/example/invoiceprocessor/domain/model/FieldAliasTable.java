package com.example.invoiceprocessor.domain.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Versioned mapping from source column names to canonical fields.
 * Source layouts are added here instead of in the extractors; every canonical field also answers to
 * its own attribute name ({@code hts_code}) and CSV header ({@code HTS}).
 */
public final class FieldAliasTable {

    public static final String DEFAULT_VERSION = "2";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String version;
    private final Map<String, CanonicalField> aliases;

    private FieldAliasTable(String version, Map<String, CanonicalField> aliases) {
        this.version = version;
        this.aliases = Map.copyOf(aliases);
    }

    /**
     * Builds the table shipped with the application. Version 1 held the ERP export columns
     * (HTTS, C/N, PART, PART_DESC, AMT, WEIGHT, quantity, invoice_nbr); version 2 added the
     * broker and CSV-export spellings.
     *
     * @return default alias table
     */
    public static FieldAliasTable defaults() {
        Map<String, CanonicalField> table = new LinkedHashMap<>();
        register(table, CanonicalField.SKU, "PART", "SKU", "PART_NO", "PART NO", "PART_NUMBER", "PART NUMBER",
                "ITEM", "ITEM_NO", "MATERIAL");
        register(table, CanonicalField.DESCRIPTION, "PART_DESC", "DESCRIPTION", "DESC", "ITEM_DESC",
                "GOODS DESCRIPTION");
        register(table, CanonicalField.HTS_CODE, "HTTS", "HTS", "HTS_CODE", "HTS CODE", "HS_CODE", "HS CODE",
                "TARIFF", "TARIFF_CODE");
        register(table, CanonicalField.COUNTRY_OF_ORIGIN, "C/N", "COO", "COUNTRY", "ORIGIN",
                "COUNTRY_OF_ORIGIN", "COUNTRY OF ORIGIN");
        register(table, CanonicalField.PACKAGE_COUNT, "NO. OF PACKAGE", "NO. OF PACKAGES", "PACKAGES", "PKGS",
                "PACKAGE_COUNT", "CARTONS");
        register(table, CanonicalField.QUANTITY, "QUANTITY", "QTY");
        register(table, CanonicalField.NET_WEIGHT_KG, "WEIGHT", "NET_WEIGHT", "NET WEIGHT", "NET_WT", "NET_WEIGHT_KG");
        register(table, CanonicalField.GROSS_WEIGHT_KG, "GROSS_WEIGHT", "GROSS WEIGHT", "GROSS_WT",
                "GROSS_WEIGHT_KG");
        register(table, CanonicalField.UNIT_PRICE, "AMT", "UNIT_PRICE", "UNIT PRICE", "PRICE", "UNIT_COST");
        register(table, CanonicalField.VALUE, "VALUE", "EXT_AMT", "EXTENDED_VALUE", "LINE_TOTAL");
        register(table, CanonicalField.QTY_UNIT, "QTY_UNIT", "QTY UNIT", "UOM", "UNIT");
        register(table, CanonicalField.INVOICE_NUMBER, "INVOICE_NBR", "INVOICE_NUMBER", "INVOICE NUMBER",
                "INVOICE", "INVOICE_NO", "INV_NO");
        for (CanonicalField field : CanonicalField.values()) {
            table.putIfAbsent(normalizeKey(field.attributeName()), field);
            if (field.csvHeader() != null) {
                table.putIfAbsent(normalizeKey(field.csvHeader()), field);
            }
        }
        return new FieldAliasTable(DEFAULT_VERSION, table);
    }

    /**
     * Returns a copy of this table with extra aliases layered on top. Existing entries are overridden.
     *
     * @param newVersion version label of the extended table
     * @param extra      additional source names
     * @return new alias table
     */
    public FieldAliasTable extend(String newVersion, Map<String, CanonicalField> extra) {
        Map<String, CanonicalField> table = new LinkedHashMap<>(aliases);
        extra.forEach((alias, field) -> table.put(normalizeKey(alias), field));
        return new FieldAliasTable(newVersion, table);
    }

    public Optional<CanonicalField> resolve(String sourceKey) {
        if (sourceKey == null || sourceKey.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliases.get(normalizeKey(sourceKey)));
    }

    /**
     * Counts how many of the given source names map to a canonical field.
     *
     * @param sourceKeys header tokens or keys
     * @return number of recognised names
     */
    public int countKnown(Collection<String> sourceKeys) {
        return (int) sourceKeys.stream().filter(key -> resolve(key).isPresent()).count();
    }

    public String version() {
        return version;
    }

    public int size() {
        return aliases.size();
    }

    static String normalizeKey(String key) {
        return WHITESPACE.matcher(key.trim()).replaceAll(" ").toUpperCase(Locale.ROOT);
    }

    private static void register(Map<String, CanonicalField> table, CanonicalField field, String... names) {
        List.of(names).forEach(name -> table.put(normalizeKey(name), field));
    }
}
