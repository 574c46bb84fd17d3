package com.example.invoiceprocessor.application.service;

import com.example.invoiceprocessor.domain.model.CanonicalField;
import com.example.invoiceprocessor.domain.model.FieldAliasTable;
import com.example.invoiceprocessor.domain.model.LineItem;
import com.example.invoiceprocessor.domain.model.NormalizationResult;
import com.example.invoiceprocessor.domain.model.RawRow;
import com.example.invoiceprocessor.domain.model.SourceTag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps raw rows onto the canonical {@link LineItem} schema.
 * <p>
 * Absent or unparsable numbers become zero and absent text becomes an empty string. A missing gross
 * weight stays zero here so that a paired PDF can still supply it. Rows that carry
 * neither a SKU nor an HTS code are dropped and counted. Rows outside the requested invoice are
 * excluded without being treated as errors.
 */
@Service
public class LineItemNormalizer {

    private static final Logger log = LoggerFactory.getLogger(LineItemNormalizer.class);
    private static final Set<String> EMPTY_MARKERS = Set.of("N/A", "NA", "NULL", "NAN", "NONE", "-");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9,.\\-]");
    private static final Pattern COMMA_THOUSANDS = Pattern.compile("\\d{1,3}(,\\d{3})+");
    private static final Pattern DOT_THOUSANDS = Pattern.compile("\\d{1,3}(\\.\\d{3}){2,}");
    private static final int DERIVED_PRICE_SCALE = 4;

    private final FieldAliasTable aliasTable;

    public LineItemNormalizer(FieldAliasTable aliasTable) {
        this.aliasTable = aliasTable;
    }

    /**
     * Normalizes a batch of raw rows.
     *
     * @param rows          raw rows in source order
     * @param sourceTag     tag stamped on every produced line item
     * @param invoiceFilter optional invoice number; when present only matching rows are kept
     * @return line items plus skipped/filtered tallies
     */
    public NormalizationResult normalize(List<RawRow> rows, SourceTag sourceTag, String invoiceFilter) {
        String filter = invoiceFilter == null || invoiceFilter.isBlank() ? null : invoiceFilter.trim();
        List<LineItem> items = new ArrayList<>();
        int skipped = 0;
        int filtered = 0;
        for (RawRow row : rows) {
            LineItem item = toLineItem(row, sourceTag);
            if (filter != null && !filter.equalsIgnoreCase(item.invoiceNumber())) {
                filtered++;
                continue;
            }
            if (item.lacksIdentity()) {
                log.debug("Dropping row without SKU and HTS code: {}", row.fields());
                skipped++;
                continue;
            }
            items.add(item);
        }
        return new NormalizationResult(items, skipped, filtered);
    }

    /**
     * Normalizes a single row, or returns empty when it has no identity.
     *
     * @param row       raw row
     * @param sourceTag tag stamped on the line item
     * @return line item or empty when the row lacks both SKU and HTS code
     */
    public Optional<LineItem> normalize(RawRow row, SourceTag sourceTag) {
        LineItem item = toLineItem(row, sourceTag);
        return item.lacksIdentity() ? Optional.empty() : Optional.of(item);
    }

    private LineItem toLineItem(RawRow row, SourceTag sourceTag) {
        Map<CanonicalField, String> values = canonicalValues(row);

        BigDecimal quantity = parseDecimal(values.get(CanonicalField.QUANTITY));
        BigDecimal unitPrice = parseDecimal(values.get(CanonicalField.UNIT_PRICE));
        BigDecimal sourceValue = parseDecimal(values.get(CanonicalField.VALUE));
        if (unitPrice.signum() == 0 && sourceValue.signum() > 0 && quantity.signum() > 0) {
            unitPrice = sourceValue.divide(quantity, DERIVED_PRICE_SCALE, RoundingMode.HALF_UP);
        }
        BigDecimal netWeight = parseDecimal(values.get(CanonicalField.NET_WEIGHT_KG));
        BigDecimal grossWeight = parseDecimal(values.get(CanonicalField.GROSS_WEIGHT_KG));

        return LineItem.of(
                values.get(CanonicalField.SKU),
                values.get(CanonicalField.DESCRIPTION),
                values.get(CanonicalField.HTS_CODE),
                values.get(CanonicalField.COUNTRY_OF_ORIGIN),
                parseCount(values.get(CanonicalField.PACKAGE_COUNT)),
                quantity,
                netWeight,
                grossWeight,
                unitPrice,
                values.get(CanonicalField.QTY_UNIT),
                values.get(CanonicalField.INVOICE_NUMBER),
                sourceTag
        );
    }

    /**
     * Resolves source keys through the alias table; the first non-empty value per field wins.
     */
    private Map<CanonicalField, String> canonicalValues(RawRow row) {
        Map<CanonicalField, String> values = new EnumMap<>(CanonicalField.class);
        row.fields().forEach((key, rawValue) -> aliasTable.resolve(key).ifPresent(field -> {
            String cleaned = cleanText(rawValue);
            if (!cleaned.isEmpty()) {
                values.putIfAbsent(field, cleaned);
            }
        }));
        return values;
    }

    static String cleanText(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return EMPTY_MARKERS.contains(trimmed.toUpperCase(Locale.ROOT)) ? "" : trimmed;
    }

    /**
     * Parses a decimal without relying on the JVM locale. When both separators occur the right-most
     * one is the decimal point; a lone comma followed by three-digit groups is a thousands separator,
     * any other lone comma is a decimal comma.
     *
     * @param raw source text, may carry currency symbols or units
     * @return parsed value, or zero for missing, unparsable or negative input
     */
    static BigDecimal parseDecimal(String raw) {
        if (raw == null || raw.isBlank()) {
            return BigDecimal.ZERO;
        }
        String trimmed = raw.trim();
        BigDecimal direct = tryParse(trimmed);
        if (direct != null) {
            return direct.signum() < 0 ? BigDecimal.ZERO : direct;
        }
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            return BigDecimal.ZERO;
        }
        String digits = NON_NUMERIC.matcher(trimmed).replaceAll("");
        if (digits.isEmpty() || digits.startsWith("-")) {
            return BigDecimal.ZERO;
        }
        int lastComma = digits.lastIndexOf(',');
        int lastDot = digits.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            digits = lastComma > lastDot
                    ? digits.replace(".", "").replace(',', '.')
                    : digits.replace(",", "");
        } else if (lastComma >= 0) {
            digits = COMMA_THOUSANDS.matcher(digits).matches()
                    ? digits.replace(",", "")
                    : digits.replace(',', '.');
        } else if (DOT_THOUSANDS.matcher(digits).matches()) {
            digits = digits.replace(".", "");
        }
        BigDecimal parsed = tryParse(digits);
        if (parsed == null) {
            log.debug("Unparsable numeric value '{}' treated as 0", raw);
            return BigDecimal.ZERO;
        }
        return parsed.signum() < 0 ? BigDecimal.ZERO : parsed;
    }

    static int parseCount(String raw) {
        BigDecimal value = parseDecimal(raw);
        if (value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            return Integer.MAX_VALUE;
        }
        return value.setScale(0, RoundingMode.DOWN).intValue();
    }

    private static BigDecimal tryParse(String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
