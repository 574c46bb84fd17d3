package com.example.invoiceprocessor.application.extraction;

import com.example.invoiceprocessor.domain.model.CanonicalField;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered regular expressions locating canonical fields in free text. Each field is matched
 * independently over the whole text; the first pattern that matches wins. Group 1 is the value.
 */
final class FieldPatternCatalog {

    private static final String NUMBER = "(\\d[\\d,]*(?:\\.\\d+)?)";
    private static final String CURRENCY = "(?:USD|US\\$|\\$)?\\s*";
    private static final String KG = "(?:\\(?KGS?\\)?)?";
    // yyyy.MM.dd; never read as an unlabelled HTS code
    private static final String DOTTED_DATE = "(?:19|20)\\d{2}\\.(?:0[1-9]|1[0-2])\\.(?:0[1-9]|[12]\\d|3[01])\\b";
    private static final String INLINE_END = "(?=\\s{2,}|[\\r\\n\\t]|$)";

    private static final Map<CanonicalField, List<Pattern>> PATTERNS = new EnumMap<>(CanonicalField.class);

    static {
        PATTERNS.put(CanonicalField.INVOICE_NUMBER, patterns(
                "\\b(\\d{3,}[A-Z]-\\d{8,})\\b",
                "\\b(\\d{3,}[A-Z]\\d{8,})\\b",
                "\\bINVOICE\\s*(?:NO\\.?|NUMBER|NBR|#)?\\s*[:#]?\\s*([A-Z0-9][A-Z0-9/-]*\\d[A-Z0-9/-]*)"));
        PATTERNS.put(CanonicalField.HTS_CODE, patterns(
                "\\b(?:HTTS|HTS|HS)(?:[\\s_]*CODE)?\\s*[:#=]?\\s*(\\d{4}(?:\\.\\d{2,4}){1,3}|\\d{6,10})\\b",
                "\\b(?!" + DOTTED_DATE + ")(\\d{4}\\.\\d{2}\\.\\d{2,4})\\b"));
        PATTERNS.put(CanonicalField.SKU, patterns(
                "\\b(?:PART|SKU|ITEM)(?:[\\s_]*(?:NO\\.?|NUMBER|#))?\\s*[:#=]\\s*([A-Z0-9][A-Z0-9._/-]*)",
                "\\*([A-Z0-9]{6,7})\\b"));
        PATTERNS.put(CanonicalField.DESCRIPTION, patterns(
                "\\b(?:PART_DESC|DESCRIPTION|DESC)\\s*[:=]\\s*([^\\r\\n\\t]+?)" + INLINE_END));
        PATTERNS.put(CanonicalField.COUNTRY_OF_ORIGIN, patterns(
                "\\b(?:COUNTRY\\s+OF\\s+ORIGIN|ORIGIN|COO)\\s*[:=]\\s*([A-Z][A-Z .]*?)(?=\\s{2,}|[\\r\\n\\t,;]|$)",
                "\\bC/N\\s*[:=]\\s*([A-Z]{2,3})\\b"));
        PATTERNS.put(CanonicalField.PACKAGE_COUNT, patterns(
                "\\b(?:NO\\.?\\s*OF\\s*PACKAGES?|PACKAGES|PKGS|CARTONS)\\s*[:=]?\\s*(\\d+)\\b"));
        PATTERNS.put(CanonicalField.QUANTITY, patterns(
                "\\b(?:QTY|QUANTITY)\\b\\.?\\s*[:=]?\\s*" + NUMBER));
        PATTERNS.put(CanonicalField.NET_WEIGHT_KG, patterns(
                "\\bNET\\s*(?:WEIGHT|WT)\\.?\\s*" + KG + "\\s*[:=]?\\s*" + NUMBER,
                "(?<!GROSS\\s)(?<!GROSS_)\\bWEIGHT\\s*" + KG + "\\s*[:=]\\s*" + NUMBER));
        PATTERNS.put(CanonicalField.GROSS_WEIGHT_KG, patterns(
                "\\bGROSS\\s*(?:WEIGHT|WT)\\.?\\s*" + KG + "\\s*[:=]?\\s*" + NUMBER));
        PATTERNS.put(CanonicalField.UNIT_PRICE, patterns(
                "\\b(?:UNIT\\s*PRICE|UNIT\\s*COST|PRICE|AMT)\\s*[:=]\\s*" + CURRENCY + NUMBER));
        PATTERNS.put(CanonicalField.VALUE, patterns(
                "\\b(?:TOTAL\\s*VALUE|LINE\\s*TOTAL|VALUE|TOTAL)\\s*[:=]\\s*" + CURRENCY + NUMBER));
        PATTERNS.put(CanonicalField.QTY_UNIT, patterns(
                "\\b(?:QTY[\\s_]*UNIT|UOM|UNIT\\s*OF\\s*MEASURE)\\s*[:=]\\s*([A-Z]{1,5})\\b"));
    }

    private FieldPatternCatalog() {
    }

    /**
     * Applies every field's patterns to the text.
     *
     * @param text whole document text
     * @return attribute name to matched value, in canonical field order; empty when nothing matched
     */
    static Map<String, String> extract(String text) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return fields;
        }
        PATTERNS.forEach((field, patterns) ->
                firstMatch(text, patterns).ifPresent(value -> fields.put(field.attributeName(), value)));
        return fields;
    }

    static Optional<String> findInvoiceNumber(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return firstMatch(text, PATTERNS.get(CanonicalField.INVOICE_NUMBER));
    }

    private static Optional<String> firstMatch(String text, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String value = matcher.group(1).trim();
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    private static List<Pattern> patterns(String... expressions) {
        return List.of(expressions).stream()
                .map(expression -> Pattern.compile(expression, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
