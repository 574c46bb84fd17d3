package com.example.invoiceprocessor.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record as it came out of a source file: source-specific field names mapped to raw strings.
 * Key order follows the source; lookups ignore case.
 */
public record RawRow(Map<String, String> fields) {

    public RawRow {
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Looks up a value by source field name, ignoring case and surrounding whitespace.
     *
     * @param name source field name
     * @return raw value or {@code null} when the row has no such field
     */
    public String get(String name) {
        if (name == null) {
            return null;
        }
        String value = fields.get(name);
        if (value != null) {
            return value;
        }
        String wanted = name.trim();
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            if (entry.getKey().trim().equalsIgnoreCase(wanted)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
