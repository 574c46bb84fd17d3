package com.example.invoiceprocessor.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldAliasTableTest {

    private final FieldAliasTable table = FieldAliasTable.defaults();

    @Test
    void resolvesErpExportColumnsIgnoringCaseAndSpacing() {
        assertThat(table.resolve("HTTS")).contains(CanonicalField.HTS_CODE);
        assertThat(table.resolve("c/n")).contains(CanonicalField.COUNTRY_OF_ORIGIN);
        assertThat(table.resolve(" part_desc ")).contains(CanonicalField.DESCRIPTION);
        assertThat(table.resolve("AMT")).contains(CanonicalField.UNIT_PRICE);
        assertThat(table.resolve("quantity")).contains(CanonicalField.QUANTITY);
        assertThat(table.resolve("WEIGHT")).contains(CanonicalField.NET_WEIGHT_KG);
        assertThat(table.resolve("country   of  origin")).contains(CanonicalField.COUNTRY_OF_ORIGIN);
    }

    @Test
    void resolvesAttributeNamesAndCsvHeaders() {
        for (CanonicalField field : CanonicalField.values()) {
            assertThat(table.resolve(field.attributeName())).contains(field);
        }
        assertThat(table.resolve("NO. OF PACKAGE")).contains(CanonicalField.PACKAGE_COUNT);
        assertThat(table.resolve("UNIT PRICE")).contains(CanonicalField.UNIT_PRICE);
    }

    @Test
    void unknownAndBlankKeysDoNotResolve() {
        assertThat(table.resolve("REMARKS")).isEmpty();
        assertThat(table.resolve("  ")).isEmpty();
        assertThat(table.resolve(null)).isEmpty();
        assertThat(table.countKnown(List.of("PART", "REMARKS", "HTTS", "AMT"))).isEqualTo(3);
    }

    @Test
    void extendAddsAliasesWithoutTouchingTheOriginal() {
        FieldAliasTable extended = table.extend("3", Map.of("Artikelnummer", CanonicalField.SKU));

        assertThat(extended.version()).isEqualTo("3");
        assertThat(extended.resolve("ARTIKELNUMMER")).contains(CanonicalField.SKU);
        assertThat(extended.size()).isEqualTo(table.size() + 1);
        assertThat(table.resolve("Artikelnummer")).isEmpty();
        assertThat(table.version()).isEqualTo(FieldAliasTable.DEFAULT_VERSION);
    }
}
