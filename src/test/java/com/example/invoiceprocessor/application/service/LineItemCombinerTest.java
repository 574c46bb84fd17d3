package com.example.invoiceprocessor.application.service;

import com.example.invoiceprocessor.domain.model.LineItem;
import com.example.invoiceprocessor.domain.model.SourceTag;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineItemCombinerTest {

    private final LineItemCombiner combiner = new LineItemCombiner();

    @Test
    void textRowsWinAndPdfOnlyFillsGaps() {
        LineItem txt = item("A1", "", "", 0, "10", "0", SourceTag.TXT);
        LineItem pdf = item("a1", "8471.30", "Widget", 4, "99", "2.50", SourceTag.PDF);

        List<LineItem> combined = combiner.combine(List.of(pdf), List.of(txt));

        assertThat(combined).singleElement().satisfies(item -> {
            assertThat(item.sku()).isEqualTo("A1");
            assertThat(item.htsCode()).isEqualTo("8471.30");
            assertThat(item.description()).isEqualTo("Widget");
            assertThat(item.packageCount()).isEqualTo(4);
            assertThat(item.quantity()).isEqualByComparingTo("10");
            assertThat(item.unitPrice()).isEqualByComparingTo("2.50");
            assertThat(item.value()).isEqualByComparingTo("25.00");
            assertThat(item.sourceTag()).isEqualTo(SourceTag.COMBINED);
        });
    }

    @Test
    void donorFallsBackToHtsCodeAndUnmatchedTextRowsStayAsTheyAre() {
        LineItem byHts = item("", "7318.15", "", 0, "5", "0", SourceTag.TXT);
        LineItem unmatched = item("Z9", "", "", 0, "1", "0", SourceTag.TXT);
        LineItem htsDonor = item("", "7318.15", "Bolt", 0, "0", "0.10", SourceTag.PDF);
        LineItem otherDonor = item("K1", "9405.40", "Lamp", 0, "0", "3.00", SourceTag.PDF);

        List<LineItem> combined = combiner.combine(List.of(htsDonor, otherDonor), List.of(byHts, unmatched));

        assertThat(combined).extracting(LineItem::description).containsExactly("Bolt", "");
        assertThat(combined.get(0).unitPrice()).isEqualByComparingTo("0.10");
        assertThat(combined.get(1).unitPrice()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(combined.get(1).sourceTag()).isEqualTo(SourceTag.COMBINED);
    }

    @Test
    void presentTextValuesAreNeverOverwritten() {
        LineItem txt = item("A1", "8471.30", "Laptop", 1, "2", "500", SourceTag.TXT);
        LineItem pdf = item("A1", "9999.99", "Other", 7, "3", "1", SourceTag.PDF);

        LineItem combined = combiner.combine(List.of(pdf), List.of(txt)).get(0);

        assertThat(combined.htsCode()).isEqualTo("8471.30");
        assertThat(combined.description()).isEqualTo("Laptop");
        assertThat(combined.packageCount()).isEqualTo(1);
        assertThat(combined.value()).isEqualByComparingTo("1000.00");
    }

    @Test
    void pdfGrossWeightFillsTextRowThatOnlyHasNetWeight() {
        LineItem txt = LineItem.of("A1", "", "", "", 0, BigDecimal.ONE, new BigDecimal("5"), BigDecimal.ZERO,
                BigDecimal.ONE, "EA", "", SourceTag.TXT);
        LineItem pdf = LineItem.of("A1", "", "", "", 0, BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("7"),
                BigDecimal.ZERO, "EA", "", SourceTag.PDF);

        LineItem combined = combiner.combine(List.of(pdf), List.of(txt)).get(0);

        assertThat(combined.netWeightKg()).isEqualByComparingTo("5");
        assertThat(combined.grossWeightKg()).isEqualByComparingTo("7");
    }

    @Test
    void emptyTextSideReturnsPdfRowsUnchanged() {
        List<LineItem> pdfItems = List.of(item("A1", "8471.30", "Widget", 1, "2", "3", SourceTag.PDF));

        assertThat(combiner.combine(pdfItems, List.of())).containsExactlyElementsOf(pdfItems);
    }

    @Test
    void combiningACombinedSetWithNothingIsIdempotent() {
        List<LineItem> combined = combiner.combine(
                List.of(item("A1", "8471.30", "Widget", 1, "0", "3", SourceTag.PDF)),
                List.of(item("A1", "", "", 0, "2", "0", SourceTag.TXT)));

        assertThat(combiner.combine(combined, List.of())).containsExactlyElementsOf(combined);
        assertThat(combiner.combine(List.of(), combined)).containsExactlyElementsOf(combined);
    }

    private static LineItem item(String sku, String hts, String description, int packages, String quantity,
                                 String unitPrice, SourceTag tag) {
        return LineItem.of(sku, description, hts, "", packages, new BigDecimal(quantity), BigDecimal.ZERO,
                BigDecimal.ZERO, new BigDecimal(unitPrice), "EA", "", tag);
    }
}
