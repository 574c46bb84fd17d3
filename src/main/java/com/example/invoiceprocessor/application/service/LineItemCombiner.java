package com.example.invoiceprocessor.application.service;

import com.example.invoiceprocessor.domain.model.LineItem;
import com.example.invoiceprocessor.domain.model.SourceTag;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Merges the normalized rows of a PDF/text pair.
 * <p>
 * When the text side produced rows it is authoritative: PDF rows only fill fields that are empty or
 * zero on a text row and never overwrite a present value. When the text side produced nothing the
 * PDF rows are returned untouched.
 */
@Service
public class LineItemCombiner {

    /**
     * @param pdfItems rows parsed from the PDF
     * @param txtItems rows parsed from the companion text file
     * @return merged rows; text-derived rows are tagged {@link SourceTag#COMBINED}
     */
    public List<LineItem> combine(List<LineItem> pdfItems, List<LineItem> txtItems) {
        if (txtItems == null || txtItems.isEmpty()) {
            return pdfItems == null ? List.of() : List.copyOf(pdfItems);
        }
        List<LineItem> donors = pdfItems == null ? List.of() : pdfItems;
        return txtItems.stream()
                .map(txt -> findDonor(txt, donors)
                        .map(donor -> backfill(txt, donor))
                        .orElseGet(() -> txt.withSourceTag(SourceTag.COMBINED)))
                .toList();
    }

    /**
     * Picks the PDF row describing the same line: same SKU, else same HTS code.
     */
    private Optional<LineItem> findDonor(LineItem txt, List<LineItem> donors) {
        return first(donors, pdf -> !txt.sku().isEmpty() && txt.sku().equalsIgnoreCase(pdf.sku()))
                .or(() -> first(donors, pdf -> !txt.htsCode().isEmpty() && txt.htsCode().equals(pdf.htsCode())));
    }

    private static Optional<LineItem> first(List<LineItem> items, Predicate<LineItem> condition) {
        return items.stream().filter(condition).findFirst();
    }

    private static LineItem backfill(LineItem txt, LineItem pdf) {
        return LineItem.of(
                text(txt.sku(), pdf.sku()),
                text(txt.description(), pdf.description()),
                text(txt.htsCode(), pdf.htsCode()),
                text(txt.countryOfOrigin(), pdf.countryOfOrigin()),
                txt.packageCount() > 0 ? txt.packageCount() : pdf.packageCount(),
                number(txt.quantity(), pdf.quantity()),
                number(txt.netWeightKg(), pdf.netWeightKg()),
                number(txt.grossWeightKg(), pdf.grossWeightKg()),
                number(txt.unitPrice(), pdf.unitPrice()),
                txt.qtyUnit(),
                text(txt.invoiceNumber(), pdf.invoiceNumber()),
                SourceTag.COMBINED
        );
    }

    private static String text(String preferred, String fallback) {
        return preferred.isEmpty() ? fallback : preferred;
    }

    private static BigDecimal number(BigDecimal preferred, BigDecimal fallback) {
        return preferred.signum() == 0 ? fallback : preferred;
    }
}
