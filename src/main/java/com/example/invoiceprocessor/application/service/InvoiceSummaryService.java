package com.example.invoiceprocessor.application.service;

import com.example.invoiceprocessor.domain.model.InvoiceSummary;
import com.example.invoiceprocessor.domain.model.LineItem;
import com.example.invoiceprocessor.domain.model.SourceTag;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes summary statistics and the per-SKU aggregation over a final line-item collection.
 * Both are pure functions of their input.
 */
@Service
public class InvoiceSummaryService {

    private static final int DERIVED_PRICE_SCALE = 4;

    private static final Comparator<Map.Entry<String, BigDecimal>> BY_VALUE_THEN_CODE =
            Map.Entry.<String, BigDecimal>comparingByValue().reversed()
                    .thenComparing(Map.Entry.<String, BigDecimal>comparingByKey());

    private final int topHtsLimit;

    public InvoiceSummaryService(ProcessingSettings settings) {
        this.topHtsLimit = settings.topHtsLimit();
    }

    /**
     * Summarizes the given rows.
     *
     * @param items         final line items
     * @param invoiceNumber label reported on the summary
     * @return summary; money and weight totals carry two decimals
     */
    public InvoiceSummary summarize(List<LineItem> items, String invoiceNumber) {
        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal netWeight = BigDecimal.ZERO;
        BigDecimal grossWeight = BigDecimal.ZERO;
        BigDecimal value = BigDecimal.ZERO;
        Set<String> htsCodes = new HashSet<>();
        Map<String, Integer> countries = new LinkedHashMap<>();
        Map<String, BigDecimal> valueByHts = new LinkedHashMap<>();
        Map<String, BigDecimal> quantityBySku = new LinkedHashMap<>();

        for (LineItem item : items) {
            quantity = quantity.add(item.quantity());
            netWeight = netWeight.add(item.netWeightKg());
            grossWeight = grossWeight.add(item.grossWeightKg());
            value = value.add(item.value());
            if (!item.htsCode().isEmpty()) {
                htsCodes.add(item.htsCode());
                valueByHts.merge(item.htsCode(), item.value(), BigDecimal::add);
            }
            if (!item.countryOfOrigin().isEmpty()) {
                countries.merge(item.countryOfOrigin(), 1, Integer::sum);
            }
            if (!item.sku().isEmpty()) {
                quantityBySku.merge(item.sku(), item.quantity(), BigDecimal::add);
            }
        }

        Map<String, BigDecimal> topHtsCodes = new LinkedHashMap<>();
        valueByHts.entrySet().stream()
                .sorted(BY_VALUE_THEN_CODE)
                .limit(topHtsLimit)
                .forEach(entry -> topHtsCodes.put(entry.getKey(), money(entry.getValue())));

        return new InvoiceSummary(
                invoiceNumber,
                items.size(),
                quantity,
                money(netWeight),
                money(grossWeight),
                money(value),
                htsCodes.size(),
                quantityBySku.size(),
                countries,
                topHtsCodes,
                quantityBySku
        );
    }

    /**
     * Groups rows by SKU in first-seen order. Rows without a SKU are grouped by HTS code instead.
     * Quantities, weights, packages and values are summed, text fields come from the first row of
     * each group and the unit price is re-derived as total value divided by total quantity.
     *
     * @param items final line items
     * @return one line item per SKU, plus one per HTS code among rows without a SKU
     */
    public List<LineItem> aggregateBySku(List<LineItem> items) {
        Map<GroupKey, SkuGroup> groups = new LinkedHashMap<>();
        for (LineItem item : items) {
            groups.computeIfAbsent(GroupKey.of(item), key -> new SkuGroup(item)).add(item);
        }
        List<LineItem> aggregated = new ArrayList<>(groups.size());
        groups.values().forEach(group -> aggregated.add(group.toLineItem()));
        return aggregated;
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(LineItem.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private record GroupKey(String sku, String htsCode) {

        static GroupKey of(LineItem item) {
            return item.sku().isEmpty() ? new GroupKey("", item.htsCode()) : new GroupKey(item.sku(), "");
        }
    }

    private static final class SkuGroup {

        private final LineItem first;
        private int packages;
        private BigDecimal quantity = BigDecimal.ZERO;
        private BigDecimal netWeight = BigDecimal.ZERO;
        private BigDecimal grossWeight = BigDecimal.ZERO;
        private BigDecimal value = BigDecimal.ZERO;
        private SourceTag sourceTag;

        private SkuGroup(LineItem first) {
            this.first = first;
            this.sourceTag = first.sourceTag();
        }

        private void add(LineItem item) {
            packages += item.packageCount();
            quantity = quantity.add(item.quantity());
            netWeight = netWeight.add(item.netWeightKg());
            grossWeight = grossWeight.add(item.grossWeightKg());
            value = value.add(item.value());
            if (item.sourceTag() != sourceTag) {
                sourceTag = SourceTag.COMBINED;
            }
        }

        private LineItem toLineItem() {
            BigDecimal unitPrice = quantity.signum() > 0
                    ? value.divide(quantity, DERIVED_PRICE_SCALE, RoundingMode.HALF_UP)
                    : first.unitPrice();
            return LineItem.of(first.sku(), first.description(), first.htsCode(), first.countryOfOrigin(), packages,
                    quantity, netWeight, grossWeight, unitPrice, first.qtyUnit(), first.invoiceNumber(), sourceTag);
        }
    }
}
