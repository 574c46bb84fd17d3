package com.example.invoiceprocessor.application.service;

import com.example.invoiceprocessor.domain.model.CanonicalField;
import com.example.invoiceprocessor.domain.model.LineItem;
import com.example.invoiceprocessor.infrastructure.exception.CsvWriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Application-layer service that serializes canonical line items into the customs CSV layout.
 * Output is deterministic for identical input; only the file name carries a timestamp.
 */
@Service
public class CsvExportService {

    private static final Logger log = LoggerFactory.getLogger(CsvExportService.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final String HEADER = CanonicalField.exportColumns().stream()
            .map(CanonicalField::csvHeader)
            .collect(Collectors.joining(","));
    private static final int MAX_NAME_ATTEMPTS = 100;

    private final Clock clock;

    /**
     * @param clock clock used to stamp export file names
     */
    public CsvExportService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the CSV document: header row followed by one row per line item, input order kept.
     *
     * @param items line items to export
     * @return CSV document as a string
     */
    public String buildCsv(List<LineItem> items) {
        StringBuilder builder = new StringBuilder();
        builder.append(HEADER).append('\n');
        for (LineItem item : items) {
            builder.append(escape(item.sku())).append(',')
                    .append(escape(item.description())).append(',')
                    .append(escape(item.htsCode())).append(',')
                    .append(escape(item.countryOfOrigin())).append(',')
                    .append(item.packageCount()).append(',')
                    .append(plain(item.quantity())).append(',')
                    .append(fixed(item.netWeightKg())).append(',')
                    .append(fixed(item.grossWeightKg())).append(',')
                    .append(fixed(item.unitPrice())).append(',')
                    .append(fixed(item.value())).append(',')
                    .append(escape(item.qtyUnit()))
                    .append('\n');
        }
        return builder.toString();
    }

    /**
     * Writes the CSV for the given rows into {@code directory}. An existing file is never
     * overwritten; a numeric suffix is appended instead.
     *
     * @param items     line items to export
     * @param directory destination directory, created when missing
     * @param fileName  preferred file name
     * @return path of the written file
     * @throws CsvWriteException when the file cannot be written
     */
    public Path writeCsv(List<LineItem> items, Path directory, String fileName) {
        String csv = buildCsv(items);
        try {
            Files.createDirectories(directory);
            for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
                Path target = directory.resolve(attempt == 0 ? fileName : withSuffix(fileName, attempt));
                try {
                    Files.writeString(target, csv, StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                    log.info("Wrote {} row(s) to {}", items.size(), target);
                    return target;
                } catch (FileAlreadyExistsException e) {
                    log.debug("{} already exists, trying another name", target);
                }
            }
        } catch (IOException e) {
            throw new CsvWriteException("Unable to write CSV " + fileName + " to " + directory, e);
        }
        throw new CsvWriteException("Unable to find a free file name for " + fileName + " in " + directory, null);
    }

    /**
     * Builds {@code {yyyyMMdd_HHmmss}_{invoice}_[combined_]{processed|aggregated}.csv}.
     *
     * @param invoiceLabel invoice number or {@code ALL}
     * @param combined     whether PDF/text pairs were merged
     * @param aggregated   whether the file holds the per-SKU aggregation
     * @return file name
     */
    public String exportFileName(String invoiceLabel, boolean combined, boolean aggregated) {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        return timestamp + "_" + safeLabel(invoiceLabel) + "_"
                + (combined ? "combined_" : "")
                + (aggregated ? "aggregated" : "processed") + ".csv";
    }

    static String safeLabel(String invoiceLabel) {
        String label = invoiceLabel == null || invoiceLabel.isBlank() ? "ALL" : invoiceLabel.trim();
        label = label.replace('/', '-').replace('\\', '-').replace(' ', '_');
        return UNSAFE_FILE_CHARS.matcher(label).replaceAll("_");
    }

    private static String withSuffix(String fileName, int attempt) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0
                ? fileName + "_" + attempt
                : fileName.substring(0, dot) + "_" + attempt + fileName.substring(dot);
    }

    private static String fixed(BigDecimal value) {
        return value.setScale(LineItem.MONEY_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    private static String plain(BigDecimal value) {
        return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
    }

    /**
     * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
     *
     * @param value raw column value
     * @return sanitized CSV-safe token
     */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n") || sanitized.contains("\r")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
