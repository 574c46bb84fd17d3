package com.example.invoiceprocessor.application.service;

import com.example.invoiceprocessor.domain.model.LineItem;
import com.example.invoiceprocessor.domain.model.SourceTag;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the CSV exporter.
 */
class CsvExportServiceTest {

    private static final String HEADER =
            "SKU,DESCRIPTION,HTS,COUNTRY OF ORIGIN,NO. OF PACKAGE,QUANTITY,NET WEIGHT,GROSS WEIGHT,UNIT PRICE,VALUE,QTY UNIT\n";

    private final CsvExportService csvExportService =
            new CsvExportService(Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC));

    @Test
    void buildCsvWritesFixedColumnsAndFormatsNumbers() {
        LineItem widget = LineItem.of("A1", "Widget, large", "8471.30", "CN", 2, new BigDecimal("10.000"),
                new BigDecimal("5"), new BigDecimal("5.5"), new BigDecimal("2.5"), "ea", "INV-1", SourceTag.TXT);
        LineItem quoted = LineItem.of("B2", "12\" pipe", "", "", 0, new BigDecimal("1.25"),
                BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("4"), "M", "", SourceTag.CSV);

        String csv = csvExportService.buildCsv(List.of(widget, quoted));

        assertThat(csv).isEqualTo(HEADER
                + "A1,\"Widget, large\",8471.30,CN,2,10,5.00,5.50,2.50,25.00,EA\n"
                + "B2,\"12\"\" pipe\",,,0,1.25,0.00,0.00,4.00,5.00,M\n");
    }

    @Test
    void emptyInputProducesHeaderOnly() {
        assertThat(csvExportService.buildCsv(List.of())).isEqualTo(HEADER);
    }

    @Test
    void fileNamesCarryTimestampLabelAndKind() {
        assertThat(csvExportService.exportFileName("INV/1 A", false, false))
                .isEqualTo("20240305_101530_INV-1_A_processed.csv");
        assertThat(csvExportService.exportFileName("074M-22005749", true, false))
                .isEqualTo("20240305_101530_074M-22005749_combined_processed.csv");
        assertThat(csvExportService.exportFileName(null, true, true))
                .isEqualTo("20240305_101530_ALL_combined_aggregated.csv");
        assertThat(csvExportService.exportFileName("ALL", false, true))
                .isEqualTo("20240305_101530_ALL_aggregated.csv");
    }

    @Test
    void writeCsvNeverOverwritesExistingFiles(@TempDir Path tempDir) throws IOException {
        List<LineItem> items = List.of(LineItem.of("A1", "", "", "", 0, BigDecimal.ONE, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ONE, "", "", SourceTag.TXT));
        Path outputDir = tempDir.resolve("outputs");

        Path first = csvExportService.writeCsv(items, outputDir, "run.csv");
        Path second = csvExportService.writeCsv(items, outputDir, "run.csv");

        assertThat(first.getFileName().toString()).isEqualTo("run.csv");
        assertThat(second.getFileName().toString()).isEqualTo("run_1.csv");
        assertThat(Files.readString(second, StandardCharsets.UTF_8))
                .isEqualTo(HEADER + "A1,,,,0,1,0.00,0.00,1.00,1.00,EA\n");
    }
}
