package com.example.invoiceprocessor.infrastructure.config;

import com.example.invoiceprocessor.application.service.ProcessingSettings;
import com.example.invoiceprocessor.domain.model.FieldAliasTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the pipeline settings, the alias table and the clock used for export file names.
 */
@Configuration
public class InvoiceProcessingConfig {

    private static final Logger log = LoggerFactory.getLogger(InvoiceProcessingConfig.class);

    @Bean
    public ProcessingSettings processingSettings(
            @Value("${invoice.output-dir:outputs}") String outputDir,
            @Value("${invoice.detection.min-matching-columns:3}") int minMatchingColumns,
            @Value("${invoice.pairing.similarity-threshold:0.6}") double pairingThreshold,
            @Value("${invoice.summary.top-hts-limit:10}") int topHtsLimit,
            @Value("${invoice.preview.sample-rows:5}") int previewSampleRows) {
        ProcessingSettings settings = new ProcessingSettings(Path.of(outputDir), minMatchingColumns,
                pairingThreshold, topHtsLimit, previewSampleRows);
        log.info("Invoice processing settings: {}", settings);
        return settings;
    }

    @Bean
    public FieldAliasTable fieldAliasTable() {
        FieldAliasTable table = FieldAliasTable.defaults();
        log.info("Loaded field alias table v{} with {} aliases", table.version(), table.size());
        return table;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
