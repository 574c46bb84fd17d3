package com.example.invoiceprocessor.application.extraction;

import com.example.invoiceprocessor.domain.model.ExtractionResult;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.ProcessingWarning;
import com.example.invoiceprocessor.domain.model.RawRow;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extracts delimiter-separated rows: CSV uploads (comma, double-quote quoting) and tab-separated
 * text exports. The first record is the header; a record whose width differs from the header's is
 * skipped and counted. Files made of {@code KEY=VALUE} tokens carry their own field names on every line.
 */
@Service
public final class StructuredTextExtractor implements FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructuredTextExtractor.class);

    private static final CSVFormat COMMA_FORMAT = CSVFormat.DEFAULT.builder()
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();
    private static final CSVFormat TAB_FORMAT = CSVFormat.TDF.builder()
            .setQuote(null)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    @Override
    public Set<InputFormat> supportedFormats() {
        return EnumSet.of(InputFormat.CSV, InputFormat.STRUCTURED_TEXT);
    }

    @Override
    public ExtractionResult extract(InvoiceFile file, InputFormat format) {
        String text = TextContentDecoder.decode(file.content());
        CSVFormat csvFormat = usesTabs(format, text) ? TAB_FORMAT : COMMA_FORMAT;

        Set<String> columns = new LinkedHashSet<>();
        List<RawRow> rows = new ArrayList<>();
        List<ProcessingWarning> warnings = new ArrayList<>();
        int skipped = 0;

        try (CSVParser parser = csvFormat.parse(new StringReader(text))) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                return ExtractionResult.failed(file.fileName(), format, "File contains no header line.");
            }
            List<String> header = records.next().toList();
            boolean keyed = FormatDetector.isKeyed(header);
            if (keyed) {
                skipped += addKeyedRow(header, columns, rows) ? 0 : 1;
            } else {
                header.stream().filter(name -> !name.isEmpty()).forEach(columns::add);
            }
            while (records.hasNext()) {
                CSVRecord record = records.next();
                List<String> tokens = record.toList();
                if (keyed) {
                    if (!addKeyedRow(tokens, columns, rows)) {
                        log.debug("Skipping line {} of {}: not a KEY=VALUE line", record.getRecordNumber(), file.fileName());
                        skipped++;
                    }
                } else if (tokens.size() != header.size()) {
                    log.debug("Skipping line {} of {}: {} tokens, header has {}",
                            record.getRecordNumber(), file.fileName(), tokens.size(), header.size());
                    skipped++;
                } else {
                    rows.add(toRow(header, tokens));
                }
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            log.warn("Stopped reading {} after {} rows: {}", file.fileName(), rows.size(), e.getMessage());
            warnings.add(ProcessingWarning.extraction(file.fileName(),
                    "File is malformed after " + rows.size() + " row(s); the rest was ignored."));
        }

        if (skipped > 0) {
            log.info("Skipped {} malformed row(s) in {}", skipped, file.fileName());
        }
        return new ExtractionResult(file.fileName(), format, List.copyOf(columns), rows, skipped, warnings, null);
    }

    private static boolean usesTabs(InputFormat format, String text) {
        if (format == InputFormat.STRUCTURED_TEXT) {
            return true;
        }
        String firstLine = text.lines().filter(line -> !line.isBlank()).findFirst().orElse("");
        return firstLine.indexOf('\t') >= 0 && firstLine.indexOf(',') < 0;
    }

    private static RawRow toRow(List<String> header, List<String> tokens) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i);
            if (!name.isEmpty()) {
                fields.put(name, tokens.get(i));
            }
        }
        return new RawRow(fields);
    }

    /**
     * Parses a line of {@code KEY=VALUE} tokens.
     *
     * @return {@code false} when the line contains a token without a key
     */
    private static boolean addKeyedRow(List<String> tokens, Set<String> columns, List<RawRow> rows) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            int separator = token.indexOf('=');
            if (separator <= 0) {
                return false;
            }
            fields.put(token.substring(0, separator).trim(), token.substring(separator + 1).trim());
        }
        if (fields.isEmpty()) {
            return false;
        }
        columns.addAll(fields.keySet());
        rows.add(new RawRow(fields));
        return true;
    }
}
