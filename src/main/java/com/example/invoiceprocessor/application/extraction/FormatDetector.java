package com.example.invoiceprocessor.application.extraction;

import com.example.invoiceprocessor.application.service.ProcessingSettings;
import com.example.invoiceprocessor.domain.model.FieldAliasTable;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies an upload by extension and content sniffing. Never throws: text that does not look
 * like a tab-separated table falls back to {@link InputFormat#UNSTRUCTURED_TEXT}.
 */
@Service
public class FormatDetector {

    private static final Logger log = LoggerFactory.getLogger(FormatDetector.class);
    private static final int SAMPLE_BYTES = 64 * 1024;
    private static final int SAMPLE_LINES = 50;
    private static final Pattern TAB = Pattern.compile("\t");
    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F', '-'};

    private final FieldAliasTable aliasTable;
    private final int minMatchingColumns;

    public FormatDetector(FieldAliasTable aliasTable, ProcessingSettings settings) {
        this.aliasTable = aliasTable;
        this.minMatchingColumns = settings.minMatchingColumns();
    }

    /**
     * Detects the format of one uploaded file.
     *
     * @param file upload tuple
     * @return detected format
     */
    public InputFormat detect(InvoiceFile file) {
        String type = file.extension().isEmpty() ? file.declaredType() : file.extension();
        if ("pdf".equals(type) || hasPdfMagic(file.content())) {
            return InputFormat.PDF_TEXT;
        }
        if ("csv".equals(type)) {
            return InputFormat.CSV;
        }
        String sample = TextContentDecoder.decodeSample(file.content(), SAMPLE_BYTES);
        InputFormat format = looksStructured(sample) ? InputFormat.STRUCTURED_TEXT : InputFormat.UNSTRUCTURED_TEXT;
        log.debug("Detected {} for {}", format, file.fileName());
        return format;
    }

    /**
     * Checks for a tab-separated header with enough known columns, followed by a data line of the
     * same width, or for tab-separated {@code KEY=VALUE} lines with enough known keys.
     *
     * @param sample decoded leading text of the file
     * @return {@code true} when the text should go through the structured extractor
     */
    boolean looksStructured(String sample) {
        List<String> lines = sample.lines()
                .filter(line -> !line.isBlank())
                .limit(SAMPLE_LINES)
                .toList();
        if (lines.isEmpty()) {
            return false;
        }
        List<String> header = splitTabs(lines.get(0));
        if (header.size() < 2) {
            return false;
        }
        if (isKeyed(header)) {
            List<String> keys = header.stream()
                    .map(token -> token.substring(0, token.indexOf('=')))
                    .toList();
            return aliasTable.countKnown(keys) >= minMatchingColumns;
        }
        if (aliasTable.countKnown(header) < minMatchingColumns) {
            return false;
        }
        return lines.stream()
                .skip(1)
                .anyMatch(line -> splitTabs(line).size() == header.size());
    }

    static boolean isKeyed(List<String> tokens) {
        List<String> nonEmpty = tokens.stream().filter(token -> !token.isEmpty()).toList();
        return !nonEmpty.isEmpty() && nonEmpty.stream().allMatch(token -> token.indexOf('=') > 0);
    }

    private static List<String> splitTabs(String line) {
        return Arrays.stream(TAB.split(line, -1)).map(String::trim).toList();
    }

    private static boolean hasPdfMagic(byte[] content) {
        if (content.length < PDF_MAGIC.length) {
            return false;
        }
        return Arrays.equals(Arrays.copyOf(content, PDF_MAGIC.length), PDF_MAGIC);
    }
}
