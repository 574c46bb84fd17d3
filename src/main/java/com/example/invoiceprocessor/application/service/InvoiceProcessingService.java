package com.example.invoiceprocessor.application.service;

import com.example.invoiceprocessor.application.exception.PairingValidationException;
import com.example.invoiceprocessor.application.exception.PreviewValidationException;
import com.example.invoiceprocessor.application.extraction.FieldExtractorRegistry;
import com.example.invoiceprocessor.application.extraction.FormatDetector;
import com.example.invoiceprocessor.domain.exception.InvoiceFilesRequiredException;
import com.example.invoiceprocessor.domain.exception.NoProcessableFilesException;
import com.example.invoiceprocessor.domain.model.ExtractionResult;
import com.example.invoiceprocessor.domain.model.FilePair;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.InvoiceSummary;
import com.example.invoiceprocessor.domain.model.LineItem;
import com.example.invoiceprocessor.domain.model.NormalizationResult;
import com.example.invoiceprocessor.domain.model.PairingResult;
import com.example.invoiceprocessor.domain.model.PreviewResult;
import com.example.invoiceprocessor.domain.model.ProcessingResult;
import com.example.invoiceprocessor.domain.model.ProcessingWarning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Application service that runs the invoice pipeline: detection, extraction, normalization,
 * optional PDF/text combination, summary and CSV export.
 * <p>
 * Only requests that leave nothing to process fail; unreadable files, empty extractions and
 * unpaired PDFs are reported as warnings on the result.
 */
@Service
public class InvoiceProcessingService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceProcessingService.class);
    private static final String ALL_INVOICES = "ALL";

    private final FormatDetector formatDetector;
    private final FieldExtractorRegistry extractorRegistry;
    private final LineItemNormalizer normalizer;
    private final FilePairingService pairingService;
    private final LineItemCombiner combiner;
    private final InvoiceSummaryService summaryService;
    private final CsvExportService csvExportService;
    private final ProcessingSettings settings;

    public InvoiceProcessingService(FormatDetector formatDetector,
                                    FieldExtractorRegistry extractorRegistry,
                                    LineItemNormalizer normalizer,
                                    FilePairingService pairingService,
                                    LineItemCombiner combiner,
                                    InvoiceSummaryService summaryService,
                                    CsvExportService csvExportService,
                                    ProcessingSettings settings) {
        this.formatDetector = formatDetector;
        this.extractorRegistry = extractorRegistry;
        this.normalizer = normalizer;
        this.pairingService = pairingService;
        this.combiner = combiner;
        this.summaryService = summaryService;
        this.csvExportService = csvExportService;
        this.settings = settings;
    }

    /**
     * Processes an upload. PDFs are paired with companion files automatically.
     *
     * @param files         uploaded files
     * @param invoiceNumber optional invoice filter, may be {@code null} or blank
     * @return line items, summary, written CSV paths and warnings
     * @throws InvoiceFilesRequiredException when no file was supplied
     * @throws NoProcessableFilesException   when no supplied file is readable
     */
    public ProcessingResult process(List<InvoiceFile> files, String invoiceNumber) {
        if (files == null || files.isEmpty()) {
            throw new InvoiceFilesRequiredException();
        }
        RunState run = new RunState();
        List<InvoiceFile> readable = screen(files, run.warnings);
        if (readable.isEmpty()) {
            throw new NoProcessableFilesException(files.size());
        }
        PairingResult pairing = pairingService.resolvePairs(readable);
        flagUnpairedPdfs(pairing, run);
        return execute(pairing, invoiceNumber, run);
    }

    /**
     * Processes a pairing the caller has already confirmed.
     *
     * @param pairing       pairs and unmatched files
     * @param invoiceNumber optional invoice filter
     * @return processing result
     */
    public ProcessingResult processPairs(PairingResult pairing, String invoiceNumber) {
        List<InvoiceFile> all = pairing == null ? List.of() : filesOf(pairing);
        if (all.isEmpty()) {
            throw new InvoiceFilesRequiredException();
        }
        if (all.stream().noneMatch(InvoiceProcessingService::isReadable)) {
            throw new NoProcessableFilesException(all.size());
        }
        return execute(pairing, invoiceNumber, new RunState());
    }

    /**
     * Proposes PDF/text pairs for the readable files of an upload.
     *
     * @param files uploaded files
     * @return pairs plus unmatched files
     */
    public PairingResult resolvePairs(List<InvoiceFile> files) {
        if (files == null || files.isEmpty()) {
            throw new InvoiceFilesRequiredException();
        }
        List<InvoiceFile> readable = screen(files, new ArrayList<>());
        if (readable.isEmpty()) {
            throw new NoProcessableFilesException(files.size());
        }
        return pairingService.resolvePairs(readable);
    }

    /**
     * Builds the pairing a caller confirmed by file name. Files named in no pair stay unmatched.
     *
     * @param files          uploaded files
     * @param pdfToCompanion PDF file name to companion file name, in pair order
     * @return confirmed pairing, scored like a proposed one
     * @throws PairingValidationException when a name was not uploaded, a PDF is used as companion
     *                                    (or the reverse), or a file appears in two pairs
     */
    public PairingResult confirmPairs(List<InvoiceFile> files, Map<String, String> pdfToCompanion) {
        if (files == null || files.isEmpty()) {
            throw new InvoiceFilesRequiredException();
        }
        Map<String, InvoiceFile> byName = new LinkedHashMap<>();
        for (InvoiceFile file : files) {
            if (file != null && file.fileName() != null) {
                byName.putIfAbsent(file.fileName(), file);
            }
        }
        Set<String> used = new HashSet<>();
        List<FilePair> pairs = new ArrayList<>();
        pdfToCompanion.forEach((pdfName, txtName) -> {
            InvoiceFile pdf = uploaded(byName, pdfName);
            InvoiceFile txt = uploaded(byName, txtName);
            if (formatDetector.detect(pdf) != InputFormat.PDF_TEXT) {
                throw new PairingValidationException(pdfName + " is not a PDF.");
            }
            if (formatDetector.detect(txt) == InputFormat.PDF_TEXT) {
                throw new PairingValidationException(txtName + " is a PDF and cannot be a companion file.");
            }
            if (!used.add(pdfName) || !used.add(txtName)) {
                throw new PairingValidationException("A file may appear in one pair only.");
            }
            double score = FilePairingService.similarity(
                    FilePairingService.normalizeName(pdfName), FilePairingService.normalizeName(txtName));
            pairs.add(new FilePair(pdf, txt, score));
        });
        List<InvoiceFile> unmatched = byName.values().stream()
                .filter(file -> !used.contains(file.fileName()))
                .toList();
        log.info("Confirmed {} pair(s), {} unmatched file(s)", pairs.size(), unmatched.size());
        return new PairingResult(pairs, unmatched);
    }

    /**
     * Shows the detected format, columns and first rows of one file without normalizing it.
     *
     * @param file uploaded file
     * @return preview of the raw structure
     * @throws PreviewValidationException when the file is missing or empty
     */
    public PreviewResult preview(InvoiceFile file) {
        if (file == null || !isReadable(file)) {
            throw new PreviewValidationException("Please choose a non-empty file to preview.");
        }
        InputFormat format = formatDetector.detect(file);
        ExtractionResult extraction = extractorRegistry.extract(file, format);
        int sampleSize = Math.min(settings.previewSampleRows(), extraction.rows().size());
        log.info("Previewed {} as {} ({} row(s))", file.fileName(), format, extraction.rows().size());
        return new PreviewResult(
                file.fileName(),
                format,
                extraction.columns(),
                extraction.rows().subList(0, sampleSize),
                extraction.rows().size(),
                extraction.skippedRows(),
                extraction.warnings()
        );
    }

    private ProcessingResult execute(PairingResult pairing, String invoiceNumber, RunState run) {
        String filter = invoiceNumber == null || invoiceNumber.isBlank() ? null : invoiceNumber.trim();
        List<LineItem> merged = new ArrayList<>();
        for (FilePair pair : pairing.pairs()) {
            List<LineItem> pdfItems = parse(pair.pdf(), filter, run);
            List<LineItem> txtItems = parse(pair.txt(), filter, run);
            merged.addAll(combiner.combine(pdfItems, txtItems));
        }
        for (InvoiceFile file : pairing.unmatched()) {
            merged.addAll(parse(file, filter, run));
        }
        List<LineItem> items = merged.stream().map(LineItem::withGrossWeightFromNet).toList();
        boolean combined = !pairing.pairs().isEmpty();

        String label = summaryLabel(filter, items, run.invoiceHint);
        InvoiceSummary summary = summaryService.summarize(items, label);
        List<LineItem> aggregated = summaryService.aggregateBySku(items);

        Path outputDirectory = settings.outputDirectory();
        Path csvPath = csvExportService.writeCsv(items, outputDirectory,
                csvExportService.exportFileName(label, combined, false));
        Path aggregatedCsvPath = csvExportService.writeCsv(aggregated, outputDirectory,
                csvExportService.exportFileName(label, combined, true));

        log.info("Processed invoice {}: {} line(s), {} skipped, {} filtered, {} warning(s)",
                label, items.size(), run.skipped, run.filtered, run.warnings.size());
        return new ProcessingResult(items, aggregated, summary, csvPath, aggregatedCsvPath,
                run.skipped, run.filtered, run.warnings, combined);
    }

    private List<LineItem> parse(InvoiceFile file, String filter, RunState run) {
        if (!isReadable(file)) {
            run.warnings.add(unreadable(file));
            return List.of();
        }
        InputFormat format = formatDetector.detect(file);
        ExtractionResult extraction = extractorRegistry.extract(file, format);
        run.warnings.addAll(extraction.warnings());
        run.skipped += extraction.skippedRows();
        if (run.invoiceHint == null && format == InputFormat.PDF_TEXT) {
            run.invoiceHint = extraction.invoiceNumberHint();
        }

        NormalizationResult normalized = normalizer.normalize(extraction.rows(), format.sourceTag(), filter);
        run.skipped += normalized.skippedRows();
        run.filtered += normalized.filteredRows();
        log.debug("{}: {} raw row(s) -> {} line item(s)", file.fileName(), extraction.rows().size(),
                normalized.items().size());
        return normalized.items();
    }

    private void flagUnpairedPdfs(PairingResult pairing, RunState run) {
        List<InvoiceFile> unmatchedPdfs = pairing.unmatched().stream()
                .filter(file -> formatDetector.detect(file) == InputFormat.PDF_TEXT)
                .toList();
        boolean companionsUploaded = pairing.unmatched().size() > unmatchedPdfs.size() || !pairing.pairs().isEmpty();
        if (!companionsUploaded) {
            return;
        }
        for (InvoiceFile pdf : unmatchedPdfs) {
            log.warn("No companion file matched {}; processing it on its own", pdf.fileName());
            run.warnings.add(ProcessingWarning.pairingAmbiguous(pdf.fileName(),
                    "No companion text file matched this PDF; it was processed on its own."));
        }
    }

    private static List<InvoiceFile> screen(List<InvoiceFile> files, List<ProcessingWarning> warnings) {
        List<InvoiceFile> readable = new ArrayList<>();
        for (InvoiceFile file : files) {
            if (isReadable(file)) {
                readable.add(file);
            } else {
                warnings.add(unreadable(file));
            }
        }
        return readable;
    }

    private static boolean isReadable(InvoiceFile file) {
        return file != null && file.fileName() != null && !file.fileName().isBlank() && !file.isEmpty();
    }

    private static ProcessingWarning unreadable(InvoiceFile file) {
        String name = file == null || file.fileName() == null ? "" : file.fileName();
        log.warn("Skipping unreadable upload '{}'", name);
        return ProcessingWarning.inputFormat(name, "File has no name or no content and was skipped.");
    }

    private static InvoiceFile uploaded(Map<String, InvoiceFile> byName, String fileName) {
        InvoiceFile file = byName.get(fileName);
        if (file == null) {
            throw new PairingValidationException("No uploaded file is named " + fileName + ".");
        }
        return file;
    }

    private static List<InvoiceFile> filesOf(PairingResult pairing) {
        return Stream.concat(
                        pairing.pairs().stream().flatMap(pair -> Stream.of(pair.pdf(), pair.txt())),
                        pairing.unmatched().stream())
                .filter(Objects::nonNull)
                .toList();
    }

    private static String summaryLabel(String filter, List<LineItem> items, String invoiceHint) {
        if (filter != null) {
            return filter;
        }
        return items.stream()
                .map(LineItem::invoiceNumber)
                .filter(invoice -> !invoice.isEmpty())
                .findFirst()
                .orElse(invoiceHint == null || invoiceHint.isBlank() ? ALL_INVOICES : invoiceHint.trim());
    }

    /**
     * Counters and warnings of a single call.
     */
    private static final class RunState {
        private final List<ProcessingWarning> warnings = new ArrayList<>();
        private int skipped;
        private int filtered;
        private String invoiceHint;
    }
}
