package com.example.invoiceprocessor.interfaces.api;

import com.example.invoiceprocessor.application.exception.PairingValidationException;
import com.example.invoiceprocessor.application.service.InvoiceProcessingService;
import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.PairingResult;
import com.example.invoiceprocessor.domain.model.PreviewResult;
import com.example.invoiceprocessor.domain.model.ProcessingResult;
import com.example.invoiceprocessor.infrastructure.exception.UploadReadException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interfaces-layer controller exposing invoice processing, preview and pairing as JSON endpoints.
 */
@Controller
public class InvoiceProcessingController {

    private static final String PAIR_SEPARATOR = "|";

    private final InvoiceProcessingService processingService;

    /**
     * @param processingService application service running the invoice pipeline
     */
    public InvoiceProcessingController(InvoiceProcessingService processingService) {
        this.processingService = processingService;
    }

    /**
     * Processes the uploaded invoice files and writes the CSV exports.
     *
     * @param files         uploaded PDF, text or CSV files (optional so an empty upload reaches the service)
     * @param invoiceNumber optional invoice filter
     * @return line items, summary and export file names
     */
    @PostMapping(value = "/api/process", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ProcessingResponse> process(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                                      @RequestParam(value = "invoice_number", required = false) String invoiceNumber) {
        ProcessingResult result = processingService.process(toInvoiceFiles(files), invoiceNumber);
        return ResponseEntity.ok(ProcessingResponse.from(result));
    }

    /**
     * Shows the detected format and first rows of a single file.
     *
     * @param file uploaded file
     * @return preview of the raw structure
     */
    @PostMapping(value = "/api/preview", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<PreviewResult> preview(@RequestParam(value = "file", required = false) MultipartFile file) {
        InvoiceFile invoiceFile = file == null ? null : toInvoiceFile(file);
        return ResponseEntity.ok(processingService.preview(invoiceFile));
    }

    /**
     * Proposes PDF/text pairs without processing them.
     *
     * @param files uploaded files
     * @return pairs and unmatched file names
     */
    @PostMapping(value = "/api/pairs", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<PairingResponse> pairs(@RequestParam(value = "files", required = false) List<MultipartFile> files) {
        return ResponseEntity.ok(PairingResponse.from(processingService.resolvePairs(toInvoiceFiles(files))));
    }

    /**
     * Processes the uploaded files with the pairs the caller confirmed after {@code /api/pairs}.
     *
     * @param files         uploaded files
     * @param pairs         confirmed pairs as {@code pdfName|companionName}
     * @param invoiceNumber optional invoice filter
     * @return line items, summary and export file names
     */
    @PostMapping(value = "/api/process-pairs", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ProcessingResponse> processPairs(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                                           @RequestParam(value = "pair", required = false) List<String> pairs,
                                                           @RequestParam(value = "invoice_number", required = false) String invoiceNumber) {
        PairingResult pairing = processingService.confirmPairs(toInvoiceFiles(files), toAssignment(pairs));
        return ResponseEntity.ok(ProcessingResponse.from(processingService.processPairs(pairing, invoiceNumber)));
    }

    private static Map<String, String> toAssignment(List<String> pairs) {
        Map<String, String> assignment = new LinkedHashMap<>();
        if (pairs == null) {
            return assignment;
        }
        for (String pair : pairs) {
            int separator = pair.indexOf(PAIR_SEPARATOR);
            if (separator <= 0 || separator == pair.length() - 1) {
                throw new PairingValidationException("Pairs must be given as pdfName|companionName, got: " + pair);
            }
            String pdfName = pair.substring(0, separator).trim();
            if (assignment.putIfAbsent(pdfName, pair.substring(separator + 1).trim()) != null) {
                throw new PairingValidationException(pdfName + " appears in more than one pair.");
            }
        }
        return assignment;
    }

    private static List<InvoiceFile> toInvoiceFiles(List<MultipartFile> files) {
        List<InvoiceFile> invoiceFiles = new ArrayList<>();
        if (files != null) {
            files.forEach(file -> invoiceFiles.add(toInvoiceFile(file)));
        }
        return invoiceFiles;
    }

    private static InvoiceFile toInvoiceFile(MultipartFile file) {
        try {
            return InvoiceFile.of(file.getOriginalFilename(), file.getBytes());
        } catch (IOException e) {
            throw new UploadReadException("Failed to read upload " + file.getOriginalFilename(), e);
        }
    }
}
