package com.example.invoiceprocessor.interfaces.api;

import com.example.invoiceprocessor.application.exception.PreviewValidationException;
import com.example.invoiceprocessor.application.service.InvoiceProcessingService;
import com.example.invoiceprocessor.domain.exception.InvoiceFilesRequiredException;
import com.example.invoiceprocessor.domain.exception.NoProcessableFilesException;
import com.example.invoiceprocessor.domain.model.FilePair;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.InvoiceSummary;
import com.example.invoiceprocessor.domain.model.LineItem;
import com.example.invoiceprocessor.domain.model.PairingResult;
import com.example.invoiceprocessor.domain.model.PreviewResult;
import com.example.invoiceprocessor.domain.model.ProcessingResult;
import com.example.invoiceprocessor.domain.model.ProcessingWarning;
import com.example.invoiceprocessor.domain.model.RawRow;
import com.example.invoiceprocessor.domain.model.SourceTag;
import com.example.invoiceprocessor.infrastructure.exception.CsvWriteException;
import com.example.invoiceprocessor.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests for the invoice endpoints and their error mapping.
 */
@WebMvcTest(controllers = InvoiceProcessingController.class)
@Import(GlobalExceptionHandler.class)
class InvoiceProcessingControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InvoiceProcessingService processingService;

    /**
     * Verifies the processing response carries line items, summary and export file names.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void processReturnsResultAsJson() throws Exception {
        LineItem item = LineItem.of("SKU1", "Widget", "8471.30", "CN", 1, BigDecimal.TEN, BigDecimal.ONE,
                BigDecimal.ONE, new BigDecimal("2.50"), "EA", "INV-1", SourceTag.TXT);
        InvoiceSummary summary = new InvoiceSummary("INV-1", 1, BigDecimal.TEN, BigDecimal.ONE, BigDecimal.ONE,
                new BigDecimal("25.00"), 1, 1, Map.of("CN", 1), Map.of("8471.30", new BigDecimal("25.00")),
                Map.of("SKU1", BigDecimal.TEN));
        ProcessingResult result = new ProcessingResult(List.of(item), List.of(item), summary,
                Path.of("outputs", "20240305_101530_INV-1_processed.csv"),
                Path.of("outputs", "20240305_101530_INV-1_aggregated.csv"), 2, 1,
                List.of(ProcessingWarning.extraction("notes.txt", "No rows could be extracted.")), false);
        BDDMockito.given(processingService.process(anyList(), eq("INV-1"))).willReturn(result);

        mockMvc.perform(multipart("/api/process")
                        .file(new MockMultipartFile("files", "lines.txt", "text/plain", "PART\tHTTS".getBytes()))
                        .param("invoice_number", "INV-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lineItems[0].sku").value("SKU1"))
                .andExpect(jsonPath("$.lineItems[0].value").value(25.00))
                .andExpect(jsonPath("$.summary.invoiceNumber").value("INV-1"))
                .andExpect(jsonPath("$.csvFile").value("20240305_101530_INV-1_processed.csv"))
                .andExpect(jsonPath("$.aggregatedCsvFile").value("20240305_101530_INV-1_aggregated.csv"))
                .andExpect(jsonPath("$.skippedRowCount").value(2))
                .andExpect(jsonPath("$.warnings[0].kind").value("EXTRACTION"));
    }

    /**
     * Verifies multipart uploads reach the service with their names and bytes.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void uploadedFilesAreHandedOverAsInvoiceFiles() throws Exception {
        BDDMockito.given(processingService.resolvePairs(argThat(files -> files.size() == 2
                        && files.get(0).equals(InvoiceFile.of("invoice_100.pdf", "%PDF-".getBytes())))))
                .willReturn(new PairingResult(
                        List.of(new FilePair(InvoiceFile.of("invoice_100.pdf", "%PDF-".getBytes()),
                                InvoiceFile.of("invoice_100_data.txt", "x".getBytes()), 0.83)),
                        List.of()));

        mockMvc.perform(multipart("/api/pairs")
                        .file(new MockMultipartFile("files", "invoice_100.pdf", "application/pdf", "%PDF-".getBytes()))
                        .file(new MockMultipartFile("files", "invoice_100_data.txt", "text/plain", "x".getBytes())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pairs[0].pdf").value("invoice_100.pdf"))
                .andExpect(jsonPath("$.pairs[0].txt").value("invoice_100_data.txt"))
                .andExpect(jsonPath("$.pairs[0].score").value(0.83))
                .andExpect(jsonPath("$.unmatched").isEmpty());
    }

    @Test
    void confirmedPairsAreProcessed() throws Exception {
        InvoiceFile pdf = InvoiceFile.of("invoice_100.pdf", "%PDF-".getBytes());
        InvoiceFile txt = InvoiceFile.of("invoice_100_data.txt", "x".getBytes());
        PairingResult pairing = new PairingResult(List.of(new FilePair(pdf, txt, 0.83)), List.of());
        InvoiceSummary summary = new InvoiceSummary("ALL", 0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, 0, 0, Map.of(), Map.of(), Map.of());
        BDDMockito.given(processingService.confirmPairs(anyList(),
                        eq(Map.of("invoice_100.pdf", "invoice_100_data.txt"))))
                .willReturn(pairing);
        BDDMockito.given(processingService.processPairs(eq(pairing), eq("INV-100")))
                .willReturn(new ProcessingResult(List.of(), List.of(), summary,
                        Path.of("outputs", "20240305_101530_INV-100_combined_processed.csv"),
                        Path.of("outputs", "20240305_101530_INV-100_combined_aggregated.csv"), 0, 0, List.of(), true));

        mockMvc.perform(multipart("/api/process-pairs")
                        .file(new MockMultipartFile("files", "invoice_100.pdf", "application/pdf", "%PDF-".getBytes()))
                        .file(new MockMultipartFile("files", "invoice_100_data.txt", "text/plain", "x".getBytes()))
                        .param("pair", "invoice_100.pdf|invoice_100_data.txt")
                        .param("invoice_number", "INV-100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.combined").value(true))
                .andExpect(jsonPath("$.csvFile").value("20240305_101530_INV-100_combined_processed.csv"));
    }

    @Test
    void malformedPairMappedToBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/process-pairs")
                        .file(new MockMultipartFile("files", "invoice_100.pdf", "application/pdf", "%PDF-".getBytes()))
                        .param("pair", "invoice_100.pdf"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value(containsString("pdfName|companionName")));
    }

    @Test
    void previewReturnsSampleRows() throws Exception {
        PreviewResult preview = new PreviewResult("lines.csv", InputFormat.CSV, List.of("SKU", "HTS"),
                List.of(new RawRow(Map.of("SKU", "A1"))), 12, 0, List.of());
        BDDMockito.given(processingService.preview(any(InvoiceFile.class))).willReturn(preview);

        mockMvc.perform(multipart("/api/preview")
                        .file(new MockMultipartFile("file", "lines.csv", "text/csv", "SKU,HTS".getBytes())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.format").value("CSV"))
                .andExpect(jsonPath("$.columns[1]").value("HTS"))
                .andExpect(jsonPath("$.sampleRows[0].fields.SKU").value("A1"))
                .andExpect(jsonPath("$.totalRows").value(12));
    }

    /**
     * Verifies that a request without files translates to HTTP 400.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingFilesMappedToBadRequest() throws Exception {
        BDDMockito.given(processingService.process(anyList(), any()))
                .willThrow(new InvoiceFilesRequiredException());

        mockMvc.perform(multipart("/api/process"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"))
                .andExpect(jsonPath("$.path").value("/api/process"));
    }

    @Test
    void noProcessableFilesMappedToUnprocessableEntity() throws Exception {
        BDDMockito.given(processingService.process(anyList(), any()))
                .willThrow(new NoProcessableFilesException(3));

        mockMvc.perform(multipart("/api/process")
                        .file(new MockMultipartFile("files", "empty.txt", "text/plain", new byte[0])))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("NO_PROCESSABLE_FILES"))
                .andExpect(jsonPath("$.details.fileCount").value(3));
    }

    @Test
    void previewValidationMappedToBadRequest() throws Exception {
        BDDMockito.given(processingService.preview(any()))
                .willThrow(new PreviewValidationException("Please choose a non-empty file to preview."));

        mockMvc.perform(multipart("/api/preview"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(processingService.process(anyList(), any()))
                .willThrow(new CsvWriteException("Unable to write CSV", new IOException("disk full")));

        mockMvc.perform(multipart("/api/process")
                        .file(new MockMultipartFile("files", "lines.txt", "text/plain", "x".getBytes())))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }
}
