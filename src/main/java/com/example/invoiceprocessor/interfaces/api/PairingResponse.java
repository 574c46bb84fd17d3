package com.example.invoiceprocessor.interfaces.api;

import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.PairingResult;

import java.util.List;

/**
 * JSON view of proposed PDF/text pairs; file contents are never echoed back.
 */
public record PairingResponse(List<FilePairView> pairs, List<String> unmatched) {

    public record FilePairView(String pdf, String txt, double score) {
    }

    public static PairingResponse from(PairingResult result) {
        List<FilePairView> pairs = result.pairs().stream()
                .map(pair -> new FilePairView(pair.pdf().fileName(), pair.txt().fileName(), pair.score()))
                .toList();
        List<String> unmatched = result.unmatched().stream()
                .map(InvoiceFile::fileName)
                .toList();
        return new PairingResponse(pairs, unmatched);
    }
}
