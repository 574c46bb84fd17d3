package com.example.invoiceprocessor.application.extraction;

import com.example.invoiceprocessor.domain.model.ExtractionResult;
import com.example.invoiceprocessor.domain.model.InputFormat;
import com.example.invoiceprocessor.domain.model.InvoiceFile;
import com.example.invoiceprocessor.domain.model.RawRow;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class UnstructuredTextExtractorTest {

    private final UnstructuredTextExtractor extractor = new UnstructuredTextExtractor();

    @Test
    void freeTextYieldsSingleRowWithMatchedFields() {
        String text = "Commercial invoice\n"
                + "Invoice No: 074M-22005749\n"
                + "HTS: 8471.30\n"
                + "QTY: 3\n";

        ExtractionResult result = extractor.extract(file("mail.txt", text), InputFormat.UNSTRUCTURED_TEXT);

        assertThat(result.rows()).hasSize(1);
        RawRow row = result.rows().get(0);
        assertThat(row.get("hts_code")).isEqualTo("8471.30");
        assertThat(row.get("quantity")).isEqualTo("3");
        assertThat(row.get("invoice_number")).isEqualTo("074M-22005749");
        assertThat(result.invoiceNumberHint()).isEqualTo("074M-22005749");
    }

    @Test
    void fieldOrderInTheTextDoesNotMatter() {
        ExtractionResult result = extractor.extract(file("mail.txt", "Shipped QTY: 3 units, HTS: 8471.30."),
                InputFormat.UNSTRUCTURED_TEXT);

        assertThat(result.rows()).singleElement().satisfies(row -> {
            assertThat(row.get("hts_code")).isEqualTo("8471.30");
            assertThat(row.get("quantity")).isEqualTo("3");
        });
    }

    @Test
    void dottedDatesAreNotTakenForTariffCodes() {
        ExtractionResult dated = extractor.extract(file("mail.txt", "Ship date 2025.10.21\nCartons 3\n"),
                InputFormat.UNSTRUCTURED_TEXT);
        ExtractionResult both = extractor.extract(
                file("mail.txt", "Ship date 2025.10.21\nCartons 3, tariff 8471.30.0000\n"),
                InputFormat.UNSTRUCTURED_TEXT);

        assertThat(dated.rows()).singleElement().satisfies(row -> {
            assertThat(row.get("hts_code")).isNull();
            assertThat(row.get("package_count")).isEqualTo("3");
        });
        assertThat(both.rows()).singleElement()
                .satisfies(row -> assertThat(row.get("hts_code")).isEqualTo("8471.30.0000"));
    }

    @Test
    void labelledFieldsAreMatchedCaseInsensitively() {
        String text = "part no: AB-100\n"
                + "Description: Steel bracket\n"
                + "Country of origin: Vietnam\n"
                + "Net weight (kg): 12.5\n"
                + "Gross weight: 13.0\n"
                + "Unit price: $4.20\n";

        RawRow row = extractor.extract(file("note.txt", text), InputFormat.UNSTRUCTURED_TEXT).rows().get(0);

        assertThat(row.get("sku")).isEqualTo("AB-100");
        assertThat(row.get("description")).isEqualTo("Steel bracket");
        assertThat(row.get("country_of_origin")).isEqualTo("Vietnam");
        assertThat(row.get("net_weight_kg")).isEqualTo("12.5");
        assertThat(row.get("gross_weight_kg")).isEqualTo("13.0");
        assertThat(row.get("unit_price")).isEqualTo("4.20");
    }

    @Test
    void textWithoutRecognisedFieldsHasNoRows() {
        ExtractionResult result = extractor.extract(file("mail.txt", "Thanks, see you next week."),
                InputFormat.UNSTRUCTURED_TEXT);

        assertThat(result.rows()).isEmpty();
        assertThat(result.invoiceNumberHint()).isNull();
    }

    @Test
    void fallbackInvoiceIsUsedWhenTextHasNone() {
        ExtractionResult result = extractor.extractFromText("scan.pdf", InputFormat.PDF_TEXT, "HTS: 8471.30",
                "INV-77");

        assertThat(result.rows().get(0).get("invoice_number")).isEqualTo("INV-77");
        assertThat(result.invoiceNumberHint()).isEqualTo("INV-77");
    }

    private static InvoiceFile file(String name, String content) {
        return InvoiceFile.of(name, content.getBytes(StandardCharsets.UTF_8));
    }
}
