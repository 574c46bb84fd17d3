package com.example.invoiceprocessor;

import com.example.invoiceprocessor.application.extraction.FieldExtractorRegistry;
import com.example.invoiceprocessor.application.service.InvoiceProcessingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke test verifying the Spring context boots with every extractor registered.
 */
@SpringBootTest
class InvoiceProcessorApplicationTests {

	@Autowired
	private InvoiceProcessingService processingService;

	@Autowired
	private FieldExtractorRegistry extractorRegistry;

	/**
	 * Ensures the application context loads without throwing exceptions.
	 */
	@Test
	void contextLoads() {
		assertThat(processingService).isNotNull();
		assertThat(extractorRegistry).isNotNull();
	}

}
