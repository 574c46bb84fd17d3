package com.example.invoiceprocessor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point. Only wires the application context; the HTTP endpoints live under the
 * interfaces layer and the pipeline under the application layer.
 */
@SpringBootApplication
public class InvoiceProcessorApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(InvoiceProcessorApplication.class, args);
	}

}
