package com.example.invoice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the invoice extraction service.
 * Only wires the application context; the HTTP endpoints live under the interfaces layer.
 */
@SpringBootApplication
public class InvoiceExtractionApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(InvoiceExtractionApplication.class, args);
	}

}
