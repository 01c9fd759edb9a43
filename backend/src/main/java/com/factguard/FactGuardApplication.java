package com.factguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FactGuard - validation pipeline for AI-generated responses.
 */
@SpringBootApplication
public class FactGuardApplication {

	public static void main(String[] args) {
		SpringApplication.run(FactGuardApplication.class, args);
	}

}
