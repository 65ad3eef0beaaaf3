package com.finbrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * FinBrain - hybrid transaction categorization and advice over a local classifier and a remote AI Brain.
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync(proxyTargetClass = true)
public class FinBrainApplication {

	public static void main(String[] args) {
		SpringApplication.run(FinBrainApplication.class, args);
	}

}
