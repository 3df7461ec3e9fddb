package com.datainsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DataInsight - sentiment, text statistics and data-format analysis service.
 */
@SpringBootApplication
public class DataInsightApplication {

	public static void main(String[] args) {
		SpringApplication.run(DataInsightApplication.class, args);
	}

}
