package com.searchcollector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Search Collector - web search content acquisition service
 *
 * Runs a search query, reads every result page through a reader proxy
 * (falling back to a direct fetch) and turns each page into a structured
 * record with an LLM.
 */
@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class SearchCollectorApplication {

    public static void main(String[] args) {
        log.info("Starting Search Collector");
        SpringApplication.run(SearchCollectorApplication.class, args);
        log.info("✅ Search Collector started successfully!");
    }
}
