package com.searchcollector.controller;

import com.searchcollector.service.SearchApiClient;
import com.searchcollector.service.StructuredExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check endpoints
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SearchApiClient searchApiClient;
    private final StructuredExtractor structuredExtractor;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> status = new HashMap<>();

        status.put("status", "UP");
        status.put("search", searchApiClient.isAvailable() ? "UP" : "NOT_CONFIGURED");
        status.put("llm", structuredExtractor.isAvailable() ? "UP" : "NOT_CONFIGURED");

        return ResponseEntity.ok(status);
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of(
                "application", "Search Collector",
                "version", "1.0.0",
                "status", "running"
        ));
    }
}
