package com.searchcollector.controller;

import com.searchcollector.model.CollectResult;
import com.searchcollector.service.CollectorService;
import com.searchcollector.service.ReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Collection endpoints
 */
@Slf4j
@RestController
@RequestMapping("/api/collect")
@RequiredArgsConstructor
public class CollectController {

    private final CollectorService collectorService;
    private final ReportFormatter reportFormatter;

    /**
     * Structured records for a query. A failed search is reported as 502
     * with the same body so callers can read the reason.
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CollectResult> collect(@RequestParam("q") String query) {
        CollectResult result = collectorService.collect(query);
        if (result.isUpstreamFailed()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(@RequestParam("q") String query) {
        CollectResult result = collectorService.collect(query);
        String report = reportFormatter.format(result);
        if (result.isUpstreamFailed()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(report);
        }
        return ResponseEntity.ok(report);
    }
}
