package com.searchcollector.controller;

import com.searchcollector.model.CollectResult;
import com.searchcollector.model.StructuredRecord;
import com.searchcollector.service.CollectorService;
import com.searchcollector.service.ReportFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CollectControllerTest {

    @Mock
    private CollectorService collectorService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new CollectController(collectorService, new ReportFormatter()))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Collected records are returned as JSON")
    void collect() throws Exception {
        StructuredRecord record = StructuredRecord.builder()
                .valid(true)
                .title("Spring Boot")
                .summary("Intro")
                .keyPoints(List.of("auto-configuration"))
                .codeSnippets(List.of())
                .sourceUrl("https://spring.io")
                .build();
        when(collectorService.collect("spring")).thenReturn(
                CollectResult.builder().query("spring").records(List.of(record)).build());

        mockMvc.perform(get("/api/collect").param("q", "spring"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("spring"))
                .andExpect(jsonPath("$.records[0].title").value("Spring Boot"))
                .andExpect(jsonPath("$.upstreamFailed").value(false));
    }

    @Test
    @DisplayName("A failed search answers 502 with the reason")
    void upstreamFailure() throws Exception {
        when(collectorService.collect("spring"))
                .thenReturn(CollectResult.upstreamFailure("spring", "Search API returned HTTP 401", 3));

        mockMvc.perform(get("/api/collect").param("q", "spring"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.upstreamFailed").value(true))
                .andExpect(jsonPath("$.failureReason").value("Search API returned HTTP 401"));
    }

    @Test
    @DisplayName("The report endpoint returns the plain-text digest")
    void report() throws Exception {
        when(collectorService.collect("spring")).thenReturn(CollectResult.builder().query("spring").build());

        mockMvc.perform(get("/api/collect/report").param("q", "spring"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("No usable web information")));
    }

    @Test
    @DisplayName("A blank query is a bad request")
    void blankQuery() throws Exception {
        when(collectorService.collect(" ")).thenThrow(new IllegalArgumentException("query is required"));

        mockMvc.perform(get("/api/collect").param("q", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("query is required"));
    }

    @Test
    @DisplayName("A missing query parameter is a bad request")
    void missingQuery() throws Exception {
        mockMvc.perform(get("/api/collect"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(collectorService);
    }
}
