package com.searchcollector.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Collector configuration, bound once from {@code collector.*} and shared by
 * every pipeline stage.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {

    @Valid
    private Search search = new Search();

    @Valid
    private Reader reader = new Reader();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Normalizer normalizer = new Normalizer();

    @Valid
    private Llm llm = new Llm();

    @Valid
    private Blocklist blocklist = new Blocklist();

    @Valid
    private Pool pool = new Pool();

    @Data
    public static class Search {
        @NotBlank
        private String baseUrl = "https://google.serper.dev";
        private String apiKey;
        private String region = "cn";
        private String language = "zh-cn";
        @Min(1)
        private int maxResults = 5;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    /**
     * Reader proxy, the primary fetch tier.
     */
    @Data
    public static class Reader {
        @NotBlank
        private String baseUrl = "https://r.jina.ai/";
        private String apiKey;
        @Min(0)
        private int maxRetries = 2;
        private Duration backoff = Duration.ofSeconds(1);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    /**
     * Direct fetch, the fallback tier.
     */
    @Data
    public static class Fetch {
        @Min(1)
        private int attempts = 2;
        @Min(0)
        private int minRawLength = 500;
        private Duration backoff = Duration.ofSeconds(1);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";
        private String referer = "https://www.google.com/";
    }

    @Data
    public static class Normalizer {
        @Min(0)
        private int minContentLength = 300;
    }

    @Data
    public static class Llm {
        @NotBlank
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        @NotBlank
        private String model = "openai/gpt-oss-120b";
        private double temperature = 0.1;
        @Min(1)
        private int maxInputChars = 80000;
        @Min(0)
        private int maxRetries = 2;
        private Duration backoff = Duration.ofSeconds(1);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Blocklist {
        private List<String> domains = new ArrayList<>();
    }

    @Data
    public static class Pool {
        @Min(1)
        private int size = 5;
    }
}
