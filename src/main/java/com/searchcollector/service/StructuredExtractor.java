package com.searchcollector.service;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.searchcollector.config.CollectorProperties;
import com.searchcollector.model.StageOutcome;
import com.searchcollector.model.StructuredRecord;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Turns cleaned page text into a {@link StructuredRecord} through an
 * OpenAI-compatible chat completions endpoint.
 */
@Slf4j
@Service
public class StructuredExtractor {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private static final Pattern THINK_BLOCK = Pattern.compile("<think>.*?</think>", Pattern.DOTALL);
    private static final Pattern LEADING_FENCE = Pattern.compile("^\\s*```[a-zA-Z]*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```\\s*$");

    static final String SYSTEM_PROMPT = """
            You are a tireless data extraction API.
            Task: read the web page text supplied by the user and extract its information.

            Notes:
            1. The text may contain navigation menus, ads and unrelated links. Ignore them and focus on the main body.
            2. As long as valuable content can be found, even when wrapped in navigation, treat the page as valid.

            Output rules:
            1. Output a single RFC 8259 JSON object and nothing else.
            2. Do not wrap the output in Markdown code fences.
            3. If the page is unusable (garbled text, captcha, login wall), set "valid" to false.

            Output template:
            {
                "valid": true,
                "title": "page title",
                "summary": "summary of the core content, at most 500 words",
                "key_points": ["key point 1", "key point 2", "key point 3"],
                "code_snippets": ["important code snippets, if any"],
                "source_url": "original link"
            }
            """;

    private final CollectorProperties.Llm config;
    private final OkHttpClient httpClient;
    private final Gson gson;
    private final String apiUrl;

    public StructuredExtractor(CollectorProperties properties, OkHttpClient okHttpClient, Gson gson) {
        this.config = properties.getLlm();
        this.gson = gson;
        this.httpClient = okHttpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();

        String baseUrl = config.getBaseUrl();
        this.apiUrl = (baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl)
                + "/chat/completions";

        if (!isAvailable()) {
            log.warn("LLM API key not configured");
        } else {
            log.info("✅ Structured extractor initialized with model: {}", config.getModel());
        }
    }

    public boolean isAvailable() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    /**
     * Extract a record from {@code content}. Calls the service at most
     * {@code maxRetries + 1} times; a page the model declares invalid is
     * rejected without retrying.
     */
    public StageOutcome<StructuredRecord> extract(String content, String link) {
        if (!isAvailable()) {
            return StageOutcome.failed("LLM not configured");
        }

        String userPrompt = buildUserPrompt(content, link);
        int maxAttempts = config.getMaxRetries() + 1;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String raw = callChatCompletion(userPrompt);
                StructuredRecord record = parseRecord(raw);

                if (record.isDeclaredInvalid()) {
                    log.info("Model declared page unusable: {}", link);
                    return StageOutcome.rejected("declared invalid");
                }

                applyDefaults(record, link);
                return StageOutcome.success(record);

            } catch (IOException e) {
                log.warn("LLM call failed for {} (attempt {}/{}): {}", link, attempt, maxAttempts, e.getMessage());
            } catch (JsonParseException e) {
                log.warn("Unparseable LLM output for {} (attempt {}/{}): {}", link, attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts && !backoff(attempt)) {
                return StageOutcome.failed("interrupted");
            }
        }

        return StageOutcome.failed("extraction retries exhausted");
    }

    private String buildUserPrompt(String content, String link) {
        String body = content.length() > config.getMaxInputChars()
                ? content.substring(0, config.getMaxInputChars())
                : content;
        return "Source link: " + link + "\n\nPage content:\n" + body;
    }

    private String callChatCompletion(String userPrompt) throws IOException {
        JsonObject requestBody = new JsonObject();
        requestBody.addProperty("model", config.getModel());
        requestBody.addProperty("temperature", config.getTemperature());

        JsonArray messages = new JsonArray();
        messages.add(message("system", SYSTEM_PROMPT));
        messages.add(message("user", userPrompt));
        requestBody.add("messages", messages);

        JsonObject responseFormat = new JsonObject();
        responseFormat.addProperty("type", "json_object");
        requestBody.add("response_format", responseFormat);

        Request request = new Request.Builder()
                .url(apiUrl)
                .header("Authorization", "Bearer " + config.getApiKey())
                .post(RequestBody.create(gson.toJson(requestBody), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String errorBody = response.body() != null ? response.body().string() : "Unknown error";
                log.error("LLM API error: {} - {}", response.code(), LogText.truncate(errorBody, 200));
                throw new IOException("LLM API error: " + response.code());
            }
            if (response.body() == null) {
                throw new IOException("LLM API returned an empty body");
            }

            String responseBody = response.body().string();
            JsonObject jsonResponse = gson.fromJson(responseBody, JsonObject.class);
            if (jsonResponse == null) {
                throw new JsonParseException("empty completion response");
            }

            JsonElement text = jsonResponse
                    .getAsJsonArray("choices")
                    .get(0).getAsJsonObject()
                    .getAsJsonObject("message")
                    .get("content");
            if (text == null || text.isJsonNull()) {
                throw new JsonParseException("completion has no content");
            }
            return text.getAsString();
        } catch (NullPointerException | IndexOutOfBoundsException | ClassCastException
                 | IllegalStateException | UnsupportedOperationException e) {
            throw new JsonParseException("unexpected completion shape: " + e.getMessage(), e);
        }
    }

    private static JsonObject message(String role, String content) {
        JsonObject message = new JsonObject();
        message.addProperty("role", role);
        message.addProperty("content", content);
        return message;
    }

    /**
     * Strip reasoning traces and code fences the model sometimes adds
     * around the JSON object.
     */
    static String cleanResponse(String raw) {
        if (raw == null) {
            return "";
        }
        String text = THINK_BLOCK.matcher(raw).replaceAll("");
        text = LEADING_FENCE.matcher(text).replaceFirst("");
        text = TRAILING_FENCE.matcher(text).replaceFirst("");
        return text.trim();
    }

    /**
     * @throws JsonParseException if the cleaned output is not a JSON object
     */
    StructuredRecord parseRecord(String raw) {
        String cleaned = cleanResponse(raw);
        JsonElement element = JsonParser.parseString(cleaned);
        if (!element.isJsonObject()) {
            throw new JsonParseException("expected a JSON object but got: " + LogText.truncate(cleaned, 80));
        }
        StructuredRecord record = gson.fromJson(element, StructuredRecord.class);
        if (record == null) {
            throw new JsonParseException("empty record");
        }
        return record;
    }

    private static void applyDefaults(StructuredRecord record, String link) {
        if (record.getValid() == null) {
            record.setValid(true);
        }
        if (!Objects.equals(link, record.getSourceUrl())) {
            log.debug("Replacing model-supplied source_url {} with {}", record.getSourceUrl(), link);
        }
        // a record always points back at the candidate it came from
        record.setSourceUrl(link);
        record.setKeyPoints(nonNullItems(record.getKeyPoints()));
        record.setCodeSnippets(nonNullItems(record.getCodeSnippets()));
    }

    private static List<String> nonNullItems(List<String> items) {
        List<String> result = new ArrayList<>();
        if (items != null) {
            items.stream().filter(Objects::nonNull).forEach(result::add);
        }
        return result;
    }

    private boolean backoff(int attempt) {
        long millis = config.getBackoff().toMillis() * attempt;
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
