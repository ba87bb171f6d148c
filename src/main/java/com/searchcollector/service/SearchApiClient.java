package com.searchcollector.service;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.searchcollector.config.CollectorProperties;
import com.searchcollector.exception.SearchApiException;
import com.searchcollector.model.Candidate;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Client for the Serper Google search API
 */
@Slf4j
@Service
public class SearchApiClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final CollectorProperties.Search config;
    private final OkHttpClient httpClient;
    private final Gson gson;

    public SearchApiClient(CollectorProperties properties, OkHttpClient okHttpClient, Gson gson) {
        this.config = properties.getSearch();
        this.gson = gson;
        this.httpClient = okHttpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();

        if (!isAvailable()) {
            log.warn("Search API key not configured");
        }
    }

    public boolean isAvailable() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    /**
     * Search the web and return the ranked organic results.
     * A response without an {@code organic} field yields an empty list.
     *
     * @throws SearchApiException if the call itself fails
     */
    public List<Candidate> search(String query) throws SearchApiException {
        if (!isAvailable()) {
            throw new SearchApiException("Search API key not configured");
        }

        JsonObject payload = new JsonObject();
        payload.addProperty("q", query);
        payload.addProperty("gl", config.getRegion());
        payload.addProperty("hl", config.getLanguage());
        payload.addProperty("num", config.getMaxResults());

        Request request = new Request.Builder()
                .url(stripTrailingSlash(config.getBaseUrl()) + "/search")
                .header("X-API-KEY", config.getApiKey())
                .post(RequestBody.create(gson.toJson(payload), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String errorBody = body != null ? body.string() : "";
                log.error("Search API error: {} - {}", response.code(), LogText.truncate(errorBody, 200));
                throw new SearchApiException("Search API returned HTTP " + response.code());
            }
            if (body == null) {
                throw new SearchApiException("Search API returned an empty body");
            }
            return parseCandidates(body.string());
        } catch (IOException e) {
            throw new SearchApiException("Search API call failed: " + e.getMessage(), e);
        }
    }

    private List<Candidate> parseCandidates(String responseBody) throws SearchApiException {
        JsonObject json;
        try {
            json = gson.fromJson(responseBody, JsonObject.class);
        } catch (JsonParseException e) {
            throw new SearchApiException("Search API returned malformed JSON", e);
        }

        List<Candidate> candidates = new ArrayList<>();
        if (json == null || !json.has("organic") || !json.get("organic").isJsonArray()) {
            log.info("Search response has no organic results");
            return candidates;
        }

        JsonArray organic = json.getAsJsonArray("organic");
        int rank = 0;
        try {
            for (JsonElement element : organic) {
                if (!element.isJsonObject()) {
                    continue;
                }
                JsonObject item = element.getAsJsonObject();
                candidates.add(Candidate.builder()
                        .title(getString(item, "title"))
                        .link(getString(item, "link"))
                        .snippet(getString(item, "snippet"))
                        .rank(++rank)
                        .build());
            }
        } catch (RuntimeException e) {
            throw new SearchApiException("Search API returned an unexpected result shape", e);
        }

        log.info("Search returned {} candidates", candidates.size());
        return candidates;
    }

    /**
     * Reads a string field, treating anything other than a JSON primitive
     * (an object or array in place of a link, say) as missing.
     */
    private static String getString(JsonObject item, String field) {
        JsonElement value = item.get(field);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
