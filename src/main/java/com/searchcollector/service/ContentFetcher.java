package com.searchcollector.service;

import com.searchcollector.config.CollectorProperties;
import com.searchcollector.model.FetchResult;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Fetches the raw text of a result page.
 *
 * The reader proxy is tried first; it returns markdown-like text and is
 * retried on 429/5xx. When it is exhausted or refuses the page, the link is
 * fetched directly with browser headers and the raw HTML is returned.
 */
@Slf4j
@Service
public class ContentFetcher {

    private static final String ACCEPT_HTML =
            "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8";
    private static final String ACCEPT_LANGUAGE = "zh-CN,zh;q=0.9,en;q=0.8";

    private final CollectorProperties.Reader readerConfig;
    private final CollectorProperties.Fetch fetchConfig;
    private final OkHttpClient readerClient;
    private final OkHttpClient directClient;

    public ContentFetcher(CollectorProperties properties, OkHttpClient okHttpClient) {
        this.readerConfig = properties.getReader();
        this.fetchConfig = properties.getFetch();
        this.readerClient = okHttpClient.newBuilder()
                .connectTimeout(readerConfig.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readerConfig.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();
        this.directClient = okHttpClient.newBuilder()
                .connectTimeout(fetchConfig.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(fetchConfig.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();
    }

    /**
     * Fetch the content behind {@code link}. Never throws; returns
     * {@link FetchResult#none()} when both tiers are exhausted.
     */
    public FetchResult fetch(String link) {
        if (link == null || link.isBlank()) {
            return FetchResult.none();
        }

        String content = fetchViaReader(link);
        if (content != null) {
            return FetchResult.primary(content);
        }

        content = fetchDirect(link);
        if (content != null) {
            return FetchResult.fallback(content);
        }

        log.warn("All fetch strategies exhausted for {}", link);
        return FetchResult.none();
    }

    /**
     * Primary tier. Returns null when the tier is exhausted or abandoned.
     */
    String fetchViaReader(String link) {
        HttpUrl url = HttpUrl.parse(readerConfig.getBaseUrl() + link);
        if (url == null) {
            log.warn("Cannot build reader URL for {}", link);
            return null;
        }

        Request.Builder builder = new Request.Builder().url(url).get();
        if (readerConfig.getApiKey() != null && !readerConfig.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + readerConfig.getApiKey());
        }
        Request request = builder.build();

        int maxAttempts = readerConfig.getMaxRetries() + 1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = readerClient.newCall(request).execute()) {
                int code = response.code();
                if (code == 200) {
                    ResponseBody body = response.body();
                    String text = body != null ? body.string() : "";
                    log.debug("Reader returned {} chars for {}", text.length(), link);
                    return text;
                }
                if (!isRetryable(code)) {
                    log.info("Reader refused {} with HTTP {}, switching to direct fetch", link, code);
                    return null;
                }
                log.debug("Reader HTTP {} for {} (attempt {}/{})", code, link, attempt, maxAttempts);
            } catch (IOException e) {
                log.debug("Reader call failed for {} (attempt {}/{}): {}", link, attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts && !sleep(readerConfig.getBackoff(), attempt)) {
                return null;
            }
        }

        log.info("Reader retries exhausted for {}", link);
        return null;
    }

    /**
     * Fallback tier. Returns the raw HTML or null.
     */
    String fetchDirect(String link) {
        HttpUrl url = HttpUrl.parse(link);
        if (url == null) {
            log.warn("Malformed link, skipping direct fetch: {}", link);
            return null;
        }

        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", fetchConfig.getUserAgent())
                .header("Accept", ACCEPT_HTML)
                .header("Accept-Language", ACCEPT_LANGUAGE)
                .header("Referer", fetchConfig.getReferer())
                .get()
                .build();

        int maxAttempts = fetchConfig.getAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = directClient.newCall(request).execute()) {
                int code = response.code();
                if (code == 403) {
                    log.info("Direct fetch forbidden for {}, giving up", link);
                    return null;
                }
                if (code == 200 && response.body() != null) {
                    String html = decode(response.body(), link);
                    if (html.length() >= fetchConfig.getMinRawLength()) {
                        log.debug("Direct fetch returned {} chars for {}", html.length(), link);
                        return html;
                    }
                    log.debug("Direct fetch body too short ({} chars) for {}, likely a bot challenge",
                            html.length(), link);
                } else {
                    log.debug("Direct fetch HTTP {} for {} (attempt {}/{})", code, link, attempt, maxAttempts);
                }
            } catch (IOException e) {
                log.debug("Direct fetch failed for {} (attempt {}/{}): {}", link, attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts && !sleep(fetchConfig.getBackoff(), attempt)) {
                return null;
            }
        }

        return null;
    }

    /**
     * Decode the body with the declared charset, or with the one inferred from
     * the document itself when the server declares none (or the ISO-8859-1
     * default that usually means "unknown").
     */
    static String decode(ResponseBody body, String link) throws IOException {
        byte[] bytes = body.bytes();
        MediaType contentType = body.contentType();
        Charset declared = contentType != null ? contentType.charset() : null;
        if (declared != null && !StandardCharsets.ISO_8859_1.equals(declared)) {
            return new String(bytes, declared);
        }

        Document sniffed = Jsoup.parse(new ByteArrayInputStream(bytes), null, link);
        Charset inferred = sniffed.charset();
        return new String(bytes, inferred != null ? inferred : StandardCharsets.UTF_8);
    }

    private static boolean isRetryable(int code) {
        return code == 429 || code >= 500;
    }

    /**
     * Linear backoff. Returns false when interrupted.
     */
    private static boolean sleep(Duration backoff, int attempt) {
        long millis = backoff.toMillis() * attempt;
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
