package com.searchcollector.model;

import lombok.Value;

/**
 * Raw content of one candidate page and the tier it came from
 */
@Value
public class FetchResult {

    private static final FetchResult NONE = new FetchResult(null, FetchStrategy.NONE);

    String content;
    FetchStrategy strategy;

    public static FetchResult primary(String content) {
        return new FetchResult(content, FetchStrategy.PRIMARY);
    }

    public static FetchResult fallback(String content) {
        return new FetchResult(content, FetchStrategy.FALLBACK);
    }

    public static FetchResult none() {
        return NONE;
    }

    public boolean hasContent() {
        return content != null && strategy != FetchStrategy.NONE;
    }
}
