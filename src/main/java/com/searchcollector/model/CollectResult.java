package com.searchcollector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result set of one {@code collect} call.
 *
 * Records are in completion order, not search rank. {@code upstreamFailed}
 * is only set when the search itself failed, so an empty result can be told
 * apart from "nothing usable was found".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectResult {

    private String query;

    @Builder.Default
    private List<StructuredRecord> records = new ArrayList<>();

    private boolean upstreamFailed;
    private String failureReason;

    @Builder.Default
    private CollectStats stats = new CollectStats();

    private long elapsedMs;

    public static CollectResult upstreamFailure(String query, String reason, long elapsedMs) {
        return CollectResult.builder()
                .query(query)
                .upstreamFailed(true)
                .failureReason(reason)
                .elapsedMs(elapsedMs)
                .build();
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
