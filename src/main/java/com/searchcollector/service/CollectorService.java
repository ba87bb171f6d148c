package com.searchcollector.service;

import com.searchcollector.exception.SearchApiException;
import com.searchcollector.model.Candidate;
import com.searchcollector.model.CandidateOutcome;
import com.searchcollector.model.CollectResult;
import com.searchcollector.model.CollectStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;

/**
 * Collector entry point: search, then run every candidate through the
 * pipeline on the shared worker pool and aggregate the records.
 */
@Slf4j
@Service
public class CollectorService {

    private final SearchApiClient searchApiClient;
    private final CandidatePipeline candidatePipeline;
    private final Executor collectorExecutor;

    public CollectorService(SearchApiClient searchApiClient,
                            CandidatePipeline candidatePipeline,
                            @Qualifier("collectorExecutor") Executor collectorExecutor) {
        this.searchApiClient = searchApiClient;
        this.candidatePipeline = candidatePipeline;
        this.collectorExecutor = collectorExecutor;
    }

    /**
     * Collect structured records for {@code query}.
     *
     * Blocks until every candidate task has finished. Per-candidate failures
     * only shrink the result; a failed search yields an empty result flagged
     * with {@code upstreamFailed}.
     *
     * @throws IllegalArgumentException if the query is blank
     */
    public CollectResult collect(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }

        long start = System.currentTimeMillis();
        log.info("Collecting for query: {}", LogText.truncate(query, 100));

        List<Candidate> candidates;
        try {
            candidates = searchApiClient.search(query);
        } catch (SearchApiException e) {
            log.error("Search failed for query '{}': {}", LogText.truncate(query, 100), e.getMessage(), e);
            return CollectResult.upstreamFailure(query, e.getMessage(), System.currentTimeMillis() - start);
        }

        CollectResult result = CollectResult.builder().query(query).build();
        result.getStats().setCandidates(candidates.size());

        if (candidates.isEmpty()) {
            log.info("No search results for query: {}", LogText.truncate(query, 100));
            result.setElapsedMs(System.currentTimeMillis() - start);
            return result;
        }

        aggregate(candidates, result);

        result.setElapsedMs(System.currentTimeMillis() - start);
        CollectStats stats = result.getStats();
        log.info("Collected {} of {} candidates in {} ms (blocked={}, unfetchable={}, tooShort={}, "
                        + "extractionFailed={}, declaredInvalid={}, errors={})",
                stats.getCollected(), stats.getCandidates(), result.getElapsedMs(), stats.getBlocked(),
                stats.getUnfetchable(), stats.getTooShort(), stats.getExtractionFailed(),
                stats.getDeclaredInvalid(), stats.getErrors());
        return result;
    }

    /**
     * Fan candidates out to the pool and fold outcomes into {@code result}
     * as they complete. Only this thread touches {@code result}.
     */
    private void aggregate(List<Candidate> candidates, CollectResult result) {
        CompletionService<CandidateOutcome> completion = new ExecutorCompletionService<>(collectorExecutor);
        int submitted = 0;

        for (Candidate candidate : candidates) {
            try {
                completion.submit(() -> candidatePipeline.process(candidate));
                submitted++;
            } catch (RuntimeException e) {
                log.error("Could not schedule {}: {}", candidate.getLink(), e.getMessage(), e);
                result.getStats().record(CandidateOutcome.Disposition.ERROR);
            }
        }

        for (int i = 0; i < submitted; i++) {
            CandidateOutcome outcome;
            try {
                outcome = completion.take().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for candidates, returning {} records", result.size());
                return;
            } catch (ExecutionException e) {
                log.error("Candidate task failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
                result.getStats().record(CandidateOutcome.Disposition.ERROR);
                continue;
            }

            result.getStats().record(outcome.getDisposition());
            if (outcome.isCollected()) {
                result.getRecords().add(outcome.getRecord());
            }
        }
    }
}
