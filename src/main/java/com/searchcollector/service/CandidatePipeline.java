package com.searchcollector.service;

import com.searchcollector.model.Candidate;
import com.searchcollector.model.CandidateOutcome;
import com.searchcollector.model.CandidateOutcome.Disposition;
import com.searchcollector.model.FetchResult;
import com.searchcollector.model.StageOutcome;
import com.searchcollector.model.StructuredRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs filter, fetch, normalize and extract for a single candidate.
 * Stages run strictly in sequence and the first non-success ends the task.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidatePipeline {

    private final BlocklistFilter blocklistFilter;
    private final ContentFetcher contentFetcher;
    private final ContentNormalizer contentNormalizer;
    private final StructuredExtractor structuredExtractor;

    /**
     * Never throws; an unexpected failure becomes an {@code ERROR} outcome.
     */
    public CandidateOutcome process(Candidate candidate) {
        try {
            return runStages(candidate);
        } catch (Exception e) {
            log.error("Unexpected error processing {}: {}", linkOf(candidate), e.getMessage(), e);
            return CandidateOutcome.dropped(candidate, Disposition.ERROR, e.getClass().getSimpleName());
        }
    }

    private CandidateOutcome runStages(Candidate candidate) {
        if (blocklistFilter.isBlocked(candidate)) {
            log.info("Skipping blocked site: {}", linkOf(candidate));
            return CandidateOutcome.dropped(candidate, Disposition.BLOCKED, "blocked domain");
        }

        String link = candidate.getLink();

        FetchResult fetched = contentFetcher.fetch(link);
        if (!fetched.hasContent()) {
            return CandidateOutcome.dropped(candidate, Disposition.UNFETCHABLE, "no content");
        }

        StageOutcome<String> cleaned = contentNormalizer.normalize(fetched.getContent(), fetched.getStrategy());
        if (!cleaned.isSuccess()) {
            log.info("Content rejected for {}: {}", link, cleaned.getReason());
            return CandidateOutcome.dropped(candidate, Disposition.TOO_SHORT, cleaned.getReason());
        }

        log.info("Content valid ({} chars via {}), extracting: {}",
                cleaned.getValue().length(), fetched.getStrategy(), link);

        StageOutcome<StructuredRecord> extracted = structuredExtractor.extract(cleaned.getValue(), link);
        return switch (extracted.getStatus()) {
            case SUCCESS -> CandidateOutcome.collected(candidate, extracted.getValue());
            case REJECTED -> CandidateOutcome.dropped(candidate, Disposition.DECLARED_INVALID, extracted.getReason());
            case FAILED -> CandidateOutcome.dropped(candidate, Disposition.EXTRACTION_FAILED, extracted.getReason());
        };
    }

    private static String linkOf(Candidate candidate) {
        return candidate == null ? null : candidate.getLink();
    }
}
