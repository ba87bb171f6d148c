package com.searchcollector.model;

import lombok.Value;

/**
 * Terminal result of one candidate task
 */
@Value
public class CandidateOutcome {

    public enum Disposition {
        COLLECTED,
        BLOCKED,
        UNFETCHABLE,
        TOO_SHORT,
        EXTRACTION_FAILED,
        DECLARED_INVALID,
        ERROR
    }

    Candidate candidate;
    Disposition disposition;
    StructuredRecord record;
    String reason;

    public static CandidateOutcome collected(Candidate candidate, StructuredRecord record) {
        return new CandidateOutcome(candidate, Disposition.COLLECTED, record, null);
    }

    public static CandidateOutcome dropped(Candidate candidate, Disposition disposition, String reason) {
        return new CandidateOutcome(candidate, disposition, null, reason);
    }

    public boolean isCollected() {
        return disposition == Disposition.COLLECTED && record != null;
    }
}
