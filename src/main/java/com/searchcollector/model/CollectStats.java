package com.searchcollector.model;

import lombok.Data;

/**
 * Per-query counters of how each candidate ended up.
 */
@Data
public class CollectStats {

    private int candidates;
    private int collected;
    private int blocked;
    private int unfetchable;
    private int tooShort;
    private int extractionFailed;
    private int declaredInvalid;
    private int errors;

    public void record(CandidateOutcome.Disposition disposition) {
        switch (disposition) {
            case COLLECTED -> collected++;
            case BLOCKED -> blocked++;
            case UNFETCHABLE -> unfetchable++;
            case TOO_SHORT -> tooShort++;
            case EXTRACTION_FAILED -> extractionFailed++;
            case DECLARED_INVALID -> declaredInvalid++;
            case ERROR -> errors++;
        }
    }

    public int dropped() {
        return candidates - collected;
    }
}
