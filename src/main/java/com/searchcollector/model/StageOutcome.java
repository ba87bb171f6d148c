package com.searchcollector.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Tagged result of one pipeline stage.
 *
 * REJECTED is an expected outcome (content too short, page declared unusable);
 * FAILED means the stage gave up after exhausting its budget.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StageOutcome<T> {

    public enum Status {
        SUCCESS,
        REJECTED,
        FAILED
    }

    Status status;
    T value;
    String reason;

    public static <T> StageOutcome<T> success(T value) {
        return new StageOutcome<>(Status.SUCCESS, value, null);
    }

    public static <T> StageOutcome<T> rejected(String reason) {
        return new StageOutcome<>(Status.REJECTED, null, reason);
    }

    public static <T> StageOutcome<T> failed(String reason) {
        return new StageOutcome<>(Status.FAILED, null, reason);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
