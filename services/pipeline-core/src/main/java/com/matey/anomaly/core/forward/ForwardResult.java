package com.matey.anomaly.core.forward;

import com.matey.anomaly.core.model.AnomalyRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of forwarding one batch.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ForwardResult {

    public enum Status {
        SUCCESS,
        /** Credentials rejected (401/403). The forwarder is halted from now on. */
        AUTH_FAILED,
        DROPPED,
        /** Refused without sending because an earlier batch hit AUTH_FAILED. */
        HALTED
    }

    private final Status status;
    private final List<AnomalyRecord> anomalies;
    private final Integer httpStatus;
    private final int attempts;

    public static ForwardResult success(List<AnomalyRecord> anomalies, int attempts) {
        return new ForwardResult(Status.SUCCESS, List.copyOf(anomalies), 200, attempts);
    }

    public static ForwardResult authFailed(int httpStatus, int attempts) {
        return new ForwardResult(Status.AUTH_FAILED, List.of(), httpStatus, attempts);
    }

    public static ForwardResult dropped(Integer httpStatus, int attempts) {
        return new ForwardResult(Status.DROPPED, List.of(), httpStatus, attempts);
    }

    public static ForwardResult halted() {
        return new ForwardResult(Status.HALTED, List.of(), null, 0);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * True when no further batch can ever be forwarded.
     */
    public boolean isFatal() {
        return status == Status.AUTH_FAILED || status == Status.HALTED;
    }
}
