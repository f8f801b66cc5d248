package com.matey.anomaly.core.forward;

/**
 * What the forwarder does with a batch after a non-auth, non-rate-limit rejection
 * (other 4xx/5xx or an unreadable response body).
 */
public enum FailurePolicy {
    /** Log and move on to the next batch. */
    DROP,
    /** Resend with capped exponential backoff until the attempt limit. */
    RETRY
}
