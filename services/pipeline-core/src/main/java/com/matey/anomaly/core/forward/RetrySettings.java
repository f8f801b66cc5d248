package com.matey.anomaly.core.forward;

import com.matey.anomaly.core.retry.BackoffPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class RetrySettings {

    @Builder.Default
    FailurePolicy failurePolicy = FailurePolicy.DROP;

    /** Total attempts per batch for network errors, and for rejections under RETRY. */
    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    BackoffPolicy retryBackoff = BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(60));

    @Builder.Default
    BackoffPolicy rateLimitBackoff = BackoffPolicy.exponential(Duration.ofSeconds(5), Duration.ofSeconds(60));

    /** 0 keeps resending a rate-limited batch until it is accepted. */
    @Builder.Default
    int maxRateLimitRetries = 0;

    public static RetrySettings defaults() {
        return RetrySettings.builder().build();
    }
}
