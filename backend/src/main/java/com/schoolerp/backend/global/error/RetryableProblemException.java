package com.schoolerp.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter) {
        super(status, code, detail);
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be zero or positive");
        }
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    // rounded up so a client never retries early
    public long retryAfterHeaderSeconds() {
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
}
