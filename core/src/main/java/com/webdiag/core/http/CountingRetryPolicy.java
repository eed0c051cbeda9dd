package com.webdiag.core.http;

import java.time.Duration;
import java.util.Objects;

/**
 * capture 한 번 동안만 쓰는 RetryPolicy 래퍼. 실제로 대기를 잡은 재시도만 센다.
 * 마지막 시도에서 위임 정책이 true를 돌려줘도 maxAttempts를 넘기면 재시도하지 않는다.
 */
final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private int retries;

    CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(int statusCode, int attempt) {
        return attempt < delegate.maxAttempts() && delegate.shouldRetry(statusCode, attempt);
    }

    @Override
    public Duration nextDelay(int attempt) {
        retries++;
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    int getRetryCount() {
        return retries;
    }
}
