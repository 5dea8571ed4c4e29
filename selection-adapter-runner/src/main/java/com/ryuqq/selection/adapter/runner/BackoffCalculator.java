package com.ryuqq.selection.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>레코드별 Retry 간격을 지수적으로 늘리고 jitter를 더해,
 * 같은 하위 시스템을 호출하는 워커들이 동시에 재시도하지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attempt-1), maxDelay)
 * delay = min(max(exponential + random(0, exponential * jitterFactor), retryAfterHint), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (기본값 baseDelay=200ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 200-220ms</li>
 *   <li>attempt=2: 400-440ms</li>
 *   <li>attempt=3: 800-880ms</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성 (baseDelay=200ms, maxDelay=10000ms, jitterFactor=0.1).
     */
    public BackoffCalculator() {
        this(200, 10000, 0.1);
    }

    /**
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 재시도 회차 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        return calculate(attempt, 0);
    }

    /**
     * Action이 제시한 retryAfter 힌트를 반영한 지연 시간 계산.
     *
     * <p>힌트가 계산값보다 크면 힌트를 따르며, 어느 경우든 maxDelay를 넘지 않습니다.</p>
     *
     * @param attempt 재시도 회차 (1부터 시작)
     * @param retryAfterHintMs Action이 제시한 최소 대기 시간 (0이면 없음)
     * @return 대기 시간 (밀리초)
     */
    public long calculate(int attempt, long retryAfterHintMs) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }
        if (retryAfterHintMs < 0) {
            throw new IllegalArgumentException(
                "retryAfterHintMs cannot be negative (current: " + retryAfterHintMs + ")"
            );
        }

        // 2^62 이상은 overflow
        int shift = Math.min(attempt - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift) ? maxDelayMs : Math.min(baseDelayMs << shift, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());

        return Math.min(Math.max(exponential + jitter, retryAfterHintMs), maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
