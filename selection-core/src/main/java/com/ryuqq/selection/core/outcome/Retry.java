package com.ryuqq.selection.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>하위 시스템 타임아웃</li>
 *   <li>외부 서비스 일시 장애 (503 Service Unavailable)</li>
 *   <li>Rate Limit 초과 (429 Too Many Requests)</li>
 * </ul>
 *
 * @param reason 재시도 사유
 * @param retryAfterMillis Action이 요청하는 최소 대기 시간 (밀리초, 0이면 Executor의 backoff만 적용)
 * @author Selection Team
 * @since 1.0.0
 */
public record Retry(String reason, long retryAfterMillis) implements ActionOutcome {

    public Retry {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (retryAfterMillis < 0) {
            throw new IllegalArgumentException("retryAfterMillis must be non-negative (current: " + retryAfterMillis + ")");
        }
    }

    public static Retry of(String reason) {
        return new Retry(reason, 0);
    }
}
