package com.ryuqq.selection.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>권한 없음 (403 Forbidden)</li>
 *   <li>레코드가 이미 삭제됨 (404 Not Found)</li>
 *   <li>비즈니스 규칙 위반 (이미 답장된 메일 등)</li>
 * </ul>
 *
 * @param errorCode 오류 코드 (예: MAIL-403)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 * @author Selection Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements ActionOutcome {

    /**
     * Action이 예외를 던졌을 때 Executor가 기록하는 코드.
     */
    public static final String ACTION_EXCEPTION = "ACTION_EXCEPTION";

    /**
     * Retry가 재시도 한도를 넘었을 때 Executor가 기록하는 코드.
     */
    public static final String RETRY_EXHAUSTED = "RETRY_EXHAUSTED";

    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }
}
