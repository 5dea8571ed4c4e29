package com.ryuqq.selection.core.outcome;

/**
 * 성공 결과.
 *
 * @param message 성공 메시지 (선택, null 가능)
 * @author Selection Team
 * @since 1.0.0
 */
public record Ok(String message) implements ActionOutcome {

    private static final Ok EMPTY = new Ok(null);

    /**
     * 메시지 없는 성공 결과.
     *
     * @return Ok 인스턴스
     */
    public static Ok of() {
        return EMPTY;
    }

    public static Ok of(String message) {
        return new Ok(message);
    }
}
