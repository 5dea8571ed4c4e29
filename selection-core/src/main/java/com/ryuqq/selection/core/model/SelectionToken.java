package com.ryuqq.selection.core.model;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Selection Token (불투명 핸들).
 *
 * <p>Token Store에 저장된 (Filter, SelectionState, SnapshotBasis) 묶음을 가리키는 키입니다.
 * 추측이 불가능해야 하므로 {@link SecureRandom}에서 256비트를 뽑아
 * URL-safe Base64(패딩 없음)로 인코딩합니다. 순차 값은 허용하지 않습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 16~128자</li>
 *   <li>패턴: URL-safe Base64 문자(영숫자, 하이픈, 언더스코어)만 허용</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class SelectionToken {

    private static final int TOKEN_BYTES = 32;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final String value;

    private SelectionToken(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SelectionToken cannot be null or blank");
        }
        if (value.length() < 16 || value.length() > 128) {
            throw new IllegalArgumentException("SelectionToken length must be between 16 and 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("SelectionToken contains invalid characters");
        }
        this.value = value;
    }

    /**
     * 기존 토큰 문자열로부터 생성 (클라이언트 요청 파싱 등).
     *
     * @param value 토큰 문자열
     * @return SelectionToken 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SelectionToken of(String value) {
        return new SelectionToken(value);
    }

    /**
     * 새 토큰 생성.
     *
     * @param random 암호학적 난수 생성기
     * @return 새 SelectionToken
     * @throws IllegalArgumentException random이 null인 경우
     */
    public static SelectionToken generate(SecureRandom random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return new SelectionToken(ENCODER.encodeToString(bytes));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SelectionToken that = (SelectionToken) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    /**
     * 토큰 값은 자격 증명처럼 다뤄지므로 앞 6자만 노출합니다.
     */
    @Override
    public String toString() {
        return "SelectionToken{" + value.substring(0, 6) + "...}";
    }
}
