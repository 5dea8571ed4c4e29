package com.ryuqq.selection.core.model;

import java.util.UUID;

/**
 * Bulk Operation 결과 식별자.
 *
 * <p>비동기 실행의 폴링 키({@code GET /bulk-actions/{resultId}})로 사용됩니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class ResultId {

    private final String value;

    private ResultId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResultId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ResultId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("ResultId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ResultId 생성.
     *
     * @param value ResultId 값
     * @return ResultId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResultId of(String value) {
        return new ResultId(value);
    }

    /**
     * UUID 기반 신규 ResultId 생성.
     *
     * @return 새 ResultId
     */
    public static ResultId newId() {
        return new ResultId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultId resultId = (ResultId) o;
        return value.equals(resultId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ResultId{" + value + '}';
    }
}
