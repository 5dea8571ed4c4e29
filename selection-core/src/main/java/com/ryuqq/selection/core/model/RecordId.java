package com.ryuqq.selection.core.model;

import java.io.Serializable;

/**
 * 레코드 식별자.
 *
 * <p>RecordId는 Record Store가 관리하는 레코드 하나를 가리키며,
 * 자연 순서(문자열 사전순)가 Resolver의 안정 정렬 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class RecordId implements Comparable<RecordId>, Serializable {

    private static final long serialVersionUID = 1L;

    private final String value;

    private RecordId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RecordId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RecordId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * RecordId 생성.
     *
     * @param value RecordId 값
     * @return RecordId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RecordId of(String value) {
        return new RecordId(value);
    }

    /**
     * RecordId 값 조회.
     *
     * @return RecordId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(RecordId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordId recordId = (RecordId) o;
        return value.equals(recordId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RecordId{" + value + '}';
    }
}
