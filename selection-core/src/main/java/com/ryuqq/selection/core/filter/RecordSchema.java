package com.ryuqq.selection.core.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Record Store가 필터링에 노출하는 필드와 타입 목록.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * RecordSchema schema = RecordSchema.builder()
 *     .field("status", FieldType.STRING)
 *     .field("starred", FieldType.BOOLEAN)
 *     .field("receivedAt", FieldType.TIMESTAMP)
 *     .build();
 * }</pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class RecordSchema {

    private final Map<String, FieldType> fields;

    private RecordSchema(Map<String, FieldType> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 필드 타입 조회.
     *
     * @param field 필드명
     * @return 필드 타입 (스키마에 없으면 empty)
     */
    public Optional<FieldType> typeOf(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    /**
     * 선언된 필드 전체 (선언 순서 유지).
     *
     * @return 읽기 전용 맵
     */
    public Map<String, FieldType> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return "RecordSchema" + fields;
    }

    /**
     * RecordSchema 빌더.
     */
    public static final class Builder {

        private final Map<String, FieldType> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder field(String name, FieldType type) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
            if (fields.putIfAbsent(name, type) != null) {
                throw new IllegalArgumentException("field already declared: " + name);
            }
            return this;
        }

        public RecordSchema build() {
            return new RecordSchema(fields);
        }
    }
}
