package com.ryuqq.selection.core.filter;

import com.ryuqq.selection.core.error.InvalidFilterException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Filter Descriptor.
 *
 * <p>레코드 컬렉션에 대한 불변, 직렬화 가능한 술어입니다.
 * 제약 목록은 순서를 유지하며 모두 AND로 결합됩니다 (OR는 지원하지 않음).</p>
 *
 * <p><strong>불변식:</strong> 결정적이고 순수해야 합니다.
 * 같은 스냅샷에 두 번 평가하면 같은 결과를 냅니다.</p>
 *
 * <p><strong>생명주기:</strong> 클라이언트가 필터/검색을 적용할 때 생성되고,
 * Selection State에 묶인 뒤에는 바뀌지 않습니다. UI 필터가 바뀌면 새 Descriptor로 교체됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FilterDescriptor unreplied = FilterDescriptor.builder()
 *     .eq("status", "unreplied")
 *     .where("receivedAt", Operator.GTE, Instant.parse("2024-01-01T00:00:00Z"))
 *     .build();
 *
 * unreplied.validate(schema);   // InvalidFilterException if incompatible
 * }</pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class FilterDescriptor implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final FilterDescriptor MATCH_ALL = new FilterDescriptor(List.of());

    private final List<FieldConstraint> constraints;

    private FilterDescriptor(List<FieldConstraint> constraints) {
        this.constraints = List.copyOf(constraints);
    }

    /**
     * 제약이 없는 Descriptor (모든 레코드 일치).
     *
     * @return match-all Descriptor
     */
    public static FilterDescriptor matchAll() {
        return MATCH_ALL;
    }

    /**
     * 제약 목록으로 생성.
     *
     * @param constraints 제약 목록 (순서 유지)
     * @return FilterDescriptor
     * @throws IllegalArgumentException constraints가 null이거나 null 요소를 포함한 경우
     */
    public static FilterDescriptor of(List<FieldConstraint> constraints) {
        if (constraints == null) {
            throw new IllegalArgumentException("constraints cannot be null");
        }
        for (FieldConstraint constraint : constraints) {
            if (constraint == null) {
                throw new IllegalArgumentException("constraints cannot contain null");
            }
        }
        return new FilterDescriptor(constraints);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<FieldConstraint> getConstraints() {
        return constraints;
    }

    /**
     * 스키마 기준 유효성 검증.
     *
     * @param schema Record Store 스키마
     * @throws IllegalArgumentException schema가 null인 경우
     * @throws InvalidFilterException 알 수 없는 필드, 타입과 호환되지 않는 연산자 또는 값이 있는 경우
     */
    public void validate(RecordSchema schema) {
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        for (FieldConstraint constraint : constraints) {
            String field = constraint.field();
            FieldType type = schema.typeOf(field).orElseThrow(
                () -> new InvalidFilterException(field, "Unknown field: " + field));

            if (!type.supports(constraint.operator())) {
                throw new InvalidFilterException(field, String.format(
                    "Operator %s is not supported on %s field '%s'", constraint.operator(), type, field));
            }
            for (Object value : constraint.values()) {
                if (!type.accepts(value)) {
                    throw new InvalidFilterException(field, String.format(
                        "Value %s (%s) is not a %s for field '%s'",
                        value, value.getClass().getSimpleName(), type, field));
                }
            }
        }
    }

    /**
     * 레코드 하나의 필드 맵에 대해 평가.
     *
     * @param fields 필드명 → 값
     * @return 모든 제약을 만족하면 true (제약이 없으면 항상 true)
     * @throws IllegalArgumentException fields가 null인 경우
     */
    public boolean matches(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        for (FieldConstraint constraint : constraints) {
            if (!constraint.test(fields.get(constraint.field()))) {
                return false;
            }
        }
        return true;
    }

    public boolean isMatchAll() {
        return constraints.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FilterDescriptor that = (FilterDescriptor) o;
        return constraints.equals(that.constraints);
    }

    @Override
    public int hashCode() {
        return constraints.hashCode();
    }

    @Override
    public String toString() {
        return "FilterDescriptor" + constraints;
    }

    /**
     * FilterDescriptor 빌더. 추가 순서가 제약 순서가 됩니다.
     */
    public static final class Builder {

        private final List<FieldConstraint> constraints = new ArrayList<>();

        private Builder() {
        }

        public Builder where(String field, Operator operator, Object... values) {
            if (values == null) {
                throw new IllegalArgumentException("values cannot be null");
            }
            constraints.add(new FieldConstraint(field, operator, Arrays.asList(values)));
            return this;
        }

        public Builder eq(String field, Object value) {
            return where(field, Operator.EQ, value);
        }

        public Builder in(String field, Object... values) {
            return where(field, Operator.IN, values);
        }

        public Builder between(String field, Object lowerInclusive, Object upperInclusive) {
            return where(field, Operator.BETWEEN, lowerInclusive, upperInclusive);
        }

        public FilterDescriptor build() {
            return new FilterDescriptor(constraints);
        }
    }
}
