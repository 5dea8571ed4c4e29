package com.ryuqq.selection.core.filter;

import com.ryuqq.selection.core.error.InvalidFilterException;

import java.io.Serializable;
import java.util.List;

/**
 * 단일 필드 제약 (field, operator, values).
 *
 * <p>생성 시점에는 구조(필드명, 값 개수)만 검증하며,
 * 필드 존재 여부와 타입 호환성은 {@link FilterDescriptor#validate(RecordSchema)}가 검증합니다.</p>
 *
 * @param field 필드명
 * @param operator 연산자
 * @param values 비교 값 (불변 리스트, null 요소 불가)
 * @author Selection Team
 * @since 1.0.0
 */
public record FieldConstraint(
    String field,
    Operator operator,
    List<Object> values
) implements Serializable {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException field, operator, values가 null인 경우
     * @throws InvalidFilterException 값 개수가 연산자와 맞지 않거나 null 값이 포함된 경우
     */
    public FieldConstraint {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (operator == null) {
            throw new IllegalArgumentException("operator cannot be null");
        }
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        for (Object value : values) {
            if (value == null) {
                throw new InvalidFilterException(field, "Constraint on '" + field + "' contains a null value");
            }
        }
        if (!operator.acceptsArity(values.size())) {
            throw new InvalidFilterException(field, String.format(
                "Operator %s on '%s' needs %s value(s) but got %d",
                operator, field, operator.describeArity(), values.size()));
        }
        values = List.copyOf(values);
    }

    /**
     * 필드의 실제 값이 제약을 만족하는지 평가.
     *
     * <p>값이 없으면(null) 어떤 연산자로도 만족하지 않습니다.
     * 타입이 맞지 않는 값도 만족하지 않는 것으로 취급합니다.</p>
     *
     * @param actual 레코드의 필드 값
     * @return 만족하면 true
     */
    public boolean test(Object actual) {
        if (actual == null) {
            return false;
        }
        try {
            switch (operator) {
                case EQ:
                    return FieldType.compareValues(actual, values.get(0)) == 0;
                case NE:
                    return FieldType.compareValues(actual, values.get(0)) != 0;
                case LT:
                    return FieldType.compareValues(actual, values.get(0)) < 0;
                case LTE:
                    return FieldType.compareValues(actual, values.get(0)) <= 0;
                case GT:
                    return FieldType.compareValues(actual, values.get(0)) > 0;
                case GTE:
                    return FieldType.compareValues(actual, values.get(0)) >= 0;
                case BETWEEN:
                    return FieldType.compareValues(actual, values.get(0)) >= 0
                        && FieldType.compareValues(actual, values.get(1)) <= 0;
                case IN:
                    return containsValue(actual);
                case NOT_IN:
                    return !containsValue(actual);
                default:
                    throw new IllegalStateException("Unhandled operator: " + operator);
            }
        } catch (ClassCastException e) {
            return false;
        }
    }

    private boolean containsValue(Object actual) {
        for (Object candidate : values) {
            if (FieldType.compareValues(actual, candidate) == 0) {
                return true;
            }
        }
        return false;
    }
}
