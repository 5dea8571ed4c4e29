package com.ryuqq.selection.core.filter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Record 필드 타입.
 *
 * <p>각 타입은 허용하는 Java 값 타입과 지원 연산자를 정의합니다.</p>
 *
 * <ul>
 *   <li>STRING: {@link String}, 모든 연산자</li>
 *   <li>NUMBER: {@link Number} (유한 값만), 모든 연산자 (BigDecimal로 비교)</li>
 *   <li>BOOLEAN: {@link Boolean}, 범위 연산자 불가</li>
 *   <li>TIMESTAMP: {@link Instant}, 모든 연산자</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public enum FieldType {

    STRING(String.class),
    NUMBER(Number.class),
    BOOLEAN(Boolean.class),
    TIMESTAMP(Instant.class);

    private final Class<?> javaType;

    FieldType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * 연산자 지원 여부.
     *
     * @param operator 연산자
     * @return 지원하면 true
     */
    public boolean supports(Operator operator) {
        if (this == BOOLEAN) {
            return operator.getCategory() != Operator.Category.RANGE;
        }
        return true;
    }

    /**
     * 값이 이 타입에 속하는지 확인.
     *
     * <p>NUMBER는 NaN, 무한대를 허용하지 않습니다.</p>
     *
     * @param value 값
     * @return 허용되면 true (null은 항상 false)
     */
    public boolean accepts(Object value) {
        if (value == null || !javaType.isInstance(value)) {
            return false;
        }
        return this != NUMBER || isFinite((Number) value);
    }

    /**
     * 같은 타입으로 취급되는 두 값을 비교합니다.
     *
     * <p>숫자는 표현(Integer, Long, Double 등)과 무관하게 값으로 비교합니다.
     * 서로 비교할 수 없는 값이면 {@link ClassCastException}을 던집니다.</p>
     *
     * @param left 왼쪽 값
     * @param right 오른쪽 값
     * @return compareTo 규약을 따르는 결과
     */
    static int compareValues(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right));
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        if (left instanceof Instant && right instanceof Instant) {
            return ((Instant) left).compareTo((Instant) right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return ((Boolean) left).compareTo((Boolean) right);
        }
        throw new ClassCastException("Cannot compare " + left.getClass().getName()
            + " with " + right.getClass().getName());
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double) {
            return Double.isFinite((Double) number);
        }
        if (number instanceof Float) {
            return Float.isFinite((Float) number);
        }
        return true;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (!isFinite(number)) {
            throw new ClassCastException("Cannot compare non-finite number " + number);
        }
        return new BigDecimal(number.toString());
    }
}
