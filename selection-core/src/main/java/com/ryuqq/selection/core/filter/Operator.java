package com.ryuqq.selection.core.filter;

/**
 * 필드 제약 연산자.
 *
 * <p>연산자는 세 가지 범주로 나뉘며, 필드 타입별 허용 여부는
 * {@link FieldType#supports(Operator)}가 결정합니다.</p>
 *
 * <ul>
 *   <li>EQUALITY: EQ, NE (값 1개)</li>
 *   <li>RANGE: LT, LTE, GT, GTE (값 1개), BETWEEN (값 2개, 양끝 포함)</li>
 *   <li>SET: IN, NOT_IN (값 1개 이상)</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public enum Operator {

    EQ(Category.EQUALITY, 1),
    NE(Category.EQUALITY, 1),
    LT(Category.RANGE, 1),
    LTE(Category.RANGE, 1),
    GT(Category.RANGE, 1),
    GTE(Category.RANGE, 1),
    BETWEEN(Category.RANGE, 2),
    IN(Category.SET, -1),
    NOT_IN(Category.SET, -1);

    /**
     * 연산자 범주.
     */
    public enum Category {
        EQUALITY,
        RANGE,
        SET
    }

    private final Category category;
    private final int arity;

    Operator(Category category, int arity) {
        this.category = category;
        this.arity = arity;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * 값 개수가 이 연산자에 맞는지 확인.
     *
     * @param valueCount 값 개수
     * @return 허용되면 true (SET 범주는 1개 이상)
     */
    public boolean acceptsArity(int valueCount) {
        if (arity < 0) {
            return valueCount >= 1;
        }
        return valueCount == arity;
    }

    /**
     * 사람이 읽을 수 있는 arity 설명 (오류 메시지용).
     *
     * @return 예: "exactly 2", "at least 1"
     */
    String describeArity() {
        return arity < 0 ? "at least 1" : "exactly " + arity;
    }
}
