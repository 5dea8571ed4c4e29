package com.ryuqq.selection.core.error;

/**
 * 필터가 잘못되었거나 필드 타입과 호환되지 않는 경우.
 *
 * <p>즉시 호출자에게 전달되며 재시도하지 않습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public class InvalidFilterException extends SelectionException {

    public static final String ERROR_CODE = "FILTER-400";

    private final String field;

    public InvalidFilterException(String field, String message) {
        super(ERROR_CODE, message);
        this.field = field;
    }

    /**
     * 문제가 된 필드명.
     *
     * @return 필드명 (필드와 무관한 오류면 null)
     */
    public String getField() {
        return field;
    }
}
