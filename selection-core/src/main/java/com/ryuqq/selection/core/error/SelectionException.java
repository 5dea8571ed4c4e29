package com.ryuqq.selection.core.error;

/**
 * Selection 도메인 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 안정적인 오류 코드를 가지며, 외부 응답(예: HTTP 상태 매핑)에 사용됩니다.</p>
 *
 * <table>
 *   <caption>오류 코드</caption>
 *   <tr><th>예외</th><th>코드</th><th>재시도</th></tr>
 *   <tr><td>{@link InvalidFilterException}</td><td>FILTER-400</td><td>불가</td></tr>
 *   <tr><td>{@link TokenNotFoundException}</td><td>TOKEN-404</td><td>불가</td></tr>
 *   <tr><td>{@link TokenExpiredException}</td><td>TOKEN-410</td><td>재선택 필요</td></tr>
 *   <tr><td>{@link StoreUnavailableException}</td><td>STORE-503</td><td>backoff 후 가능</td></tr>
 *   <tr><td>{@link ResolutionInterruptedException}</td><td>RESOLVE-500</td><td>부분 결과 보존</td></tr>
 * </table>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public abstract class SelectionException extends RuntimeException {

    private final String errorCode;

    protected SelectionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SelectionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: TOKEN-410)
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 재시도하면 성공할 가능성이 있는 오류인지 여부.
     *
     * @return 일시적 오류면 true
     */
    public boolean isTransient() {
        return false;
    }
}
