package com.ryuqq.selection.core.error;

/**
 * Resolve 스트림 도중 데이터 소스가 끊긴 경우.
 *
 * <p>이미 방출된 ID는 유효하며, Executor는 그때까지 처리한 결과를 최종으로 취급합니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public class ResolutionInterruptedException extends SelectionException {

    public static final String ERROR_CODE = "RESOLVE-500";

    private final long emittedCount;

    public ResolutionInterruptedException(long emittedCount, Throwable cause) {
        super(ERROR_CODE, "Resolution interrupted after " + emittedCount + " ids", cause);
        this.emittedCount = emittedCount;
    }

    /**
     * 중단 전까지 방출된 ID 수.
     *
     * @return 방출된 ID 수
     */
    public long getEmittedCount() {
        return emittedCount;
    }
}
