package com.ryuqq.selection.core.result;

/**
 * ABORTED 사유.
 *
 * @author Selection Team
 * @since 1.0.0
 */
public enum AbortReason {

    /**
     * 호출자가 취소를 요청함.
     */
    CANCELLED,

    /**
     * 소프트 타임아웃 도달 (취소와 동일하게 처리).
     */
    TIMED_OUT,

    /**
     * 데이터 소스가 스트림 도중 끊김.
     */
    RESOLUTION_INTERRUPTED
}
