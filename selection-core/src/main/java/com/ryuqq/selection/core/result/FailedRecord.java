package com.ryuqq.selection.core.result;

import com.ryuqq.selection.core.model.RecordId;

/**
 * 실패한 레코드와 사유.
 *
 * @param recordId 레코드 ID
 * @param errorCode 오류 코드 (Action의 Fail 코드 또는 ACTION_EXCEPTION, RETRY_EXHAUSTED)
 * @param message 오류 메시지
 * @author Selection Team
 * @since 1.0.0
 */
public record FailedRecord(RecordId recordId, String errorCode, String message) {

    public FailedRecord {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
    }
}
