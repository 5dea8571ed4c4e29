package com.ryuqq.selection.application.bulk;

import com.ryuqq.selection.core.model.SelectionToken;

import java.util.Map;

/**
 * Bulk Action 실행 요청 ({@code POST /bulk-actions}).
 *
 * @param token 선택 토큰
 * @param actionKind Action 종류 (예: "reply", "tag")
 * @param params Action 파라미터 (예: reply 본문)
 * @author Selection Team
 * @since 1.0.0
 */
public record BulkActionRequest(SelectionToken token, String actionKind, Map<String, String> params) {

    public BulkActionRequest {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (actionKind == null || actionKind.isBlank()) {
            throw new IllegalArgumentException("actionKind cannot be null or blank");
        }
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static BulkActionRequest of(SelectionToken token, String actionKind) {
        return new BulkActionRequest(token, actionKind, Map.of());
    }
}
