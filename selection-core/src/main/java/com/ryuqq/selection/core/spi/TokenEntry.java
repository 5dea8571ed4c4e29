package com.ryuqq.selection.core.spi;

import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.model.SelectionToken;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.selection.SelectionState;

import java.time.Instant;

/**
 * Token Store에 저장되는 불변 항목.
 *
 * <p>생성 후에는 절대 갱신되지 않습니다 (삭제만 가능).
 * 따라서 같은 토큰을 동시에 resolve해도 안전합니다.</p>
 *
 * @param token 토큰
 * @param filter 묶인 Filter Descriptor
 * @param selection 묶인 Selection State
 * @param snapshotBasis Live 또는 Pinned
 * @param createdAt 생성 시각
 * @param expiresAt 만료 시각 (createdAt 이후)
 * @author Selection Team
 * @since 1.0.0
 */
public record TokenEntry(
    SelectionToken token,
    FilterDescriptor filter,
    SelectionState selection,
    SnapshotBasis snapshotBasis,
    Instant createdAt,
    Instant expiresAt
) {

    public TokenEntry {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (selection == null) {
            throw new IllegalArgumentException("selection cannot be null");
        }
        if (snapshotBasis == null) {
            throw new IllegalArgumentException("snapshotBasis cannot be null");
        }
        if (createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("createdAt and expiresAt cannot be null");
        }
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
    }

    /**
     * 주어진 시각에 만료되었는지 확인.
     *
     * @param now 기준 시각
     * @return now가 expiresAt 이후(같은 시각 포함)면 true
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
