package com.ryuqq.selection.core.model;

/**
 * 고정 버전 기준.
 *
 * @param version Record Store의 데이터 버전 (0 이상)
 * @author Selection Team
 * @since 1.0.0
 */
public record PinnedSnapshot(long version) implements SnapshotBasis {

    public PinnedSnapshot {
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative (current: " + version + ")");
        }
    }

    @Override
    public String toString() {
        return "pinned@v" + version;
    }
}
