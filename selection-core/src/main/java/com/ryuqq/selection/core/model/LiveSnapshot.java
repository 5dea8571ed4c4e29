package com.ryuqq.selection.core.model;

/**
 * Live 기준: resolve 시점의 현재 데이터로 평가.
 *
 * @author Selection Team
 * @since 1.0.0
 */
public record LiveSnapshot() implements SnapshotBasis {

    static final LiveSnapshot INSTANCE = new LiveSnapshot();

    @Override
    public String toString() {
        return "live";
    }
}
