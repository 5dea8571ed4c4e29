package com.ryuqq.selection.core.resolver;

import com.ryuqq.selection.core.model.RecordId;

import java.util.List;

/**
 * MANUAL 모드 스트림: 이미 필터로 검증된 include 목록을 배치로 나눠 방출.
 */
final class ManualResolvedStream implements ResolvedStream {

    private final List<RecordId> matched;
    private final int batchSize;
    private int position;

    ManualResolvedStream(List<RecordId> matched, int batchSize) {
        this.matched = List.copyOf(matched);
        this.batchSize = batchSize;
    }

    @Override
    public List<RecordId> nextBatch() {
        if (position >= matched.size()) {
            return List.of();
        }
        int end = Math.min(position + batchSize, matched.size());
        List<RecordId> batch = matched.subList(position, end);
        position = end;
        return batch;
    }

    @Override
    public long emittedCount() {
        return position;
    }

    @Override
    public void close() {
        position = matched.size();
    }
}
