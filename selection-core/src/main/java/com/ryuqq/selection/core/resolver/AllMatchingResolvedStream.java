package com.ryuqq.selection.core.resolver;

import com.ryuqq.selection.core.error.ResolutionInterruptedException;
import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.spi.RecordCursor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * ALL 모드 스트림: 커서에서 배치를 당겨 exclude 집합을 제거.
 *
 * <p>제외 후 배치가 비면 다음 배치를 계속 당기므로,
 * 빈 리스트는 커서가 소진되었을 때만 반환됩니다.</p>
 */
final class AllMatchingResolvedStream implements ResolvedStream {

    private final RecordCursor cursor;
    private final Set<RecordId> excluded;
    private final int batchSize;
    private long emitted;
    private boolean exhausted;

    AllMatchingResolvedStream(RecordCursor cursor, Set<RecordId> excluded, int batchSize) {
        this.cursor = cursor;
        this.excluded = excluded;
        this.batchSize = batchSize;
    }

    @Override
    public List<RecordId> nextBatch() {
        while (!exhausted) {
            List<RecordId> candidates;
            try {
                candidates = cursor.nextBatch(batchSize);
            } catch (StoreUnavailableException e) {
                close();
                throw new ResolutionInterruptedException(emitted, e);
            }

            if (candidates.isEmpty()) {
                close();
                break;
            }

            List<RecordId> batch = new ArrayList<>(candidates.size());
            for (RecordId id : candidates) {
                if (!excluded.contains(id)) {
                    batch.add(id);
                }
            }
            if (!batch.isEmpty()) {
                emitted += batch.size();
                return batch;
            }
        }
        return List.of();
    }

    @Override
    public long emittedCount() {
        return emitted;
    }

    @Override
    public void close() {
        if (!exhausted) {
            exhausted = true;
            cursor.close();
        }
    }
}
