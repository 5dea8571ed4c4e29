package com.ryuqq.selection.adapter.inmemory.store;

import com.ryuqq.selection.core.model.ResultId;
import com.ryuqq.selection.core.result.BulkOperationResult;
import com.ryuqq.selection.core.spi.BulkResultStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link BulkResultStore} SPI.
 *
 * <p>종료 상태로 저장된 결과는 이후 덮어쓸 수 없습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public class InMemoryBulkResultStore implements BulkResultStore {

    private final ConcurrentHashMap<ResultId, BulkOperationResult> results = new ConcurrentHashMap<>();

    @Override
    public void save(BulkOperationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        results.compute(result.resultId(), (id, existing) -> {
            if (existing != null && existing.status().isTerminal()) {
                throw new IllegalStateException(
                    "Result " + id + " is already terminal (" + existing.status() + ")");
            }
            return result;
        });
    }

    @Override
    public Optional<BulkOperationResult> find(ResultId resultId) {
        if (resultId == null) {
            throw new IllegalArgumentException("resultId cannot be null");
        }
        return Optional.ofNullable(results.get(resultId));
    }

    public int size() {
        return results.size();
    }

    public void clear() {
        results.clear();
    }
}
