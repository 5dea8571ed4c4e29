package com.ryuqq.selection.core.resolver;

import com.ryuqq.selection.core.error.InvalidFilterException;
import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.selection.SelectionMode;
import com.ryuqq.selection.core.selection.SelectionState;
import com.ryuqq.selection.core.spi.RecordCursor;
import com.ryuqq.selection.core.spi.RecordSource;
import com.ryuqq.selection.core.spi.TokenEntry;

import java.util.List;

/**
 * Resolver: (Filter, SelectionState, SnapshotBasis)를 구체적인 ID 스트림으로 변환.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>스냅샷 기준(Pinned 버전 또는 Live)으로 필터 평가</li>
 *   <li>MANUAL: include 집합을 필터에 직접 조회({@link RecordSource#retainMatching})하여 검증.
 *       include는 보통 한 페이지 분량이므로 전체 후보를 스트리밍하지 않습니다.</li>
 *   <li>ALL: 후보 커서를 스트리밍하며 exclude 집합 제거</li>
 *   <li>batchSize 단위로 방출. ALL 모드에서 전체 후보를 메모리에 올리지 않습니다.</li>
 * </ol>
 *
 * <p><strong>실패:</strong> 커서가 도중에 {@link StoreUnavailableException}을 던지면
 * 스트림은 {@link com.ryuqq.selection.core.error.ResolutionInterruptedException}으로 중단됩니다.
 * 열기 단계의 실패는 그대로 전파됩니다 (아직 방출된 것이 없음).</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class SelectionResolver {

    private final RecordSource recordSource;
    private final ResolverConfig config;

    public SelectionResolver(RecordSource recordSource) {
        this(recordSource, new ResolverConfig());
    }

    public SelectionResolver(RecordSource recordSource, ResolverConfig config) {
        if (recordSource == null) {
            throw new IllegalArgumentException("recordSource cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.recordSource = recordSource;
        this.config = config;
    }

    /**
     * 토큰 항목 resolve.
     *
     * @param entry Token Store 항목
     * @return ID 스트림 (호출자가 close 책임)
     */
    public ResolvedStream resolve(TokenEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        return resolve(entry.filter(), entry.selection(), entry.snapshotBasis());
    }

    /**
     * Resolve.
     *
     * @param filter Filter Descriptor
     * @param selection Selection State
     * @param snapshotBasis Live 또는 Pinned
     * @return ID 스트림 (호출자가 close 책임)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws InvalidFilterException 스키마와 맞지 않는 필터
     * @throws StoreUnavailableException 스트림을 열 수 없는 경우
     */
    public ResolvedStream resolve(FilterDescriptor filter, SelectionState selection, SnapshotBasis snapshotBasis) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (selection == null) {
            throw new IllegalArgumentException("selection cannot be null");
        }
        if (snapshotBasis == null) {
            throw new IllegalArgumentException("snapshotBasis cannot be null");
        }

        if (selection.mode() == SelectionMode.MANUAL) {
            if (selection.included().isEmpty()) {
                return new ManualResolvedStream(List.of(), config.batchSize());
            }
            List<RecordId> matched = recordSource.retainMatching(filter, snapshotBasis, selection.included());
            return new ManualResolvedStream(matched, config.batchSize());
        }

        RecordCursor cursor = recordSource.open(filter, snapshotBasis);
        return new AllMatchingResolvedStream(cursor, selection.excluded(), config.batchSize());
    }

    public ResolverConfig getConfig() {
        return config;
    }
}
