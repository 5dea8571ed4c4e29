package com.ryuqq.selection.core.resolver;

import com.ryuqq.selection.core.error.ResolutionInterruptedException;
import com.ryuqq.selection.core.model.RecordId;

import java.util.List;

/**
 * Resolve 결과의 지연 시퀀스 (pull 기반 커서).
 *
 * <p>유한하며, Pinned 스냅샷이 아니면 다시 열었을 때 같은 결과를 보장하지 않습니다.
 * 한 번에 한 배치씩만 메모리에 올립니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (ResolvedStream stream = resolver.resolve(entry)) {
 *     List<RecordId> batch;
 *     while (!(batch = stream.nextBatch()).isEmpty()) {
 *         batch.forEach(action::apply);
 *     }
 * }
 * }</pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public interface ResolvedStream extends AutoCloseable {

    /**
     * 다음 배치.
     *
     * @return ID 목록 (안정 정렬 순서), 소진되면 빈 리스트
     * @throws ResolutionInterruptedException 데이터 소스가 도중에 끊긴 경우
     */
    List<RecordId> nextBatch();

    /**
     * 지금까지 방출한 ID 수.
     *
     * @return 방출 수
     */
    long emittedCount();

    @Override
    void close();
}
