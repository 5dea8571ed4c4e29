package com.ryuqq.selection.core.spi;

import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.model.RecordId;

import java.util.List;

/**
 * Pull 기반 레코드 커서.
 *
 * <p>호출자가 다음 배치를 요청할 때만 저장소에서 읽습니다 (backpressure).
 * ID는 안정 정렬 키 순서로 방출됩니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public interface RecordCursor extends AutoCloseable {

    /**
     * 다음 배치 조회.
     *
     * @param maxSize 최대 ID 수 (양수)
     * @return 다음 ID 목록, 소진되었으면 빈 리스트
     * @throws StoreUnavailableException 저장소 장애
     */
    List<RecordId> nextBatch(int maxSize);

    @Override
    void close();
}
