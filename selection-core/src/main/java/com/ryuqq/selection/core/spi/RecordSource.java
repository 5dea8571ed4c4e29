package com.ryuqq.selection.core.spi;

import com.ryuqq.selection.core.error.InvalidFilterException;
import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.filter.RecordSchema;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.model.SnapshotBasis;

import java.util.Collection;
import java.util.List;

/**
 * Record Store SPI (외부 협력자).
 *
 * <p>Filter Descriptor를 Live 또는 Pinned 스냅샷에 대해 평가하고,
 * 일치하는 ID를 안정 정렬 순서로 스트리밍합니다.</p>
 *
 * <p><strong>Pinned 스냅샷과 삭제:</strong> Pinned 평가는 고정 버전의 필드 값으로 필터를 평가하되,
 * 그 이후 삭제된 레코드는 결과에서 제외합니다 (삭제된 레코드에는 Action을 적용할 수 없음).
 * 따라서 Pinned 토큰의 attempted 건수는 고정 시점의 명목 건수가 아니라 현재 살아 있는 레코드 기준입니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public interface RecordSource {

    /**
     * 필터링 가능한 필드 스키마.
     *
     * @return 스키마
     */
    RecordSchema schema();

    /**
     * 현재 데이터 버전 (Pinned 토큰 발급 시 사용).
     *
     * @return 단조 증가하는 버전
     * @throws StoreUnavailableException 저장소 장애
     */
    long currentVersion();

    /**
     * 필터 일치 ID 커서 열기.
     *
     * @param filter Filter Descriptor
     * @param snapshotBasis Live 또는 Pinned
     * @return 커서 (호출자가 close 책임)
     * @throws InvalidFilterException 스키마와 맞지 않는 필터
     * @throws StoreUnavailableException 저장소 장애
     */
    RecordCursor open(FilterDescriptor filter, SnapshotBasis snapshotBasis);

    /**
     * 필터 일치 건수.
     *
     * @param filter Filter Descriptor
     * @param snapshotBasis Live 또는 Pinned
     * @return 일치 건수
     * @throws InvalidFilterException 스키마와 맞지 않는 필터
     * @throws StoreUnavailableException 저장소 장애
     */
    long count(FilterDescriptor filter, SnapshotBasis snapshotBasis);

    /**
     * 주어진 ID 중 필터에 일치하고 존재하는 것만 직접 조회 (MANUAL 모드용).
     *
     * @param filter Filter Descriptor
     * @param snapshotBasis Live 또는 Pinned
     * @param ids 후보 ID
     * @return 일치 ID (안정 정렬 순서, 중복 없음)
     * @throws InvalidFilterException 스키마와 맞지 않는 필터
     * @throws StoreUnavailableException 저장소 장애
     */
    List<RecordId> retainMatching(FilterDescriptor filter, SnapshotBasis snapshotBasis, Collection<RecordId> ids);
}
