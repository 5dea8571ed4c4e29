package com.ryuqq.selection.core.spi;

import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.error.TokenExpiredException;
import com.ryuqq.selection.core.error.TokenNotFoundException;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.model.SelectionToken;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.selection.SelectionState;

/**
 * Selection Token Store SPI.
 *
 * <p>불투명 토큰을 (Filter, SelectionState, SnapshotBasis) 묶음에 매핑하는 키-값 저장소입니다.
 * 시스템에서 유일한 공유 가변 상태이며, 여러 서비스 인스턴스가 함께 쓸 수 있도록
 * 외부 저장소(Redis, RDB 테이블 등)로 구현하는 것을 전제로 합니다.</p>
 *
 * <p><strong>키 단위 규칙:</strong></p>
 * <ul>
 *   <li>append/delete only: 저장된 항목을 제자리 갱신하지 않음</li>
 *   <li>TTL: 저장소가 만료를 책임짐 (수동 정리 작업 불필요)</li>
 *   <li>동시 resolve는 순수 읽기이므로 안전</li>
 * </ul>
 *
 * <p><strong>Redis 매핑 예시:</strong></p>
 * <pre>
 * create     → SET sel:{token} {json} PXAT {expiresAt + retention}
 * resolve    → GET sel:{token}   (expiresAt 지남 → TokenExpired, 없음 → TokenNotFound)
 * invalidate → DEL sel:{token}
 * </pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public interface TokenStore {

    /**
     * 새 토큰 발급.
     *
     * @param filter Filter Descriptor
     * @param selection Selection State
     * @param snapshotBasis Live 또는 Pinned
     * @return 저장된 항목 (expiresAt = now + TTL)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws StoreUnavailableException 저장소를 사용할 수 없는 경우
     */
    TokenEntry create(FilterDescriptor filter, SelectionState selection, SnapshotBasis snapshotBasis);

    /**
     * 토큰 조회.
     *
     * @param token 토큰
     * @return 저장된 항목
     * @throws IllegalArgumentException token이 null인 경우
     * @throws TokenNotFoundException 알 수 없는 토큰
     * @throws TokenExpiredException 만료된 토큰
     * @throws StoreUnavailableException 저장소를 사용할 수 없는 경우
     */
    TokenEntry resolve(SelectionToken token);

    /**
     * 토큰 조기 삭제 (멱등).
     *
     * @param token 토큰
     * @throws IllegalArgumentException token이 null인 경우
     */
    void invalidate(SelectionToken token);

    /**
     * 만료 후 보존 기간까지 지난 항목을 최대 batchSize개 삭제.
     *
     * <p>네이티브 TTL이 있는 저장소는 0을 반환하는 no-op으로 구현해도 됩니다.</p>
     *
     * @param batchSize 최대 삭제 수
     * @return 삭제한 항목 수
     * @throws IllegalArgumentException batchSize가 양수가 아닌 경우
     */
    int purgeExpired(int batchSize);

    /**
     * 단일 사용 토큰 여부.
     *
     * <p>true면 실행이 중단 없이 종료된 뒤 호출자가 토큰을 {@link #invalidate(SelectionToken)}합니다.</p>
     *
     * @return 단일 사용이면 true (기본값 false)
     */
    default boolean isSingleUse() {
        return false;
    }
}
