package com.ryuqq.selection.application.selection;

import com.ryuqq.selection.core.error.InvalidFilterException;
import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.error.TokenExpiredException;
import com.ryuqq.selection.core.error.TokenNotFoundException;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.model.SelectionToken;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.selection.SelectionMode;
import com.ryuqq.selection.core.selection.SelectionState;
import com.ryuqq.selection.core.spi.RecordSource;
import com.ryuqq.selection.core.spi.TokenEntry;
import com.ryuqq.selection.core.spi.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 선택 토큰 발급과 건수 추정 유스케이스.
 *
 * <p>UI는 클릭마다 서버를 호출하지 않고 Selection State를 로컬에서 변경하다가,
 * 실제로 Bulk Action을 실행할 때만 토큰을 요청합니다 (지연 발급).</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * createSelection(filter, selection, pin)
 *   1. filter.validate(recordSource.schema())   → InvalidFilterException (fail fast)
 *   2. pin ? pinned(recordSource.currentVersion()) : live
 *   3. tokenStore.create(filter, selection, basis)
 *
 * estimate(token)
 *   1. tokenStore.resolve(token)                → TokenNotFound / TokenExpired
 *   2. MANUAL: |included|
 *      ALL:    recordSource.count(filter, basis) - |excluded|
 * </pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class SelectionService {

    private static final Logger log = LoggerFactory.getLogger(SelectionService.class);

    private final TokenStore tokenStore;
    private final RecordSource recordSource;
    private final Clock clock;

    public SelectionService(TokenStore tokenStore, RecordSource recordSource) {
        this(tokenStore, recordSource, Clock.systemUTC());
    }

    public SelectionService(TokenStore tokenStore, RecordSource recordSource, Clock clock) {
        if (tokenStore == null) {
            throw new IllegalArgumentException("tokenStore cannot be null");
        }
        if (recordSource == null) {
            throw new IllegalArgumentException("recordSource cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.tokenStore = tokenStore;
        this.recordSource = recordSource;
        this.clock = clock;
    }

    /**
     * 토큰 발급 ({@code POST /selections}).
     *
     * @param filter Filter Descriptor
     * @param selection Selection State
     * @param pinSnapshot true면 현재 데이터 버전에 고정 (결정적 resolve)
     * @return 발급된 항목 (token, expiresAt)
     * @throws IllegalArgumentException filter 또는 selection이 null인 경우
     * @throws InvalidFilterException 스키마와 맞지 않는 필터
     * @throws StoreUnavailableException 저장소 장애
     */
    public TokenEntry createSelection(FilterDescriptor filter, SelectionState selection, boolean pinSnapshot) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (selection == null) {
            throw new IllegalArgumentException("selection cannot be null");
        }

        filter.validate(recordSource.schema());

        SnapshotBasis basis = pinSnapshot
            ? SnapshotBasis.pinned(recordSource.currentVersion())
            : SnapshotBasis.live();

        TokenEntry entry = tokenStore.create(filter, selection, basis);
        log.info("Selection token issued: {} (mode={}, snapshot={}, expiresAt={})",
            entry.token(), selection.mode(), basis, entry.expiresAt());
        return entry;
    }

    /**
     * 선택 건수 추정 ({@code POST /selections/{token}/estimate}).
     *
     * @param token 토큰
     * @return 추정 건수 (참고용)
     * @throws TokenNotFoundException 알 수 없는 토큰
     * @throws TokenExpiredException 만료된 토큰
     * @throws StoreUnavailableException 저장소 장애
     */
    public SelectionEstimate estimate(SelectionToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        TokenEntry entry = tokenStore.resolve(token);
        SelectionState selection = entry.selection();

        long matchingTotal = 0;
        if (selection.mode() == SelectionMode.ALL) {
            matchingTotal = recordSource.count(entry.filter(), entry.snapshotBasis());
        }
        long estimated = selection.estimatedCount(matchingTotal);

        log.debug("Estimated {} selected records for {} (matchingTotal={})", estimated, token, matchingTotal);
        return new SelectionEstimate(estimated, clock.instant());
    }
}
