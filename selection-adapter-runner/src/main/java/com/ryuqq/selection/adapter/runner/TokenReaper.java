package com.ryuqq.selection.adapter.runner;

import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.spi.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token Reaper 컴포넌트.
 *
 * <p>네이티브 TTL이 없는 {@link TokenStore} 구현에서 만료 후 보존 기간이 지난 토큰을 정리합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. purgeExpired(batchSize) 반복
 * 2. 반환값이 batchSize보다 작으면 (더 지울 것이 없음) 종료
 * 3. maxBatchesPerScan에 도달하면 다음 스캔으로 넘김
 * 4. 저장소 장애 시 경고 로그 후 다음 스캔에서 재시도
 * </pre>
 *
 * <p>주기적으로 호출되어야 합니다 (예: @Scheduled, ScheduledExecutorService).
 * 여러 인스턴스가 동시에 실행해도 안전합니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class TokenReaper {

    private static final Logger log = LoggerFactory.getLogger(TokenReaper.class);

    private final TokenStore tokenStore;
    private final TokenReaperConfig config;

    /**
     * @param tokenStore 토큰 저장소
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TokenReaper(TokenStore tokenStore, TokenReaperConfig config) {
        if (tokenStore == null) {
            throw new IllegalArgumentException("tokenStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.tokenStore = tokenStore;
        this.config = config;
    }

    /**
     * 만료 토큰 정리.
     *
     * @return 이번 스캔에서 삭제한 토큰 수
     */
    public int scan() {
        int purged = 0;
        int batches = 0;
        try {
            while (batches < config.maxBatchesPerScan()) {
                int removed = tokenStore.purgeExpired(config.batchSize());
                batches++;
                purged += removed;
                if (removed < config.batchSize()) {
                    break;
                }
            }
        } catch (StoreUnavailableException e) {
            log.warn("Token reaper scan stopped after {} purged: token store unavailable", purged, e);
            return purged;
        }

        if (purged > 0) {
            log.info("Token reaper scan completed: {} purged in {} batches", purged, batches);
        } else {
            log.debug("Token reaper scan completed: nothing to purge");
        }
        return purged;
    }
}
