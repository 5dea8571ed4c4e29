package com.ryuqq.selection.adapter.inmemory.store;

import java.time.Duration;

/**
 * Token Store 설정.
 *
 * @param ttl 토큰 유효 시간 (기본 15분)
 * @param expiredRetention 만료 후 "expired"로 구분해 보관하는 기간 (기본 1시간, 0이면 즉시 삭제 대상)
 * @param singleUse 실행 종료 후 토큰 무효화 여부 (기본 false)
 * @author Selection Team
 * @since 1.0.0
 */
public record TokenStoreConfig(Duration ttl, Duration expiredRetention, boolean singleUse) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_EXPIRED_RETENTION = Duration.ofHours(1);

    public TokenStoreConfig {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (expiredRetention == null || expiredRetention.isNegative()) {
            throw new IllegalArgumentException("expiredRetention cannot be null or negative");
        }
    }

    public TokenStoreConfig() {
        this(DEFAULT_TTL, DEFAULT_EXPIRED_RETENTION, false);
    }

    public TokenStoreConfig withTtl(Duration ttl) {
        return new TokenStoreConfig(ttl, expiredRetention, singleUse);
    }

    public TokenStoreConfig withExpiredRetention(Duration expiredRetention) {
        return new TokenStoreConfig(ttl, expiredRetention, singleUse);
    }

    public TokenStoreConfig withSingleUse(boolean singleUse) {
        return new TokenStoreConfig(ttl, expiredRetention, singleUse);
    }
}
