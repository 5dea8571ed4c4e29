package com.ryuqq.selection.core.error;

import com.ryuqq.selection.core.model.SelectionToken;

import java.time.Instant;

/**
 * 만료된 토큰.
 *
 * <p>UI는 "선택이 만료되었습니다. 다시 선택해 주세요"로 안내합니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public class TokenExpiredException extends SelectionException {

    public static final String ERROR_CODE = "TOKEN-410";

    private final Instant expiredAt;

    public TokenExpiredException(SelectionToken token, Instant expiredAt) {
        super(ERROR_CODE, "Selection token " + token + " expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
