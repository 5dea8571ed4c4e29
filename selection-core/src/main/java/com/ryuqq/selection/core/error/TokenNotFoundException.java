package com.ryuqq.selection.core.error;

import com.ryuqq.selection.core.model.SelectionToken;

/**
 * 알 수 없는 토큰.
 *
 * <p>만료가 아니라 존재하지 않는 토큰이므로 프로그래밍 오류나 잘못된 북마크를 의미합니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public class TokenNotFoundException extends SelectionException {

    public static final String ERROR_CODE = "TOKEN-404";

    public TokenNotFoundException(SelectionToken token) {
        super(ERROR_CODE, "Unknown selection token: " + token);
    }
}
