package com.ryuqq.selection.core.error;

/**
 * 저장소(Token Store, Record Source) 일시 장애.
 *
 * <p>호출자는 backoff 후 재시도할 수 있습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public class StoreUnavailableException extends SelectionException {

    public static final String ERROR_CODE = "STORE-503";

    public StoreUnavailableException(String message) {
        super(ERROR_CODE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
