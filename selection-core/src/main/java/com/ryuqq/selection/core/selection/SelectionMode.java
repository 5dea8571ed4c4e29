package com.ryuqq.selection.core.selection;

/**
 * 선택 모드.
 *
 * @author Selection Team
 * @since 1.0.0
 */
public enum SelectionMode {

    /**
     * 명시적으로 고른 레코드만 선택 (include 목록).
     */
    MANUAL,

    /**
     * 필터에 일치하는 모든 레코드에서 일부를 제외 (exclude 목록).
     */
    ALL
}
