package com.ryuqq.selection.core.model;

/**
 * Resolve 시점의 데이터 기준.
 *
 * <ul>
 *   <li>{@link LiveSnapshot}: resolve 시점의 최신 데이터로 필터를 다시 평가합니다.
 *       호출마다 결과가 달라질 수 있으며, 이는 보장하지 않는 동작이지 버그가 아닙니다.</li>
 *   <li>{@link PinnedSnapshot}: 고정된 데이터 버전으로 평가합니다 (결정적 resolve).</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public sealed interface SnapshotBasis permits LiveSnapshot, PinnedSnapshot {

    /**
     * Live 기준 반환.
     *
     * @return LiveSnapshot 싱글턴
     */
    static SnapshotBasis live() {
        return LiveSnapshot.INSTANCE;
    }

    /**
     * 특정 버전에 고정된 기준 생성.
     *
     * @param version 데이터 버전 (0 이상)
     * @return PinnedSnapshot
     * @throws IllegalArgumentException version이 음수인 경우
     */
    static SnapshotBasis pinned(long version) {
        return new PinnedSnapshot(version);
    }

    /**
     * 고정 기준인지 확인.
     *
     * @return PinnedSnapshot이면 true
     */
    default boolean isPinned() {
        return this instanceof PinnedSnapshot;
    }
}
