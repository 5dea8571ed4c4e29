package com.ryuqq.selection.core.selection;

import com.ryuqq.selection.core.model.RecordId;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Selection State (선택 상태).
 *
 * <p>모드를 판별자로 하는 합 타입입니다. 두 변형은 서로 배타적인 payload를 가집니다:</p>
 * <ul>
 *   <li>{@link ManualSelection}: include 집합만 가짐</li>
 *   <li>{@link AllMatchingSelection}: exclude 집합만 가짐</li>
 * </ul>
 *
 * <p>두 집합을 함께 들고 다니는 평면 구조를 쓰지 않으므로,
 * 비활성 집합은 항상 비어 있다는 불변식이 타입으로 보장됩니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 *                 toggle(id)                      toggle(id)
 *               ┌────────────┐                  ┌────────────┐
 *               ▼            │                  ▼            │
 *          MANUAL(included) ─┘                ALL(excluded) ─┘
 *               │     selectAllMatching()       ▲   │
 *               └───────────────────────────────┘   │
 *               ▲          clearAll()               │
 *               └───────────────────────────────────┘
 * </pre>
 *
 * <p>모드 전환은 항상 두 집합을 비웁니다. 전환 시 집합을 조용히 유지하면
 * 의미가 뒤바뀌므로(include가 exclude로 해석됨) 허용하지 않습니다.</p>
 *
 * <p>모든 연산은 새 인스턴스를 반환하며 I/O가 없습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public sealed interface SelectionState permits ManualSelection, AllMatchingSelection {

    /**
     * 빈 선택 (MANUAL, 집합 모두 비어 있음). 테이블 뷰가 열릴 때의 초기 상태입니다.
     *
     * @return 빈 ManualSelection
     */
    static SelectionState empty() {
        return ManualSelection.EMPTY;
    }

    /**
     * 현재 모드.
     *
     * @return MANUAL 또는 ALL
     */
    SelectionMode mode();

    /**
     * 개별 레코드 토글.
     *
     * <p>MANUAL이면 include 집합에서, ALL이면 exclude 집합에서 id의 포함 여부를 뒤집습니다.
     * 실패하지 않으며, 같은 id로 두 번 호출하면 원래 상태로 돌아옵니다.</p>
     *
     * @param id 레코드 ID
     * @return 새 상태
     * @throws IllegalArgumentException id가 null인 경우
     */
    SelectionState toggle(RecordId id);

    /**
     * 필터 일치 전체 선택: ALL 모드, 두 집합 초기화.
     *
     * @return 빈 AllMatchingSelection
     */
    default SelectionState selectAllMatching() {
        return AllMatchingSelection.EMPTY;
    }

    /**
     * 전체 해제: MANUAL 모드, 두 집합 초기화.
     *
     * @return 빈 ManualSelection
     */
    default SelectionState clearAll() {
        return ManualSelection.EMPTY;
    }

    /**
     * 레코드 선택 여부.
     *
     * <p>ALL 모드의 "전체"는 활성 필터 기준이므로, 필터 일치 여부를 membershipCheck로 받습니다.</p>
     *
     * @param id 레코드 ID
     * @param membershipCheck id가 활성 필터에 일치하는지 검사 (MANUAL 모드에서는 호출되지 않음)
     * @return 선택되어 있으면 true
     */
    boolean isSelected(RecordId id, Predicate<RecordId> membershipCheck);

    /**
     * 선택 건수 추정치.
     *
     * <p>matchingTotal은 화면 표시 시점에 이미 낡았을 수 있으므로 참고용입니다.
     * 실행 시 실제 처리 건수(attempted)가 최종 값입니다.</p>
     *
     * @param matchingTotal 필터 일치 전체 건수 (0 이상)
     * @return MANUAL: |included|, ALL: max(0, matchingTotal - |excluded|)
     * @throws IllegalArgumentException matchingTotal이 음수인 경우
     */
    long estimatedCount(long matchingTotal);

    /**
     * include 집합 (ALL 모드에서는 항상 빈 집합).
     *
     * @return 읽기 전용 집합
     */
    Set<RecordId> included();

    /**
     * exclude 집합 (MANUAL 모드에서는 항상 빈 집합).
     *
     * @return 읽기 전용 집합
     */
    Set<RecordId> excluded();
}
