package com.ryuqq.selection.core.selection;

import com.ryuqq.selection.core.model.RecordId;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * ALL 모드: 필터에 일치하는 모든 레코드 중 excluded를 뺀 집합.
 *
 * @param excluded 제외된 레코드 ID (불변)
 * @author Selection Team
 * @since 1.0.0
 */
public record AllMatchingSelection(Set<RecordId> excluded) implements SelectionState {

    static final AllMatchingSelection EMPTY = new AllMatchingSelection(Set.of());

    public AllMatchingSelection {
        if (excluded == null) {
            throw new IllegalArgumentException("excluded cannot be null");
        }
        excluded = Set.copyOf(excluded);
    }

    @Override
    public SelectionMode mode() {
        return SelectionMode.ALL;
    }

    @Override
    public SelectionState toggle(RecordId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Set<RecordId> next = new LinkedHashSet<>(excluded);
        if (!next.remove(id)) {
            next.add(id);
        }
        return new AllMatchingSelection(next);
    }

    @Override
    public boolean isSelected(RecordId id, Predicate<RecordId> membershipCheck) {
        if (membershipCheck == null) {
            throw new IllegalArgumentException("membershipCheck cannot be null in ALL mode");
        }
        return membershipCheck.test(id) && !excluded.contains(id);
    }

    @Override
    public long estimatedCount(long matchingTotal) {
        if (matchingTotal < 0) {
            throw new IllegalArgumentException("matchingTotal cannot be negative (current: " + matchingTotal + ")");
        }
        return Math.max(0, matchingTotal - excluded.size());
    }

    @Override
    public Set<RecordId> included() {
        return Set.of();
    }
}
