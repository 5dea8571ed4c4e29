package com.ryuqq.selection.core.selection;

import com.ryuqq.selection.core.model.RecordId;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * MANUAL 모드: 명시적으로 고른 레코드 집합.
 *
 * @param included 선택된 레코드 ID (불변)
 * @author Selection Team
 * @since 1.0.0
 */
public record ManualSelection(Set<RecordId> included) implements SelectionState {

    static final ManualSelection EMPTY = new ManualSelection(Set.of());

    public ManualSelection {
        if (included == null) {
            throw new IllegalArgumentException("included cannot be null");
        }
        included = Set.copyOf(included);
    }

    @Override
    public SelectionMode mode() {
        return SelectionMode.MANUAL;
    }

    @Override
    public SelectionState toggle(RecordId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Set<RecordId> next = new LinkedHashSet<>(included);
        if (!next.remove(id)) {
            next.add(id);
        }
        return new ManualSelection(next);
    }

    @Override
    public boolean isSelected(RecordId id, Predicate<RecordId> membershipCheck) {
        return included.contains(id);
    }

    @Override
    public long estimatedCount(long matchingTotal) {
        if (matchingTotal < 0) {
            throw new IllegalArgumentException("matchingTotal cannot be negative (current: " + matchingTotal + ")");
        }
        return included.size();
    }

    @Override
    public Set<RecordId> excluded() {
        return Set.of();
    }
}
