package com.ryuqq.selection.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SnapshotBasis 테스트.
 *
 * @author Selection Team
 * @since 1.0.0
 */
class SnapshotBasisTest {

    @Test
    void live_IsSingletonAndNotPinned() {
        assertSame(SnapshotBasis.live(), SnapshotBasis.live());
        assertFalse(SnapshotBasis.live().isPinned());
    }

    @Test
    void pinned_KeepsVersion() {
        // When
        SnapshotBasis basis = SnapshotBasis.pinned(42);

        // Then
        assertTrue(basis.isPinned());
        assertEquals(42, ((PinnedSnapshot) basis).version());
        assertEquals(SnapshotBasis.pinned(42), basis);
    }

    @Test
    void pinned_NegativeVersion_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> SnapshotBasis.pinned(-1));
    }
}
