package com.ryuqq.selection.core.resolver;

import com.ryuqq.selection.core.error.ResolutionInterruptedException;
import com.ryuqq.selection.core.error.StoreUnavailableException;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.selection.SelectionState;
import com.ryuqq.selection.core.spi.RecordCursor;
import com.ryuqq.selection.core.spi.RecordSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SelectionResolver 테스트.
 *
 * @author Selection Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SelectionResolverTest {

    private static final FilterDescriptor FILTER = FilterDescriptor.builder().eq("replied", false).build();

    @Mock
    private RecordSource recordSource;

    @Mock
    private RecordCursor cursor;

    @Test
    void resolve_ManualWithEmptyInclude_SkipsRecordSource() {
        // Given
        SelectionResolver resolver = new SelectionResolver(recordSource);

        // When
        ResolvedStream stream = resolver.resolve(FILTER, SelectionState.empty(), SnapshotBasis.live());

        // Then
        assertTrue(stream.nextBatch().isEmpty());
        assertEquals(0, stream.emittedCount());
        verify(recordSource, never()).retainMatching(any(), any(), anyCollection());
        verify(recordSource, never()).open(any(), any());
    }

    @Test
    void resolve_Manual_EmitsOnlyIdsStillMatchingInBatches() {
        // Given
        SelectionState selection = SelectionState.empty()
            .toggle(id("a")).toggle(id("b")).toggle(id("c")).toggle(id("gone"));
        when(recordSource.retainMatching(eq(FILTER), eq(SnapshotBasis.live()), anyCollection()))
            .thenReturn(List.of(id("a"), id("b"), id("c")));
        SelectionResolver resolver = new SelectionResolver(recordSource, new ResolverConfig(2));

        // When
        ResolvedStream stream = resolver.resolve(FILTER, selection, SnapshotBasis.live());

        // Then
        assertEquals(List.of(id("a"), id("b")), stream.nextBatch());
        assertEquals(List.of(id("c")), stream.nextBatch());
        assertTrue(stream.nextBatch().isEmpty());
        assertEquals(3, stream.emittedCount());
    }

    @Test
    void resolve_All_DropsExcludedIdsAndClosesCursorAtEnd() {
        // Given
        SelectionState selection = SelectionState.empty().selectAllMatching().toggle(id("b")).toggle(id("c"));
        when(recordSource.open(FILTER, SnapshotBasis.live())).thenReturn(cursor);
        when(cursor.nextBatch(3))
            .thenReturn(List.of(id("a"), id("b"), id("c")))
            .thenReturn(List.of(id("d")))
            .thenReturn(List.of());
        SelectionResolver resolver = new SelectionResolver(recordSource, new ResolverConfig(3));

        // When
        List<RecordId> drained = drain(resolver.resolve(FILTER, selection, SnapshotBasis.live()));

        // Then
        assertEquals(List.of(id("a"), id("d")), drained);
        verify(cursor, times(1)).close();
    }

    @Test
    void resolve_All_SkipsBatchesThatAreFullyExcluded() {
        // Given
        SelectionState selection = SelectionState.empty().selectAllMatching().toggle(id("a")).toggle(id("b"));
        when(recordSource.open(FILTER, SnapshotBasis.live())).thenReturn(cursor);
        when(cursor.nextBatch(2))
            .thenReturn(List.of(id("a"), id("b")))
            .thenReturn(List.of(id("c")));
        SelectionResolver resolver = new SelectionResolver(recordSource, new ResolverConfig(2));

        // When
        ResolvedStream stream = resolver.resolve(FILTER, selection, SnapshotBasis.live());

        // Then
        assertEquals(List.of(id("c")), stream.nextBatch());
        assertEquals(1, stream.emittedCount());
    }

    @Test
    void resolve_All_StoreFailureMidStream_ThrowsResolutionInterrupted() {
        // Given
        when(recordSource.open(FILTER, SnapshotBasis.live())).thenReturn(cursor);
        when(cursor.nextBatch(2))
            .thenReturn(List.of(id("a"), id("b")))
            .thenThrow(new StoreUnavailableException("connection reset"));
        SelectionResolver resolver = new SelectionResolver(recordSource, new ResolverConfig(2));
        ResolvedStream stream = resolver.resolve(FILTER, SelectionState.empty().selectAllMatching(),
            SnapshotBasis.live());
        stream.nextBatch();

        // When
        ResolutionInterruptedException exception = assertThrows(ResolutionInterruptedException.class, stream::nextBatch);

        // Then
        assertEquals(2, exception.getEmittedCount());
        assertInstanceOf(StoreUnavailableException.class, exception.getCause());
        assertEquals(ResolutionInterruptedException.ERROR_CODE, exception.getErrorCode());
        verify(cursor).close();
    }

    @Test
    void resolve_All_OpenFailure_PropagatesStoreUnavailable() {
        when(recordSource.open(FILTER, SnapshotBasis.pinned(3)))
            .thenThrow(new StoreUnavailableException("down"));
        SelectionResolver resolver = new SelectionResolver(recordSource);

        assertThrows(StoreUnavailableException.class,
            () -> resolver.resolve(FILTER, SelectionState.empty().selectAllMatching(), SnapshotBasis.pinned(3)));
    }

    @Test
    void close_BeforeExhaustion_ClosesCursorOnce() {
        // Given
        when(recordSource.open(FILTER, SnapshotBasis.live())).thenReturn(cursor);
        ResolvedStream stream = new SelectionResolver(recordSource)
            .resolve(FILTER, SelectionState.empty().selectAllMatching(), SnapshotBasis.live());

        // When
        stream.close();
        stream.close();

        // Then
        verify(cursor, times(1)).close();
        assertTrue(stream.nextBatch().isEmpty());
    }

    @Test
    void resolve_NullArguments_ThrowException() {
        SelectionResolver resolver = new SelectionResolver(recordSource);

        assertThrows(IllegalArgumentException.class,
            () -> resolver.resolve(null, SelectionState.empty(), SnapshotBasis.live()));
        assertThrows(IllegalArgumentException.class,
            () -> resolver.resolve(FILTER, null, SnapshotBasis.live()));
        assertThrows(IllegalArgumentException.class,
            () -> resolver.resolve(FILTER, SelectionState.empty(), null));
    }

    @Test
    void resolverConfig_BatchSizeOutOfRange_ThrowsException() {
        assertEquals(1000, new ResolverConfig().batchSize());
        assertThrows(IllegalArgumentException.class, () -> new ResolverConfig(0));
        assertThrows(IllegalArgumentException.class, () -> new ResolverConfig(ResolverConfig.MAX_BATCH_SIZE + 1));
        assertEquals(50, new ResolverConfig().withBatchSize(50).batchSize());
    }

    private static List<RecordId> drain(ResolvedStream stream) {
        List<RecordId> drained = new ArrayList<>();
        List<RecordId> batch;
        while (!(batch = stream.nextBatch()).isEmpty()) {
            drained.addAll(batch);
        }
        return drained;
    }

    private static RecordId id(String value) {
        return RecordId.of(value);
    }
}
