package com.ryuqq.selection.application.selection;

import com.ryuqq.selection.core.error.InvalidFilterException;
import com.ryuqq.selection.core.error.TokenExpiredException;
import com.ryuqq.selection.core.filter.FieldType;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.filter.RecordSchema;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.model.SelectionToken;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.selection.SelectionState;
import com.ryuqq.selection.core.spi.RecordSource;
import com.ryuqq.selection.core.spi.TokenEntry;
import com.ryuqq.selection.core.spi.TokenStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * SelectionService 테스트.
 *
 * @author Selection Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SelectionServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final SelectionToken TOKEN = SelectionToken.of("token-abcdefghijklmnop");
    private static final RecordSchema SCHEMA = RecordSchema.builder()
        .field("status", FieldType.STRING)
        .field("replied", FieldType.BOOLEAN)
        .build();

    @Mock
    private TokenStore tokenStore;

    @Mock
    private RecordSource recordSource;

    private SelectionService service;

    @BeforeEach
    void setUp() {
        service = new SelectionService(tokenStore, recordSource, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createSelection_pin이면_현재_버전으로_고정된다() {
        // Given
        FilterDescriptor filter = FilterDescriptor.builder().eq("replied", false).build();
        SelectionState selection = SelectionState.empty().selectAllMatching();
        when(recordSource.schema()).thenReturn(SCHEMA);
        when(recordSource.currentVersion()).thenReturn(42L);
        when(tokenStore.create(filter, selection, SnapshotBasis.pinned(42L)))
            .thenReturn(entry(filter, selection, SnapshotBasis.pinned(42L)));

        // When
        TokenEntry entry = service.createSelection(filter, selection, true);

        // Then
        assertThat(entry.token()).isEqualTo(TOKEN);
        assertThat(entry.snapshotBasis()).isEqualTo(SnapshotBasis.pinned(42L));
    }

    @Test
    void createSelection_pin이_아니면_live로_발급되고_버전을_조회하지_않는다() {
        // Given
        FilterDescriptor filter = FilterDescriptor.matchAll();
        SelectionState selection = SelectionState.empty();
        when(recordSource.schema()).thenReturn(SCHEMA);
        when(tokenStore.create(filter, selection, SnapshotBasis.live()))
            .thenReturn(entry(filter, selection, SnapshotBasis.live()));

        // When
        TokenEntry entry = service.createSelection(filter, selection, false);

        // Then
        assertThat(entry.snapshotBasis()).isEqualTo(SnapshotBasis.live());
        verify(recordSource, never()).currentVersion();
    }

    @Test
    void createSelection_잘못된_필터는_토큰을_발급하지_않는다() {
        // Given
        FilterDescriptor filter = FilterDescriptor.builder().eq("unknown", "x").build();
        when(recordSource.schema()).thenReturn(SCHEMA);

        // When & Then
        assertThatThrownBy(() -> service.createSelection(filter, SelectionState.empty(), true))
            .isInstanceOf(InvalidFilterException.class)
            .hasMessageContaining("unknown");
        verifyNoInteractions(tokenStore);
    }

    @Test
    void createSelection_null_인자는_거부된다() {
        assertThatThrownBy(() -> service.createSelection(null, SelectionState.empty(), false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("filter cannot be null");
        assertThatThrownBy(() -> service.createSelection(FilterDescriptor.matchAll(), null, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("selection cannot be null");
    }

    @Test
    void estimate_ALL_모드는_전체_매칭에서_제외_건수를_뺀다() {
        // Given
        FilterDescriptor filter = FilterDescriptor.builder().eq("replied", false).build();
        SelectionState selection = SelectionState.empty().selectAllMatching()
            .toggle(RecordId.of("r-1"))
            .toggle(RecordId.of("r-2"));
        TokenEntry entry = entry(filter, selection, SnapshotBasis.pinned(7L));
        when(tokenStore.resolve(TOKEN)).thenReturn(entry);
        when(recordSource.count(filter, SnapshotBasis.pinned(7L))).thenReturn(100L);

        // When
        SelectionEstimate estimate = service.estimate(TOKEN);

        // Then
        assertThat(estimate.estimatedCount()).isEqualTo(98L);
        assertThat(estimate.computedAt()).isEqualTo(NOW);
    }

    @Test
    void estimate_MANUAL_모드는_포함_건수이며_소스를_조회하지_않는다() {
        // Given
        SelectionState selection = SelectionState.empty()
            .toggle(RecordId.of("r-1"))
            .toggle(RecordId.of("r-2"))
            .toggle(RecordId.of("r-3"));
        when(tokenStore.resolve(TOKEN)).thenReturn(entry(FilterDescriptor.matchAll(), selection, SnapshotBasis.live()));

        // When
        SelectionEstimate estimate = service.estimate(TOKEN);

        // Then
        assertThat(estimate.estimatedCount()).isEqualTo(3L);
        verify(recordSource, never()).count(any(), any());
    }

    @Test
    void estimate_만료된_토큰은_전파된다() {
        // Given
        when(tokenStore.resolve(TOKEN)).thenThrow(new TokenExpiredException(TOKEN, NOW));

        // When & Then
        assertThatThrownBy(() -> service.estimate(TOKEN))
            .isInstanceOf(TokenExpiredException.class);
    }

    private static TokenEntry entry(FilterDescriptor filter, SelectionState selection, SnapshotBasis basis) {
        return new TokenEntry(TOKEN, filter, selection, basis, NOW, NOW.plus(Duration.ofMinutes(15)));
    }
}
