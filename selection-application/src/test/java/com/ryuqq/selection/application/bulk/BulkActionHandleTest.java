package com.ryuqq.selection.application.bulk;

import com.ryuqq.selection.core.model.ResultId;
import com.ryuqq.selection.core.result.BulkOperationResult;
import com.ryuqq.selection.core.statemachine.BulkOperationStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BulkActionHandle 유닛 테스트.
 *
 * @author Selection Team
 * @since 1.0.0
 */
class BulkActionHandleTest {

    private static final Instant STARTED = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void completed_핸들은_결과를_담고_URL이_없다() {
        // given
        ResultId resultId = ResultId.of("result-1");
        BulkOperationResult result = new BulkOperationResult(resultId, "reply", BulkOperationStatus.COMPLETED,
            null, 3, 3, 0, List.of(), STARTED, STARTED.plusSeconds(1));

        // when
        BulkActionHandle handle = BulkActionHandle.completed(result);

        // then
        assertThat(handle.getResultId()).isEqualTo(resultId);
        assertThat(handle.isCompletedInline()).isTrue();
        assertThat(handle.getResultOrNull()).isEqualTo(result);
        assertThat(handle.getStatusUrlOrNull()).isNull();
    }

    @Test
    void async_핸들은_상태_조회_URL을_담는다() {
        // given
        ResultId resultId = ResultId.of("result-2");

        // when
        BulkActionHandle handle = BulkActionHandle.async(resultId);

        // then
        assertThat(handle.isCompletedInline()).isFalse();
        assertThat(handle.getResultOrNull()).isNull();
        assertThat(handle.getStatusUrlOrNull()).isEqualTo("/bulk-actions/result-2");
        assertThat(handle.toString()).contains("statusUrl=/bulk-actions/result-2");
    }

    @Test
    void 실행_중인_결과로_completed_핸들을_만들_수_없다() {
        BulkOperationResult running = BulkOperationResult.started(ResultId.of("result-3"), "reply", STARTED);

        assertThatThrownBy(() -> BulkActionHandle.completed(running))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("terminal");
        assertThatThrownBy(() -> BulkActionHandle.completed(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
