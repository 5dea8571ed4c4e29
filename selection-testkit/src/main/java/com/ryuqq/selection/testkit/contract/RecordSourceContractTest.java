package com.ryuqq.selection.testkit.contract;

import com.ryuqq.selection.core.error.InvalidFilterException;
import com.ryuqq.selection.core.filter.FieldType;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.filter.Operator;
import com.ryuqq.selection.core.filter.RecordSchema;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.spi.RecordCursor;
import com.ryuqq.selection.core.spi.RecordSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * {@link RecordSource} 구현체가 지켜야 하는 계약 테스트.
 *
 * <p>모든 테스트는 {@link #SCHEMA} 스키마의 레코드 10건(r-00 ~ r-09)으로 시작합니다.
 * 짝수 번호는 replied=false, 홀수 번호는 replied=true이며 score는 번호와 같습니다.</p>
 *
 * <p><strong>검증 항목:</strong></p>
 * <ul>
 *   <li>커서는 ID 오름차순으로 중복 없이 모든 매칭 레코드를 방출</li>
 *   <li>count는 커서 방출 건수와 일치</li>
 *   <li>retainMatching은 매칭되는 ID만 안정적인 순서로 반환</li>
 *   <li>pinned 스냅샷: 고정 이후 변경/추가는 보이지 않고, 삭제된 레코드는 제외</li>
 *   <li>스키마와 맞지 않는 필터는 InvalidFilterException</li>
 * </ul>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public abstract class RecordSourceContractTest {

    protected static final RecordSchema SCHEMA = RecordSchema.builder()
        .field("status", FieldType.STRING)
        .field("replied", FieldType.BOOLEAN)
        .field("score", FieldType.NUMBER)
        .build();

    protected static final FilterDescriptor UNREPLIED = FilterDescriptor.builder().eq("replied", false).build();

    protected RecordSource source;

    /**
     * @param schema 레코드 스키마
     * @return 비어 있는 소스
     */
    protected abstract RecordSource createSource(RecordSchema schema);

    protected abstract void insert(RecordId id, Map<String, Object> fields);

    protected abstract void update(RecordId id, Map<String, Object> fields);

    protected abstract void delete(RecordId id);

    @BeforeEach
    void setUpSource() {
        source = createSource(SCHEMA);
        for (int i = 0; i < 10; i++) {
            insert(id(i), fields(i % 2 == 1, i));
        }
    }

    @Test
    void 커서는_매칭_레코드를_ID_순서대로_배치로_방출한다() {
        List<RecordId> ids = drain(UNREPLIED, SnapshotBasis.live(), 2);

        assertThat(ids).containsExactly(id(0), id(2), id(4), id(6), id(8));
    }

    @Test
    void matchAll_커서는_전체를_방출한다() {
        List<RecordId> ids = drain(FilterDescriptor.matchAll(), SnapshotBasis.live(), 3);

        assertThat(ids).hasSize(10).doesNotHaveDuplicates().isSorted();
    }

    @Test
    void count는_커서_방출_건수와_같다() {
        FilterDescriptor highScore = FilterDescriptor.builder().where("score", Operator.GTE, 5).build();

        assertThat(source.count(highScore, SnapshotBasis.live()))
            .isEqualTo(drain(highScore, SnapshotBasis.live(), 4).size())
            .isEqualTo(5L);
    }

    @Test
    void retainMatching은_매칭되는_ID만_안정적인_순서로_반환한다() {
        // Given
        List<RecordId> candidates = List.of(id(5), id(4), RecordId.of("r-missing"), id(0), id(4));

        // When
        List<RecordId> retained = source.retainMatching(UNREPLIED, SnapshotBasis.live(), candidates);

        // Then
        assertThat(retained).containsExactly(id(0), id(4));
    }

    @Test
    void live_스냅샷은_최신_변경을_본다() {
        // Given
        update(id(1), fields(false, 1));
        delete(id(2));

        // When
        List<RecordId> ids = drain(UNREPLIED, SnapshotBasis.live(), 10);

        // Then
        assertThat(ids).containsExactly(id(0), id(1), id(4), id(6), id(8));
    }

    @Test
    void pinned_스냅샷은_고정_이후의_변경과_추가를_보지_않는다() {
        // Given
        SnapshotBasis pinned = SnapshotBasis.pinned(source.currentVersion());
        update(id(1), fields(false, 1));
        update(id(0), fields(true, 0));
        insert(RecordId.of("r-10"), fields(false, 10));

        // When
        List<RecordId> ids = drain(UNREPLIED, pinned, 10);

        // Then
        assertThat(ids).containsExactly(id(0), id(2), id(4), id(6), id(8));
        assertThat(source.count(UNREPLIED, pinned)).isEqualTo(5L);
    }

    @Test
    void pinned_스냅샷도_고정_이후_삭제된_레코드는_제외한다() {
        // Given
        SnapshotBasis pinned = SnapshotBasis.pinned(source.currentVersion());
        delete(id(4));

        // When
        List<RecordId> streamed = drain(UNREPLIED, pinned, 10);
        List<RecordId> retained = source.retainMatching(UNREPLIED, pinned, List.of(id(2), id(4)));

        // Then
        assertThat(streamed).containsExactly(id(0), id(2), id(6), id(8));
        assertThat(retained).containsExactly(id(2));
    }

    @Test
    void currentVersion은_변경마다_증가한다() {
        long before = source.currentVersion();

        update(id(3), fields(false, 3));

        assertThat(source.currentVersion()).isGreaterThan(before);
    }

    @Test
    void 스키마에_없는_필드를_쓰는_필터는_거부된다() {
        FilterDescriptor unknown = FilterDescriptor.builder().eq("priority", "high").build();

        assertThatThrownBy(() -> source.open(unknown, SnapshotBasis.live()))
            .isInstanceOf(InvalidFilterException.class)
            .hasMessageContaining("priority");
        assertThatThrownBy(() -> source.count(unknown, SnapshotBasis.live()))
            .isInstanceOf(InvalidFilterException.class);
        assertThatThrownBy(() -> source.retainMatching(unknown, SnapshotBasis.live(), List.of(id(0))))
            .isInstanceOf(InvalidFilterException.class);
    }

    @Test
    void BOOLEAN_필드에_범위_연산자를_쓰는_필터는_거부된다() {
        FilterDescriptor range = FilterDescriptor.builder().where("replied", Operator.GT, false).build();

        assertThatThrownBy(() -> source.open(range, SnapshotBasis.live()))
            .isInstanceOf(InvalidFilterException.class);
        assertThatThrownBy(() -> source.count(range, SnapshotBasis.pinned(source.currentVersion())))
            .isInstanceOf(InvalidFilterException.class);
    }

    protected List<RecordId> drain(FilterDescriptor filter, SnapshotBasis basis, int batchSize) {
        List<RecordId> all = new ArrayList<>();
        try (RecordCursor cursor = source.open(filter, basis)) {
            List<RecordId> batch;
            while (!(batch = cursor.nextBatch(batchSize)).isEmpty()) {
                assertThat(batch.size()).isLessThanOrEqualTo(batchSize);
                all.addAll(batch);
            }
        }
        return all;
    }

    protected static RecordId id(int n) {
        return RecordId.of(String.format("r-%02d", n));
    }

    protected static Map<String, Object> fields(boolean replied, int score) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", replied ? "closed" : "open");
        fields.put("replied", replied);
        fields.put("score", score);
        return fields;
    }
}
