package com.ryuqq.selection.adapter.runner;

import com.ryuqq.selection.adapter.inmemory.source.InMemoryRecordSource;
import com.ryuqq.selection.adapter.inmemory.store.InMemoryBulkResultStore;
import com.ryuqq.selection.adapter.inmemory.store.InMemoryTokenStore;
import com.ryuqq.selection.adapter.inmemory.store.TokenStoreConfig;
import com.ryuqq.selection.application.bulk.BulkActionHandle;
import com.ryuqq.selection.application.bulk.BulkActionRegistry;
import com.ryuqq.selection.application.bulk.BulkActionRequest;
import com.ryuqq.selection.application.selection.SelectionService;
import com.ryuqq.selection.core.filter.FieldType;
import com.ryuqq.selection.core.filter.FilterDescriptor;
import com.ryuqq.selection.core.filter.RecordSchema;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.model.ResultId;
import com.ryuqq.selection.core.model.SnapshotBasis;
import com.ryuqq.selection.core.resolver.ResolvedStream;
import com.ryuqq.selection.core.resolver.ResolverConfig;
import com.ryuqq.selection.core.resolver.SelectionResolver;
import com.ryuqq.selection.core.result.BulkOperationResult;
import com.ryuqq.selection.core.selection.SelectionState;
import com.ryuqq.selection.core.spi.TokenEntry;
import com.ryuqq.selection.core.statemachine.BulkOperationStatus;
import com.ryuqq.selection.testkit.fixture.RecordingAction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * "필터 일치 전체 선택" 종단 시나리오 테스트.
 *
 * <p>토큰 발급 → 추정 → 실행까지 in-memory 어댑터로 연결해 검증합니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
class SelectAllScenarioTest {

    private static final RecordSchema SCHEMA = RecordSchema.builder()
        .field("status", FieldType.STRING)
        .field("replied", FieldType.BOOLEAN)
        .build();
    private static final FilterDescriptor UNREPLIED = FilterDescriptor.builder().eq("replied", false).build();

    private InMemoryRecordSource source;
    private InMemoryTokenStore tokenStore;
    private SelectionService selectionService;
    private RecordingAction action;
    private BulkOperationExecutor executor;
    private InlineBulkActionRunner runner;

    @BeforeEach
    void setUp() {
        source = new InMemoryRecordSource(SCHEMA);
        tokenStore = new InMemoryTokenStore(new TokenStoreConfig(), Clock.systemUTC());
        selectionService = new SelectionService(tokenStore, source);
        action = RecordingAction.create();
        executor = new BulkOperationExecutor(new BulkExecutorConfig(), new BackoffCalculator(1, 5, 0.0),
            Clock.systemUTC());
        BulkActionRegistry registry = new BulkActionRegistry().register("mark-replied", params -> action);
        runner = new InlineBulkActionRunner(tokenStore, new SelectionResolver(source, new ResolverConfig(500)),
            registry, new InMemoryBulkResultStore(), executor);
    }

    @AfterEach
    void tearDown() {
        runner.close();
        executor.close();
    }

    @Test
    void 미답변_만건_전체_선택_후_3건_제외하면_9997건만_처리된다() {
        // Given
        seed(10_000, 500);
        RecordId[] excluded = {id("u", 17), id("u", 5_000), id("u", 9_999)};
        SelectionState selection = SelectionState.empty().selectAllMatching();
        for (RecordId recordId : excluded) {
            selection = selection.toggle(recordId);
        }
        TokenEntry entry = selectionService.createSelection(UNREPLIED, selection, false);

        // When
        long estimated = selectionService.estimate(entry.token()).estimatedCount();
        BulkOperationResult result = runToCompletion(entry);

        // Then
        assertThat(estimated).isEqualTo(9_997);
        assertThat(result.status()).isEqualTo(BulkOperationStatus.COMPLETED);
        assertThat(result.attempted()).isEqualTo(9_997);
        assertThat(result.succeeded()).isEqualTo(9_997);
        assertThat(action.getApplied()).hasSize(9_997).doesNotContain(excluded);
        assertThat(action.getApplied()).noneMatch(recordId -> recordId.getValue().startsWith("r-"));
    }

    @Test
    void 고정_스냅샷_토큰은_이후_수정을_무시하지만_삭제된_레코드는_건너뛴다() {
        // Given
        seed(100, 0);
        TokenEntry entry = selectionService.createSelection(
            UNREPLIED, SelectionState.empty().selectAllMatching(), true);
        source.delete(id("u", 10));
        source.update(id("u", 20), Map.of("status", "open", "replied", true));
        source.insert(id("u", 100), Map.of("status", "open", "replied", false));

        // When
        BulkOperationResult result = runToCompletion(entry);

        // Then
        assertThat(result.status()).isEqualTo(BulkOperationStatus.COMPLETED);
        assertThat(result.attempted()).isEqualTo(99);
        assertThat(action.getApplied())
            .contains(id("u", 20))
            .doesNotContain(id("u", 10), id("u", 100));
    }

    @Test
    void live_토큰은_실행_시점의_데이터로_다시_평가된다() {
        // Given
        seed(100, 0);
        TokenEntry entry = selectionService.createSelection(
            UNREPLIED, SelectionState.empty().selectAllMatching(), false);
        source.update(id("u", 20), Map.of("status", "open", "replied", true));
        source.insert(id("u", 100), Map.of("status", "open", "replied", false));

        // When
        BulkOperationResult result = runToCompletion(entry);

        // Then
        assertThat(result.attempted()).isEqualTo(100);
        assertThat(action.getApplied()).contains(id("u", 100)).doesNotContain(id("u", 20));
    }

    @Test
    void resolve_결과는_필터_일치_집합에서_제외_집합을_뺀_것과_같다() {
        // Given
        seed(300, 300);
        FilterDescriptor filter = FilterDescriptor.builder()
            .eq("replied", false)
            .in("status", "open", "pending")
            .build();
        SelectionState selection = SelectionState.empty().selectAllMatching()
            .toggle(id("u", 3))
            .toggle(id("u", 4))
            .toggle(id("r", 1));
        SelectionResolver resolver = new SelectionResolver(source, new ResolverConfig(7));

        Set<RecordId> expected = new HashSet<>();
        for (int i = 0; i < 300; i++) {
            if (i % 3 != 2) {
                expected.add(id("u", i));
            }
        }
        expected.remove(id("u", 3));
        expected.remove(id("u", 4));

        // When
        List<RecordId> resolved = new ArrayList<>();
        try (ResolvedStream stream = resolver.resolve(filter, selection,
                SnapshotBasis.live())) {
            List<RecordId> batch;
            while (!(batch = stream.nextBatch()).isEmpty()) {
                resolved.addAll(batch);
            }
        }

        // Then
        assertThat(resolved).doesNotHaveDuplicates();
        assertThat(resolved).isSorted();
        assertThat(new HashSet<>(resolved)).isEqualTo(expected);
    }

    @Test
    void 같은_토큰을_동시에_두_번_실행해도_부수_효과는_중복되지_않는다() throws Exception {
        // Given
        seed(2_000, 0);
        TokenEntry entry = selectionService.createSelection(
            UNREPLIED, SelectionState.empty().selectAllMatching(), false);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService clients = Executors.newFixedThreadPool(2);

        // When
        List<BulkOperationResult> results;
        try {
            CompletableFuture<BulkOperationResult> first = CompletableFuture.supplyAsync(
                () -> awaitStart(start, entry), clients);
            CompletableFuture<BulkOperationResult> second = CompletableFuture.supplyAsync(
                () -> awaitStart(start, entry), clients);
            start.countDown();
            results = List.of(first.get(30, TimeUnit.SECONDS), second.get(30, TimeUnit.SECONDS));
        } finally {
            clients.shutdownNow();
        }

        // Then
        assertThat(results).allSatisfy(result -> {
            assertThat(result.status()).isEqualTo(BulkOperationStatus.COMPLETED);
            assertThat(result.attempted()).isEqualTo(2_000);
            assertThat(result.succeeded()).isEqualTo(2_000);
        });
        assertThat(results.get(0).resultId()).isNotEqualTo(results.get(1).resultId());
        assertThat(action.getApplied()).hasSize(2_000);
        assertThat(action.getInvocations()).isEqualTo(4_000);
    }

    private BulkOperationResult awaitStart(CountDownLatch start, TokenEntry entry) {
        try {
            start.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return runToCompletion(entry);
    }

    private BulkOperationResult runToCompletion(TokenEntry entry) {
        BulkActionHandle handle = runner.submit(BulkActionRequest.of(entry.token(), "mark-replied"), 5000);
        if (handle.isCompletedInline()) {
            return handle.getResultOrNull();
        }
        return awaitTerminal(handle.getResultId());
    }

    private BulkOperationResult awaitTerminal(ResultId resultId) {
        long deadline = System.nanoTime() + Duration.ofSeconds(30).toNanos();
        while (System.nanoTime() < deadline) {
            BulkOperationResult current = runner.find(resultId).orElseThrow();
            if (current.status().isTerminal()) {
                return current;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        throw new AssertionError("bulk operation " + resultId + " did not finish in time");
    }

    /**
     * u-NNNNN: 미답변, r-NNNNN: 답변 완료. status는 open/pending/closed 순환.
     */
    private void seed(int unreplied, int replied) {
        String[] statuses = {"open", "pending", "closed"};
        for (int i = 0; i < unreplied; i++) {
            source.insert(id("u", i), Map.of("status", statuses[i % 3], "replied", false));
        }
        for (int i = 0; i < replied; i++) {
            source.insert(id("r", i), Map.of("status", statuses[i % 3], "replied", true));
        }
    }

    private static RecordId id(String prefix, int n) {
        return RecordId.of(String.format("%s-%05d", prefix, n));
    }
}
