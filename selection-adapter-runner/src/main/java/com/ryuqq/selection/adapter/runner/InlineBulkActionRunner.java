package com.ryuqq.selection.adapter.runner;

import com.ryuqq.selection.application.bulk.BulkActionHandle;
import com.ryuqq.selection.application.bulk.BulkActionOrchestrator;
import com.ryuqq.selection.application.bulk.BulkActionRegistry;
import com.ryuqq.selection.application.bulk.BulkActionRequest;
import com.ryuqq.selection.core.executor.BulkAction;
import com.ryuqq.selection.core.model.ResultId;
import com.ryuqq.selection.core.model.SelectionToken;
import com.ryuqq.selection.core.resolver.ResolvedStream;
import com.ryuqq.selection.core.resolver.SelectionResolver;
import com.ryuqq.selection.core.result.BulkOperationResult;
import com.ryuqq.selection.core.spi.BulkResultStore;
import com.ryuqq.selection.core.spi.TokenEntry;
import com.ryuqq.selection.core.spi.TokenStore;
import com.ryuqq.selection.core.statemachine.BulkOperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Inline Bulk Action Runner.
 *
 * <p>time budget 기반으로 동기/비동기 응답을 분기하는 {@link BulkActionOrchestrator} 구현체입니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>입력 검증 (timeBudget 50 ~ 5000ms)</li>
 *   <li>토큰 resolve, Action 생성, Resolved Stream 열기 (실패 시 즉시 예외)</li>
 *   <li>ResultId 발급, RUNNING 결과 저장</li>
 *   <li>작업 풀에서 {@link BulkOperationExecutor} 실행 (비블로킹), 배치마다 진행 스냅샷 저장</li>
 *   <li>timeBudget 동안 결과 저장소를 폴링 (10ms 간격)</li>
 *   <li>종료 시: {@link BulkActionHandle#completed}, 초과 시: {@link BulkActionHandle#async}</li>
 * </ol>
 *
 * <p><strong>단일 사용 토큰:</strong> {@link TokenStore#isSingleUse()}가 true면
 * 실행이 중단(ABORTED) 없이 끝난 뒤 토큰을 무효화합니다.
 * 중단된 실행의 토큰은 남겨 두어 다시 제출할 수 있습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class InlineBulkActionRunner implements BulkActionOrchestrator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InlineBulkActionRunner.class);

    private static final long MIN_TIME_BUDGET_MS = 50;
    private static final long MAX_TIME_BUDGET_MS = 5000;
    private static final long DEFAULT_POLLING_INTERVAL_MS = 10;

    private final TokenStore tokenStore;
    private final SelectionResolver resolver;
    private final BulkActionRegistry registry;
    private final BulkResultStore resultStore;
    private final BulkOperationExecutor executor;
    private final long pollingIntervalMs;
    private final ExecutorService jobPool;
    private final ConcurrentHashMap<ResultId, ExecutionControl> running = new ConcurrentHashMap<>();

    public InlineBulkActionRunner(TokenStore tokenStore, SelectionResolver resolver, BulkActionRegistry registry,
                                  BulkResultStore resultStore, BulkOperationExecutor executor) {
        this(tokenStore, resolver, registry, resultStore, executor, DEFAULT_POLLING_INTERVAL_MS);
    }

    /**
     * @param tokenStore 토큰 저장소
     * @param resolver Selection Resolver
     * @param registry Action 레지스트리
     * @param resultStore 결과 저장소
     * @param executor Bulk Operation Executor
     * @param pollingIntervalMs 결과 폴링 간격 (밀리초)
     * @throws IllegalArgumentException 의존성이 null이거나 pollingIntervalMs가 양수가 아닌 경우
     */
    public InlineBulkActionRunner(TokenStore tokenStore, SelectionResolver resolver, BulkActionRegistry registry,
                                  BulkResultStore resultStore, BulkOperationExecutor executor,
                                  long pollingIntervalMs) {
        if (tokenStore == null) {
            throw new IllegalArgumentException("tokenStore cannot be null");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (resultStore == null) {
            throw new IllegalArgumentException("resultStore cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException("pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")");
        }
        this.tokenStore = tokenStore;
        this.resolver = resolver;
        this.registry = registry;
        this.resultStore = resultStore;
        this.executor = executor;
        this.pollingIntervalMs = pollingIntervalMs;
        AtomicInteger counter = new AtomicInteger();
        this.jobPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "bulk-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public BulkActionHandle submit(BulkActionRequest request, long timeBudgetMs) {
        validateInput(request, timeBudgetMs);

        // 1. 토큰/Action/스트림 준비 (실패 시 실행을 시작하지 않음)
        TokenEntry entry = tokenStore.resolve(request.token());
        BulkAction action = registry.create(request.actionKind(), request.params());
        ResolvedStream stream = resolver.resolve(entry);

        // 2. 실행 등록
        ResultId resultId = ResultId.newId();
        ExecutionControl control = executor.newControl();
        BulkOperationResult started = BulkOperationResult.started(resultId, request.actionKind(), control.getStartedAt());
        running.put(resultId, control);
        try {
            resultStore.save(started);
            jobPool.execute(() -> runJob(resultId, request, stream, action, control));
        } catch (RuntimeException e) {
            running.remove(resultId);
            stream.close();
            throw e;
        }

        // 3. timeBudget 동안 폴링
        return pollForCompletion(resultId, timeBudgetMs);
    }

    @Override
    public Optional<BulkOperationResult> find(ResultId resultId) {
        if (resultId == null) {
            throw new IllegalArgumentException("resultId cannot be null");
        }
        return resultStore.find(resultId);
    }

    @Override
    public boolean cancel(ResultId resultId) {
        if (resultId == null) {
            throw new IllegalArgumentException("resultId cannot be null");
        }
        ExecutionControl control = running.get(resultId);
        if (control == null) {
            return false;
        }
        control.cancel();
        log.info("Cancellation requested for bulk operation {}", resultId);
        return true;
    }

    /**
     * 실행 중인 작업 수.
     *
     * @return 아직 종료되지 않은 실행 수
     */
    public int getRunningCount() {
        return running.size();
    }

    private void runJob(ResultId resultId, BulkActionRequest request, ResolvedStream stream,
                        BulkAction action, ExecutionControl control) {
        try {
            BulkOperationResult result = executor.execute(resultId, request.actionKind(), stream, action,
                control, resultStore::save);
            // 최종 결과가 보이기 전에 무효화
            if (result.status() != BulkOperationStatus.ABORTED && tokenStore.isSingleUse()) {
                invalidateQuietly(request.token());
            }
            resultStore.save(result);
        } catch (RuntimeException e) {
            log.error("Bulk operation {} failed unexpectedly", resultId, e);
            throw e;
        } finally {
            running.remove(resultId);
        }
    }

    private void invalidateQuietly(SelectionToken token) {
        try {
            tokenStore.invalidate(token);
        } catch (RuntimeException e) {
            // 토큰은 TTL로 만료되므로 결과에는 영향 없음
            log.warn("Failed to invalidate single-use token {}", token, e);
        }
    }

    private void validateInput(BulkActionRequest request, long timeBudgetMs) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (timeBudgetMs < MIN_TIME_BUDGET_MS || timeBudgetMs > MAX_TIME_BUDGET_MS) {
            throw new IllegalArgumentException(
                String.format("timeBudgetMs must be between %d and %d ms (current: %d)",
                    MIN_TIME_BUDGET_MS, MAX_TIME_BUDGET_MS, timeBudgetMs));
        }
    }

    private BulkActionHandle pollForCompletion(ResultId resultId, long timeBudgetMs) {
        long startTimeNanos = System.nanoTime();
        long timeBudgetNanos = timeBudgetMs * 1_000_000L;

        while (System.nanoTime() - startTimeNanos < timeBudgetNanos) {
            Optional<BulkOperationResult> current = resultStore.find(resultId);
            if (current.isPresent() && current.get().status().isTerminal()) {
                return BulkActionHandle.completed(current.get());
            }
            if (!sleep(pollingIntervalMs)) {
                break;
            }
        }
        return BulkActionHandle.async(resultId);
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 작업 풀 종료. 실행 중인 작업에는 취소를 요청합니다.
     */
    @Override
    public void close() {
        running.values().forEach(ExecutionControl::cancel);
        jobPool.shutdown();
        try {
            if (!jobPool.awaitTermination(60, TimeUnit.SECONDS)) {
                jobPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            jobPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
