package com.ryuqq.selection.adapter.runner;

import com.ryuqq.selection.core.error.ResolutionInterruptedException;
import com.ryuqq.selection.core.executor.BulkAction;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.model.ResultId;
import com.ryuqq.selection.core.outcome.ActionOutcome;
import com.ryuqq.selection.core.outcome.Fail;
import com.ryuqq.selection.core.outcome.Retry;
import com.ryuqq.selection.core.protection.Bulkhead;
import com.ryuqq.selection.core.protection.BulkheadConfig;
import com.ryuqq.selection.core.protection.SemaphoreBulkhead;
import com.ryuqq.selection.core.resolver.ResolvedStream;
import com.ryuqq.selection.core.result.AbortReason;
import com.ryuqq.selection.core.result.BulkOperationResult;
import com.ryuqq.selection.core.result.FailedRecord;
import com.ryuqq.selection.core.statemachine.BulkOperationStatus;
import com.ryuqq.selection.core.statemachine.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bulk Operation Executor.
 *
 * <p>Resolved Stream에서 배치를 당겨 각 레코드에 {@link BulkAction}을 적용하고,
 * 레코드별 결과를 집계해 {@link BulkOperationResult}를 만듭니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * loop:
 *   1. control.checkAbort()            → CANCELLED / TIMED_OUT 이면 중단
 *   2. stream.nextBatch()              → ResolutionInterrupted 이면 중단 (그 외 예외는 전파)
 *   3. 빈 배치면 종료
 *   4. 배치의 각 ID:
 *      a. dedupe (현재 배치와 직전 배치에 이미 나온 ID는 건너뜀)
 *      b. bulkhead 허가 획득 (실행당 concurrency 제한)
 *      c. 공유 워커 풀에 제출: apply → Retry면 backoff 후 재시도 → Ok / Fail 집계
 *   5. 배치의 모든 작업 완료 대기
 *   6. listener.onProgress(RUNNING 스냅샷)
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>Action 예외 → Fail(ACTION_EXCEPTION), 실행은 계속</li>
 *   <li>Action이 {@link Error}를 던지면 → Fail(ACTION_EXCEPTION)로 집계한 뒤 Error는 워커에서 다시 던짐</li>
 *   <li>Retry가 maxRetries를 넘으면 → Fail(RETRY_EXHAUSTED)</li>
 *   <li>레코드 하나의 실패로 전체 실행을 중단하지 않음</li>
 *   <li>중단(ABORTED) 시에도 이미 처리된 레코드는 되돌리지 않음</li>
 * </ul>
 *
 * <p><strong>스레드 모델:</strong> 워커 풀은 모든 실행이 공유하고(workerThreads),
 * 실행마다 {@link SemaphoreBulkhead}로 동시 Action 수를 제한합니다(concurrency).
 * 완료 순서는 보장하지 않으며, concurrency=1이면 방출 순서대로 실행됩니다.</p>
 *
 * <p><strong>Dedupe:</strong> 키셋 페이지 경계에서 다시 방출된 ID를 걸러내기 위해
 * 현재 배치와 직전 배치의 ID만 기억합니다. 상태는 배치 크기의 두 배로 제한되며,
 * 두 배치 이상 떨어져 다시 나온 ID는 걸러내지 않습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class BulkOperationExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BulkOperationExecutor.class);

    private static final long PERMIT_WAIT_MS = 100;

    private final BulkExecutorConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Clock clock;
    private final ExecutorService workerPool;

    public BulkOperationExecutor(BulkExecutorConfig config) {
        this(config, new BackoffCalculator(), Clock.systemUTC());
    }

    /**
     * @param config 설정
     * @param backoffCalculator Retry 간격 계산기
     * @param clock 시각 (startedAt/finishedAt, soft timeout)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BulkOperationExecutor(BulkExecutorConfig config, BackoffCalculator backoffCalculator, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.clock = clock;
        this.workerPool = Executors.newFixedThreadPool(config.workerThreads(), namedThreads("bulk-worker-"));
    }

    /**
     * 새 실행용 제어 객체 (soft timeout = config.softTimeoutMs).
     *
     * @return ExecutionControl
     */
    public ExecutionControl newControl() {
        return ExecutionControl.start(clock, config.softTimeoutMs());
    }

    /**
     * Bulk Operation 실행 (호출 스레드에서 블로킹).
     *
     * <p>stream은 실행이 끝나면 닫힙니다. startedAt은 control 생성 시각입니다.</p>
     *
     * @param resultId 결과 ID
     * @param actionKind Action 종류
     * @param stream Resolved Stream
     * @param action 레코드별 Action
     * @param control 취소/timeout 제어
     * @param listener 진행 리스너
     * @return 종료 상태의 결과 (COMPLETED, COMPLETED_WITH_ERRORS, ABORTED)
     * @throws RuntimeException stream이 {@link ResolutionInterruptedException} 외의 예외를 던진 경우 (stream은 닫힘)
     */
    public BulkOperationResult execute(ResultId resultId, String actionKind, ResolvedStream stream,
                                       BulkAction action, ExecutionControl control, ProgressListener listener) {
        if (resultId == null) {
            throw new IllegalArgumentException("resultId cannot be null");
        }
        if (actionKind == null || actionKind.isBlank()) {
            throw new IllegalArgumentException("actionKind cannot be null or blank");
        }
        if (stream == null) {
            throw new IllegalArgumentException("stream cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (control == null) {
            throw new IllegalArgumentException("control cannot be null");
        }
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        Instant startedAt = control.getStartedAt();
        Tally tally = new Tally(config.maxReportedFailures());
        Bulkhead bulkhead = new SemaphoreBulkhead(new BulkheadConfig(config.concurrency(), PERMIT_WAIT_MS));
        Set<RecordId> previousBatch = Set.of();
        AbortReason abortReason = null;
        long skippedDuplicates = 0;

        log.info("Bulk operation {} started (actionKind={}, concurrency={})",
            resultId, actionKind, config.concurrency());

        try (stream) {
            while (true) {
                abortReason = control.checkAbort();
                if (abortReason != null) {
                    break;
                }

                List<RecordId> batch;
                try {
                    batch = stream.nextBatch();
                } catch (ResolutionInterruptedException e) {
                    log.warn("Bulk operation {} resolution interrupted after {} ids", resultId, e.getEmittedCount(), e);
                    abortReason = AbortReason.RESOLUTION_INTERRUPTED;
                    break;
                }
                if (batch.isEmpty()) {
                    break;
                }

                List<Future<?>> inFlight = new ArrayList<>(batch.size());
                Set<RecordId> currentBatch = new HashSet<>(batch.size() * 2);
                for (RecordId id : batch) {
                    if (config.dedupeEnabled() && (previousBatch.contains(id) || !currentBatch.add(id))) {
                        skippedDuplicates++;
                        continue;
                    }
                    if (!acquire(bulkhead, resultId)) {
                        abortReason = AbortReason.CANCELLED;
                        break;
                    }
                    inFlight.add(workerPool.submit(() -> {
                        try {
                            tally.record(id, applyWithRetry(action, id));
                        } catch (Error e) {
                            log.error("Action raised an error for {}", id, e);
                            tally.record(id, Fail.of(Fail.ACTION_EXCEPTION, messageOf(e), e.getClass().getName()));
                            throw e;
                        } finally {
                            bulkhead.release(resultId);
                        }
                    }));
                }
                awaitAll(resultId, inFlight);
                previousBatch = currentBatch;
                if (abortReason != null) {
                    break;
                }

                BulkOperationResult snapshot = tally.snapshot(resultId, actionKind, BulkOperationStatus.RUNNING,
                    null, startedAt, null);
                log.debug("Bulk operation {} progress: attempted={}, succeeded={}, failed={}",
                    resultId, snapshot.attempted(), snapshot.succeeded(), snapshot.failed());
                notify(progress, snapshot);
            }
        }

        BulkOperationStatus status = StatusTransition.transition(BulkOperationStatus.RUNNING,
            abortReason != null ? BulkOperationStatus.ABORTED
                : tally.hasFailures() ? BulkOperationStatus.COMPLETED_WITH_ERRORS
                : BulkOperationStatus.COMPLETED);
        BulkOperationResult result = tally.snapshot(resultId, actionKind, status, abortReason, startedAt, clock.instant());

        if (status == BulkOperationStatus.ABORTED) {
            log.warn("Bulk operation {} aborted ({}): attempted={}, succeeded={}, failed={}",
                resultId, abortReason, result.attempted(), result.succeeded(), result.failed());
        } else {
            log.info("Bulk operation {} finished {}: attempted={}, succeeded={}, failed={}, skippedDuplicates={}",
                resultId, status, result.attempted(), result.succeeded(), result.failed(), skippedDuplicates);
        }
        return result;
    }

    /**
     * 레코드 하나에 Action 적용. Retry는 backoff 후 maxRetries까지 재시도합니다.
     */
    private ActionOutcome applyWithRetry(BulkAction action, RecordId id) {
        int retries = 0;
        while (true) {
            ActionOutcome outcome;
            try {
                outcome = action.apply(id);
            } catch (RuntimeException e) {
                log.debug("Action threw for {}", id, e);
                return Fail.of(Fail.ACTION_EXCEPTION, messageOf(e), e.getClass().getName());
            }
            if (outcome == null) {
                return Fail.of(Fail.ACTION_EXCEPTION, "Action returned null outcome");
            }
            if (!(outcome instanceof Retry)) {
                return outcome;
            }

            Retry retry = (Retry) outcome;
            retries++;
            if (retries > config.maxRetries()) {
                log.warn("Retries exhausted for {} after {} attempts: {}", id, retries, retry.reason());
                return Fail.of(Fail.RETRY_EXHAUSTED,
                    "Retries exhausted after " + config.maxRetries() + " retries: " + retry.reason());
            }

            long delay = backoffCalculator.calculate(retries, retry.retryAfterMillis());
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Fail.of(Fail.ACTION_EXCEPTION, "Interrupted while waiting to retry", e.getClass().getName());
            }
        }
    }

    private boolean acquire(Bulkhead bulkhead, ResultId resultId) {
        long waitMs = bulkhead.getConfig().maxWaitDurationMs();
        try {
            boolean acquired = false;
            while (!acquired) {
                acquired = bulkhead.tryAcquire(resultId, waitMs);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Bulk operation {} interrupted while waiting for a permit", resultId);
            return false;
        }
    }

    private void awaitAll(ResultId resultId, List<Future<?>> futures) {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    log.error("Bulk operation {} worker failed unexpectedly", resultId, e.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void notify(ProgressListener listener, BulkOperationResult snapshot) {
        try {
            listener.onProgress(snapshot);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for {}", snapshot.resultId(), e);
        }
    }

    private static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public BulkExecutorConfig getConfig() {
        return config;
    }

    /**
     * 워커 풀 종료. 진행 중인 Action은 최대 60초 기다립니다.
     */
    @Override
    public void close() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(60, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 실행 하나의 집계. attempted/succeeded/failed를 함께 갱신해 스냅샷이 항상 일관됩니다.
     */
    private static final class Tally {

        private final int maxReportedFailures;
        private final List<FailedRecord> failures = new ArrayList<>();
        private long succeeded;
        private long failed;

        Tally(int maxReportedFailures) {
            this.maxReportedFailures = maxReportedFailures;
        }

        synchronized void record(RecordId id, ActionOutcome outcome) {
            if (outcome instanceof Fail) {
                Fail fail = (Fail) outcome;
                failed++;
                if (failures.size() < maxReportedFailures) {
                    failures.add(new FailedRecord(id, fail.errorCode(), fail.message()));
                }
            } else {
                succeeded++;
            }
        }

        synchronized boolean hasFailures() {
            return failed > 0;
        }

        synchronized BulkOperationResult snapshot(ResultId resultId, String actionKind, BulkOperationStatus status,
                                                  AbortReason abortReason, Instant startedAt, Instant finishedAt) {
            return new BulkOperationResult(resultId, actionKind, status, abortReason,
                succeeded + failed, succeeded, failed, failures, startedAt, finishedAt);
        }
    }
}
