package com.ryuqq.selection.testkit.fixture;

import com.ryuqq.selection.core.executor.BulkAction;
import com.ryuqq.selection.core.model.RecordId;
import com.ryuqq.selection.core.outcome.ActionOutcome;
import com.ryuqq.selection.core.outcome.Fail;
import com.ryuqq.selection.core.outcome.Ok;
import com.ryuqq.selection.core.outcome.Retry;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 호출을 기록하는 멱등 {@link BulkAction} 테스트 더블.
 *
 * <p>같은 레코드에 대한 두 번째 적용은 부수 효과 없이 Ok를 반환하고
 * {@link #getDuplicateInvocations()}에만 집계됩니다. 레코드별로 실패/재시도/예외를
 * 미리 지정할 수 있고, 동시에 실행 중인 호출 수의 최댓값을 기록합니다.</p>
 *
 * <pre>
 * RecordingAction action = RecordingAction.create()
 *     .failOn(RecordId.of("r-3"))
 *     .retryOn(RecordId.of("r-5"), 2)
 *     .withDelayMillis(5);
 * </pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class RecordingAction implements BulkAction {

    public static final String FAIL_CODE = "ACTION_REJECTED";

    private final Set<RecordId> applied = ConcurrentHashMap.newKeySet();
    private final Set<RecordId> failing = ConcurrentHashMap.newKeySet();
    private final Set<RecordId> throwing = ConcurrentHashMap.newKeySet();
    private final Map<RecordId, AtomicInteger> retriesLeft = new ConcurrentHashMap<>();
    private final AtomicLong invocations = new AtomicLong();
    private final AtomicLong duplicateInvocations = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile long delayMillis;

    private RecordingAction() {
    }

    public static RecordingAction create() {
        return new RecordingAction();
    }

    public RecordingAction failOn(RecordId... ids) {
        failing.addAll(Arrays.asList(ids));
        return this;
    }

    public RecordingAction throwOn(RecordId... ids) {
        throwing.addAll(Arrays.asList(ids));
        return this;
    }

    /**
     * 지정한 레코드가 times번 Retry를 반환한 뒤 성공하도록 설정.
     */
    public RecordingAction retryOn(RecordId id, int times) {
        retriesLeft.put(id, new AtomicInteger(times));
        return this;
    }

    public RecordingAction withDelayMillis(long delayMillis) {
        this.delayMillis = delayMillis;
        return this;
    }

    @Override
    public ActionOutcome apply(RecordId id) {
        invocations.incrementAndGet();
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            pause();
            if (throwing.contains(id)) {
                throw new IllegalStateException("boom on " + id.getValue());
            }
            if (failing.contains(id)) {
                return Fail.of(FAIL_CODE, "rejected " + id.getValue());
            }
            AtomicInteger retries = retriesLeft.get(id);
            if (retries != null && retries.getAndDecrement() > 0) {
                return Retry.of("not yet " + id.getValue());
            }
            if (!applied.add(id)) {
                duplicateInvocations.incrementAndGet();
            }
            return Ok.of();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void pause() {
        long delay = delayMillis;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while applying", e);
        }
    }

    /**
     * @return 부수 효과가 적용된 레코드 (중복 없음)
     */
    public Set<RecordId> getApplied() {
        return Set.copyOf(applied);
    }

    public long getInvocations() {
        return invocations.get();
    }

    /**
     * @return 이미 적용된 레코드에 다시 호출된 횟수
     */
    public long getDuplicateInvocations() {
        return duplicateInvocations.get();
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }
}
