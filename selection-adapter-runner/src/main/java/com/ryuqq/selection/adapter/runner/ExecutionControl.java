package com.ryuqq.selection.adapter.runner;

import com.ryuqq.selection.core.result.AbortReason;

import java.time.Clock;
import java.time.Instant;

/**
 * 실행 하나에 대한 협조적 취소와 soft timeout 제어.
 *
 * <p>Executor는 배치 경계마다 {@link #checkAbort()}를 확인합니다.
 * 진행 중인 배치는 끝까지 처리하며, 이미 처리된 레코드는 되돌리지 않습니다.</p>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class ExecutionControl {

    private final Clock clock;
    private final Instant startedAt;
    private final Instant deadline;
    private volatile boolean cancelled;

    private ExecutionControl(Clock clock, Instant startedAt, Instant deadline) {
        this.clock = clock;
        this.startedAt = startedAt;
        this.deadline = deadline;
    }

    /**
     * 지금부터 softTimeoutMs 뒤를 deadline으로 하는 제어 생성.
     *
     * @param clock 시계
     * @param softTimeoutMs soft timeout (밀리초, 양수)
     * @return ExecutionControl
     */
    public static ExecutionControl start(Clock clock, long softTimeoutMs) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (softTimeoutMs <= 0) {
            throw new IllegalArgumentException("softTimeoutMs must be positive (current: " + softTimeoutMs + ")");
        }
        Instant now = clock.instant();
        return new ExecutionControl(clock, now, now.plusMillis(softTimeoutMs));
    }

    /**
     * 취소 요청 (멱등).
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isDeadlineExceeded() {
        return !clock.instant().isBefore(deadline);
    }

    /**
     * 중단해야 하는지 확인. 취소가 timeout보다 우선합니다.
     *
     * @return 중단 사유, 계속 진행하면 null
     */
    public AbortReason checkAbort() {
        if (cancelled) {
            return AbortReason.CANCELLED;
        }
        if (isDeadlineExceeded()) {
            return AbortReason.TIMED_OUT;
        }
        return null;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getDeadline() {
        return deadline;
    }
}
