package com.ryuqq.selection.testkit.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 테스트에서 시간을 직접 진행시키는 Clock.
 *
 * <p>TTL 만료, 보관 기간, soft timeout처럼 시간에 의존하는 동작을
 * sleep 없이 검증할 때 사용합니다. 스레드 안전합니다.</p>
 *
 * <pre>
 * MutableClock clock = MutableClock.at(Instant.parse("2026-01-01T00:00:00Z"));
 * TokenStore store = new InMemoryTokenStore(config, clock);
 * clock.advance(Duration.ofMinutes(16));
 * </pre>
 *
 * @author Selection Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    private MutableClock(AtomicReference<Instant> now, ZoneId zone) {
        this.now = now;
        this.zone = zone;
    }

    public static MutableClock at(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        return new MutableClock(new AtomicReference<>(instant), ZoneOffset.UTC);
    }

    /**
     * 현재 시각을 duration만큼 진행.
     *
     * @param duration 진행할 시간 (음수 불가)
     * @return 진행 후 시각
     */
    public Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative");
        }
        return now.updateAndGet(current -> current.plus(duration));
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now.get();
    }
}
