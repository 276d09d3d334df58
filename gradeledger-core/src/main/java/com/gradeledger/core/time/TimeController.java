package com.gradeledger.core.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock whose time only moves when told to.
 * Lets tests and the simulator drive deadlines, attempt expiry and analyzer
 * windows without waiting.
 * 
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2024-03-01T09:00:00Z"));
 * coordinator = new TestAttemptCoordinator(runner, writer, auditLog, metrics, time);
 * 
 * time.advanceMinutes(61);
 * // the 60 minute attempt is now expired
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;
    private final ZoneId zone;

    public TimeController(Instant startTime) {
        this(new AtomicReference<>(startTime), ZoneOffset.UTC);
    }

    private TimeController(AtomicReference<Instant> currentTime, ZoneId zone) {
        this.currentTime = currentTime;
        this.zone = zone;
    }

    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Same controlled instant seen through another zone; advancing either moves both.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        return new TimeController(currentTime, zone);
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    public void advanceHours(long hours) {
        advance(Duration.ofHours(hours));
    }

    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }

    public boolean hasElapsed(Instant since, Duration duration) {
        return Duration.between(since, instant()).compareTo(duration) >= 0;
    }
}
