package com.trade.signalengine.service.pacing;

import com.trade.signalengine.dto.Signal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Caps directional emissions in a trailing one-hour window. NO_SIGNAL is always admitted and never counted.
 * Rejected signals are dropped, not queued.
 */
@Slf4j
@Component
public class SignalRateLimiter {

    static final Duration WINDOW = Duration.ofHours(1);

    private final Clock clock;
    private final Deque<Instant> emitted = new ArrayDeque<>();

    public SignalRateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Check-and-record under one lock.
     *
     * @param maxPerHour 0 disables the cap
     */
    public synchronized boolean admit(Signal candidate, int maxPerHour) {
        if (!candidate.isDirectional()) return true;
        Instant now = clock.instant();
        evictOlderThan(now.minus(WINDOW));
        if (maxPerHour > 0 && emitted.size() >= maxPerHour) {
            log.warn("Rate limit: {} {} dropped, {} signals in the last hour (max {})",
                    candidate.instrument(), candidate.action(), emitted.size(), maxPerHour);
            return false;
        }
        emitted.addLast(now);
        return true;
    }

    public synchronized int emittedInWindow() {
        evictOlderThan(clock.instant().minus(WINDOW));
        return emitted.size();
    }

    private void evictOlderThan(Instant cutoff) {
        while (!emitted.isEmpty() && !emitted.peekFirst().isAfter(cutoff)) {
            emitted.pollFirst();
        }
    }
}
