package com.trade.signalengine.service.pacing;

import com.trade.signalengine.common.constants.SignalEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sliding-window limit on on-demand evaluations per user.
 */
@Slf4j
@Component
public class UserRequestThrottle {

    private final Clock clock;
    private final int maxRequests;
    private final Duration window;
    private final Duration idleEviction;
    private final ConcurrentMap<String, Deque<Instant>> requests = new ConcurrentHashMap<>();

    public UserRequestThrottle(SignalEngineProperties props, Clock clock) {
        SignalEngineProperties.Pacing p = props.getPacing();
        this.clock = clock;
        this.maxRequests = p.getMaxUserRequestsPerMinute();
        this.window = p.getUserWindow();
        this.idleEviction = p.getIdleUserEviction();
    }

    public boolean tryAcquire(String userId) {
        String key = userId == null || userId.isBlank() ? "anonymous" : userId;
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        AtomicBoolean admitted = new AtomicBoolean();
        // compute runs atomically per key, so eviction cannot detach the deque mid-update
        requests.compute(key, (k, q) -> {
            Deque<Instant> d = q == null ? new ArrayDeque<>() : q;
            while (!d.isEmpty() && !d.peekFirst().isAfter(cutoff)) d.pollFirst();
            if (d.size() < maxRequests) {
                d.addLast(now);
                admitted.set(true);
            }
            return d.isEmpty() ? null : d;
        });
        if (!admitted.get()) {
            log.info("User {} throttled: {} requests in {}s", key, maxRequests, window.toSeconds());
        }
        return admitted.get();
    }

    /**
     * Drops users whose last request is older than the idle window.
     */
    @Scheduled(fixedDelay = 10, timeUnit = TimeUnit.MINUTES)
    public void evictIdleUsers() {
        Instant cutoff = clock.instant().minus(idleEviction);
        int removed = 0;
        for (String key : requests.keySet()) {
            AtomicBoolean dropped = new AtomicBoolean();
            requests.computeIfPresent(key, (k, q) -> {
                Instant last = q.peekLast();
                if (last == null || last.isBefore(cutoff)) {
                    dropped.set(true);
                    return null;
                }
                return q;
            });
            if (dropped.get()) removed++;
        }
        if (removed > 0) log.debug("Evicted {} idle users from request throttle", removed);
    }

    public int trackedUsers() {
        return requests.size();
    }
}
