package com.trade.signalengine.web;

import com.trade.signalengine.common.Result;
import com.trade.signalengine.common.exception.Http;
import com.trade.signalengine.common.exception.ValidationException;
import com.trade.signalengine.config.EngineSettings;
import com.trade.signalengine.service.engine.HealthMonitor;
import com.trade.signalengine.service.engine.RecentSignalsPublisher;
import com.trade.signalengine.service.engine.SignalEngineService;
import com.trade.signalengine.service.market.MarketDataService;
import com.trade.signalengine.service.market.MetricsCollector;
import com.trade.signalengine.service.pacing.SignalRateLimiter;
import com.trade.signalengine.service.pacing.UserRequestThrottle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Slf4j
public class EngineController {

    private final SignalEngineService engine;
    private final UserRequestThrottle throttle;
    private final RecentSignalsPublisher recentSignals;
    private final HealthMonitor health;
    private final MetricsCollector metrics;
    private final MarketDataService marketData;
    private final SignalRateLimiter rateLimiter;
    private final EngineSettings settings;

    @PostMapping("/evaluate/{instrument}")
    public ResponseEntity<?> evaluate(@PathVariable("instrument") String instrument,
                                      @RequestHeader(value = "X-User-Id", required = false) String userId) {
        if (!throttle.tryAcquire(userId)) {
            return Http.from(Result.fail("THROTTLED", "Too many evaluation requests, try again in a minute"));
        }
        log.info("On-demand evaluation of {} requested by {}", instrument, userId);
        return Http.from(engine.evaluate(instrument));
    }

    @GetMapping("/signals/recent")
    public ResponseEntity<?> recent(@RequestParam(value = "limit", defaultValue = "20") int limit) {
        return Http.from(Result.ok(recentSignals.recent(Math.max(1, Math.min(limit, 50)))));
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("health", health.status());
        out.put("cycleRunning", engine.isCycleRunning());
        out.put("skippedTicks", engine.getSkippedTicks());
        out.put("lastCycle", engine.getLastCycle());
        out.put("signalsLastHour", rateLimiter.emittedInWindow());
        out.put("sources", marketData.getSourceStatus());
        out.put("metrics", metrics.getMetricsSummary());
        return Http.from(Result.ok(out));
    }

    @GetMapping("/settings")
    public ResponseEntity<?> settings() {
        return Http.from(Result.ok(settings.describe()));
    }

    @PutMapping("/settings/{key}")
    public ResponseEntity<?> update(@PathVariable("key") String key, @RequestParam("value") String value) {
        try {
            Object now = settings.update(key, value);
            return Http.from(Result.ok(Map.of(key, now)));
        } catch (ValidationException e) {
            log.warn("Rejected tuning update {}={}: {}", key, value, e.getMessage());
            return Http.from(Result.fail(e.getErrorCode(), e.getMessage()));
        }
    }
}
