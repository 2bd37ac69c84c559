package com.trade.signalengine.service.engine;

import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.dto.Evaluation;
import com.trade.signalengine.service.market.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic health checks: upstream error rate, advisory error rate and time since the last directional signal.
 * Each alert type fires at most once per cooldown.
 */
@Slf4j
@Component
public class HealthMonitor implements SignalPublisher {

    public enum AlertType {API_ERROR_RATE, ADVISORY_ERROR_RATE, NO_SIGNALS}

    public record Alert(AlertType type, String message, Instant at) {
    }

    public record HealthStatus(boolean healthy, double apiErrorRatePct, double advisoryErrorRatePct,
                               Instant lastSignalAt, List<Alert> recentAlerts) {
    }

    private static final int MAX_ALERTS = 20;

    private final MetricsCollector metrics;
    private final SignalEngineProperties.Health cfg;
    private final Clock clock;
    private final Instant startedAt;
    private final Map<AlertType, Instant> lastAlert = new ConcurrentHashMap<>();
    private final Deque<Alert> alerts = new ArrayDeque<>();
    private volatile Instant lastSignalAt;

    public HealthMonitor(MetricsCollector metrics, SignalEngineProperties props, Clock clock) {
        this.metrics = metrics;
        this.cfg = props.getHealth();
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Override
    public void publish(Evaluation evaluation) {
        if (evaluation.signal().isDirectional()) lastSignalAt = evaluation.signal().timestamp();
    }

    @Scheduled(fixedDelayString = "${signal-engine.health.check-interval:PT5M}",
            initialDelayString = "${signal-engine.health.check-interval:PT5M}")
    public void scheduledCheck() {
        try {
            check();
        } catch (RuntimeException e) {
            log.error("Health check failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return alerts raised by this run; suppressed duplicates are not included
     */
    public List<Alert> check() {
        Instant now = clock.instant();
        List<Alert> raised = new ArrayList<>();

        double apiRate = metrics.getApiErrorRatePct();
        if (metrics.getCounter("api.calls.total") > 0 && apiRate >= cfg.getApiErrorRatePct()) {
            raise(AlertType.API_ERROR_RATE, String.format("upstream error rate %.1f%%", apiRate), now, raised);
        }
        double advRate = metrics.getAdvisoryErrorRatePct();
        if (metrics.getCounter("advisory.calls.total") > 0 && advRate > cfg.getAdvisoryErrorRatePct()) {
            raise(AlertType.ADVISORY_ERROR_RATE, String.format("advisory error rate %.1f%%", advRate), now, raised);
        }
        Instant since = lastSignalAt == null ? startedAt : lastSignalAt;
        Duration quiet = Duration.between(since, now);
        if (quiet.toMinutes() >= (long) (cfg.getNoSignalHours() * 60)) {
            raise(AlertType.NO_SIGNALS, "no signal for " + quiet.toMinutes() + " minutes", now, raised);
        }
        return raised;
    }

    public HealthStatus status() {
        List<Alert> snapshot;
        synchronized (alerts) {
            snapshot = List.copyOf(alerts);
        }
        Instant now = clock.instant();
        boolean healthy = lastAlert.values().stream().noneMatch(t -> now.isBefore(t.plus(cfg.getAlertCooldown())));
        return new HealthStatus(healthy, metrics.getApiErrorRatePct(), metrics.getAdvisoryErrorRatePct(),
                lastSignalAt, snapshot);
    }

    private void raise(AlertType type, String message, Instant now, List<Alert> raised) {
        Instant prev = lastAlert.get(type);
        if (prev != null && now.isBefore(prev.plus(cfg.getAlertCooldown()))) {
            log.debug("Alert {} suppressed until {}", type, prev.plus(cfg.getAlertCooldown()));
            return;
        }
        lastAlert.put(type, now);
        Alert alert = new Alert(type, message, now);
        synchronized (alerts) {
            alerts.addFirst(alert);
            while (alerts.size() > MAX_ALERTS) alerts.removeLast();
        }
        raised.add(alert);
        log.warn("HEALTH ALERT {}: {}", type, message);
    }
}
