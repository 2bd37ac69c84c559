package com.trade.signalengine.service.market;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory counters and latency samples for the signal pipeline.
 * Counter names are dotted paths, e.g. {@code source.calls.twelvedata} or {@code cycle.skipped.NO_DATA}.
 */
@Slf4j
@Service
public class MetricsCollector {

    private static final int MAX_HISTOGRAM_SIZE = 1000;

    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> latencyHistograms = new ConcurrentHashMap<>();
    private final Map<String, Double> gauges = new ConcurrentHashMap<>();

    public void recordSourceCall(String source, long latencyMs) {
        incrementCounter("source.calls." + source);
        incrementCounter("api.calls.total");
        String metricKey = "source.latency." + source;
        recordLatency(metricKey, latencyMs);
        log.debug("Recorded source call: {} = {}ms", source, latencyMs);
    }

    public void recordSourceFailure(String source, String errorKind) {
        incrementCounter("source.failures." + source);
        incrementCounter("source.failures.by_kind." + errorKind);
        incrementCounter("api.calls.errors");
        updateSourceFailureRate(source);
        log.debug("Recorded source failure: {} - {}", source, errorKind);
    }

    public void recordCacheHit(String cache) {
        incrementCounter("cache.hits." + cache);
    }

    public void recordCacheMiss(String cache) {
        incrementCounter("cache.misses." + cache);
    }

    public void recordAdvisoryCall(boolean success, long latencyMs) {
        incrementCounter("advisory.calls.total");
        if (!success) incrementCounter("advisory.calls.errors");
        recordLatency("advisory.latency", latencyMs);
    }

    public void recordSignal(String instrument, String action, double confidence) {
        incrementCounter("signals.emitted.total");
        incrementCounter("signals.emitted.by_action." + action);
        updateGauge("signals.last_confidence." + instrument, confidence);
        updateGauge("signals.last_emitted_epoch_s", Instant.now().getEpochSecond());
    }

    public void recordEvaluation(String instrument, String action) {
        incrementCounter("evaluations.total");
        incrementCounter("evaluations.by_action." + action);
    }

    public void recordCycleSkip(String reason) {
        incrementCounter("cycle.skipped." + reason);
    }

    public long getCounter(String metricName) {
        LongAdder counter = counters.get(metricName);
        return counter != null ? counter.sum() : 0L;
    }

    public Double getGauge(String metricName) {
        return gauges.get(metricName);
    }

    /**
     * Percent of upstream calls that failed since start, 0 when nothing was called.
     */
    public double getApiErrorRatePct() {
        return ratePct(getCounter("api.calls.errors"), getCounter("api.calls.total"));
    }

    public double getAdvisoryErrorRatePct() {
        return ratePct(getCounter("advisory.calls.errors"), getCounter("advisory.calls.total"));
    }

    public LatencyStatistics getLatencyStatistics(String metricName) {
        List<Long> histogram = latencyHistograms.get(metricName);
        if (histogram == null) return null;
        List<Long> sorted;
        synchronized (histogram) {
            if (histogram.isEmpty()) return null;
            sorted = new ArrayList<>(histogram);
        }
        sorted.sort(Long::compareTo);
        long min = sorted.get(0);
        long max = sorted.get(sorted.size() - 1);
        long p50 = sorted.get(sorted.size() / 2);
        long p95 = sorted.get(Math.min(sorted.size() - 1, (int) (sorted.size() * 0.95)));
        double avg = sorted.stream().mapToLong(Long::longValue).average().orElse(0.0);
        return new LatencyStatistics(min, max, (long) avg, p50, p95, sorted.size());
    }

    public MetricsSummary getMetricsSummary() {
        Map<String, Long> counterSnapshot = new HashMap<>();
        counters.forEach((key, value) -> counterSnapshot.put(key, value.sum()));
        Map<String, Double> gaugeSnapshot = new HashMap<>(gauges);
        Map<String, LatencyStatistics> latencySnapshot = new HashMap<>();
        latencyHistograms.keySet().forEach(key -> {
            LatencyStatistics stats = getLatencyStatistics(key);
            if (stats != null) latencySnapshot.put(key, stats);
        });
        return new MetricsSummary(counterSnapshot, gaugeSnapshot, latencySnapshot, Instant.now());
    }

    public void resetMetrics() {
        counters.clear();
        latencyHistograms.clear();
        gauges.clear();
        log.info("All metrics have been reset");
    }

    private void incrementCounter(String metricName) {
        counters.computeIfAbsent(metricName, k -> new LongAdder()).increment();
    }

    private void updateGauge(String metricName, double value) {
        gauges.put(metricName, value);
    }

    private void recordLatency(String metricName, long latencyMs) {
        List<Long> histogram = latencyHistograms.computeIfAbsent(metricName, k -> new ArrayList<>());
        double avg;
        synchronized (histogram) {
            histogram.add(latencyMs);
            if (histogram.size() > MAX_HISTOGRAM_SIZE) {
                histogram.subList(0, histogram.size() - MAX_HISTOGRAM_SIZE).clear();
            }
            avg = histogram.stream().mapToLong(Long::longValue).average().orElse(0.0);
        }
        updateGauge(metricName + ".avg", avg);
    }

    private void updateSourceFailureRate(String source) {
        long calls = getCounter("source.calls." + source);
        long failures = getCounter("source.failures." + source);
        if (calls > 0) updateGauge("source.failure_rate." + source, ratePct(failures, calls));
    }

    private static double ratePct(long part, long total) {
        return total <= 0 ? 0.0 : part * 100.0 / total;
    }

    public record LatencyStatistics(long min, long max, long avg, long p50, long p95, int sampleSize) {
    }

    public record MetricsSummary(
            Map<String, Long> counters,
            Map<String, Double> gauges,
            Map<String, LatencyStatistics> latencies,
            Instant timestamp
    ) {
    }
}
