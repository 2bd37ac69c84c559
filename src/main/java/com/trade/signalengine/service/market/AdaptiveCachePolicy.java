package com.trade.signalengine.service.market;

import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.config.EngineSettings;
import com.trade.signalengine.dto.CandleSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the raw-series cache TTL from current volatility.
 * <p>
 * Once an instrument has {@value #MIN_BASELINE_SAMPLES} ATR% samples, the latest ATR% is compared with their mean:
 * 1.5x above it gives the minimum TTL, below two thirds of it the maximum. Until then the absolute
 * high/low volatility bands from the tuning apply.
 */
@Slf4j
@Component
public class AdaptiveCachePolicy {

    static final int BASELINE_WINDOW = 20;
    static final int MIN_BASELINE_SAMPLES = 5;
    static final double HIGH_RATIO = 1.5;
    static final double LOW_RATIO = 2.0 / 3.0;

    private final SignalEngineProperties.Acquisition cfg;
    private final int atrPeriod;
    private final EngineSettings settings;
    private final Map<String, Deque<Double>> baselines = new ConcurrentHashMap<>();

    public AdaptiveCachePolicy(SignalEngineProperties props, EngineSettings settings) {
        this.cfg = props.getData();
        this.atrPeriod = props.getIndicators().getAtrPeriod();
        this.settings = settings;
    }

    public Duration ttlFor(CandleSeries series) {
        double price = series.lastClose();
        double atr = series.averageTrueRange(atrPeriod);
        if (!(price > 0) || !Double.isFinite(atr)) return cfg.getCacheBaseTtl();
        double atrPct = atr / price * 100.0;

        Deque<Double> window = baselines.computeIfAbsent(series.getInstrument(), k -> new ArrayDeque<>());
        double baseline;
        int samples;
        synchronized (window) {
            samples = window.size();
            baseline = window.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
            window.addLast(atrPct);
            while (window.size() > BASELINE_WINDOW) window.removeFirst();
        }

        Duration ttl;
        if (samples >= MIN_BASELINE_SAMPLES && baseline > 0) {
            double ratio = atrPct / baseline;
            ttl = ratio > HIGH_RATIO ? cfg.getCacheMinTtl()
                    : ratio < LOW_RATIO ? cfg.getCacheMaxTtl()
                    : cfg.getCacheBaseTtl();
        } else {
            SignalTuning t = settings.snapshot();
            ttl = atrPct > t.getHighVolatilityPct() ? cfg.getCacheMinTtl()
                    : atrPct < t.getLowVolatilityPct() ? cfg.getCacheMaxTtl()
                    : cfg.getCacheBaseTtl();
        }
        log.debug("Cache TTL for {}: {}s (atr%={}, baseline={}, samples={})",
                series.getInstrument(), ttl.toSeconds(), atrPct, baseline, samples);
        return ttl;
    }
}
