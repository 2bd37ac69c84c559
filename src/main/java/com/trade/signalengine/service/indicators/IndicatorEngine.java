package com.trade.signalengine.service.indicators;

import com.trade.signalengine.common.Ta4jIndicators;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.common.exception.InsufficientHistoryException;
import com.trade.signalengine.core.TtlLruCache;
import com.trade.signalengine.dto.CandleSeries;
import com.trade.signalengine.dto.IndicatorBundle;
import com.trade.signalengine.dto.MomentumState;
import com.trade.signalengine.dto.SeriesVersion;
import com.trade.signalengine.dto.TrendState;
import com.trade.signalengine.service.market.MetricsCollector;
import com.trade.signalengine.service.trend.TrendDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.ta4j.core.BarSeries;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Computes one {@link IndicatorBundle} per {@link SeriesVersion} and caches it for a short window.
 * Computation is a pure function of the series and the indicator periods; the tuning only feeds the trend rules.
 */
@Slf4j
@Service
public class IndicatorEngine {

    private static final String CACHE_NAME = "indicators";

    private final Ta4jIndicators ta;
    private final TrendDetector trendDetector;
    private final MetricsCollector metrics;
    private final int momentumPeriods;
    private final Duration cacheTtl;
    private final TtlLruCache<SeriesVersion, IndicatorBundle> cache;
    private final Object computeLock = new Object();

    public IndicatorEngine(SignalEngineProperties props, TrendDetector trendDetector,
                           MetricsCollector metrics, Clock clock) {
        SignalEngineProperties.Indicators p = props.getIndicators();
        this.ta = new Ta4jIndicators(p);
        this.trendDetector = trendDetector;
        this.metrics = metrics;
        this.momentumPeriods = p.getMomentumPeriods();
        this.cacheTtl = p.getCacheTtl();
        this.cache = new TtlLruCache<>(p.getCacheMaxEntries(), clock);
    }

    public int minimumHistory() {
        return ta.minimumHistory();
    }

    /**
     * @throws InsufficientHistoryException when the series is shorter than the longest look-back
     */
    public IndicatorBundle compute(CandleSeries series, SignalTuning tuning) {
        int required = ta.minimumHistory();
        if (series.size() < required) {
            throw new InsufficientHistoryException(series.size(), required);
        }
        SeriesVersion version = series.version();
        Optional<IndicatorBundle> hit = cache.get(version);
        if (hit.isPresent()) {
            metrics.recordCacheHit(CACHE_NAME);
            return hit.get();
        }
        synchronized (computeLock) {
            AtomicBoolean loaded = new AtomicBoolean();
            IndicatorBundle bundle = cache.getOrCompute(version, cacheTtl, v -> {
                loaded.set(true);
                return load(series, v, tuning);
            });
            if (!loaded.get()) metrics.recordCacheHit(CACHE_NAME);
            return bundle;
        }
    }

    private IndicatorBundle load(CandleSeries series, SeriesVersion version, SignalTuning tuning) {
        metrics.recordCacheMiss(CACHE_NAME);
        IndicatorBundle bundle = calculate(series, version, tuning);
        log.debug("Indicators for {}: rsi={} macdDiff={} bb%={} adx={} atr={} trend={} momentum={}",
                version, bundle.rsi(), bundle.macdDiff(), bundle.bollingerPercent(), bundle.adx(),
                bundle.atr(), bundle.trend().direction(), bundle.momentum().direction());
        return bundle;
    }

    private IndicatorBundle calculate(CandleSeries series, SeriesVersion version, SignalTuning tuning) {
        BarSeries bars = ta.buildSeries(series.getInstrument(), series.getCandles(), series.getInterval().getDuration());
        double[] macd = ta.macd(bars);
        double[] stoch = ta.stochastic(bars);
        IndicatorBundle raw = new IndicatorBundle(
                version,
                series.lastClose(),
                ta.rsi(bars),
                macd[0], macd[1], macd[2],
                ta.bollingerPercent(bars),
                ta.atr(bars),
                ta.adx(bars),
                stoch[0], stoch[1],
                ta.volumeRatio(bars),
                null, null);
        TrendState trend = trendDetector.detectTrend(raw, tuning);
        MomentumState momentum = trendDetector.computeMomentum(series, momentumPeriods);
        return raw.withTrendAndMomentum(trend, momentum);
    }
}
