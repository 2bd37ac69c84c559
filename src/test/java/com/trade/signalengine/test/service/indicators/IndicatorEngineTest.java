package com.trade.signalengine.test.service.indicators;

import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.common.exception.InsufficientHistoryException;
import com.trade.signalengine.dto.CandleSeries;
import com.trade.signalengine.dto.IndicatorBundle;
import com.trade.signalengine.enums.MomentumDirection;
import com.trade.signalengine.service.indicators.IndicatorEngine;
import com.trade.signalengine.service.market.MetricsCollector;
import com.trade.signalengine.service.trend.TrendDetector;
import com.trade.signalengine.test.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.trade.signalengine.test.support.Fixtures.T0;
import static com.trade.signalengine.test.support.Fixtures.series;
import static com.trade.signalengine.test.support.Fixtures.trend;
import static com.trade.signalengine.test.support.Fixtures.wave;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndicatorEngineTest {

    private final SignalEngineProperties props = new SignalEngineProperties();
    private final SignalTuning tuning = new SignalTuning();
    private MetricsCollector metrics;
    private MutableClock clock;
    private IndicatorEngine engine;

    @BeforeEach
    void setUp() {
        metrics = new MetricsCollector();
        clock = new MutableClock(T0);
        engine = new IndicatorEngine(props, new TrendDetector(props), metrics, clock);
    }

    @Test
    void refusesShortHistory() {
        CandleSeries shortSeries = series("EURUSD", wave(20, 1.08, 0.0, 0.0005));

        assertThatThrownBy(() -> engine.compute(shortSeries, tuning))
                .isInstanceOf(InsufficientHistoryException.class)
                .satisfies(e -> {
                    InsufficientHistoryException ih = (InsufficientHistoryException) e;
                    assertThat(ih.getAvailable()).isEqualTo(20);
                    assertThat(ih.getRequired()).isEqualTo(engine.minimumHistory());
                });
    }

    @Test
    void minimumHistoryCoversMacdWarmUp() {
        assertThat(engine.minimumHistory()).isEqualTo(35);
    }

    @Test
    void valuesStayInTheirRanges() {
        IndicatorBundle b = engine.compute(series("EURUSD", wave(120, 1.08, 0.00001, 0.0005)), tuning);

        assertThat(b.rsi()).isBetween(0.0, 100.0);
        assertThat(b.adx()).isBetween(0.0, 100.0);
        assertThat(b.stochK()).isBetween(0.0, 100.0);
        assertThat(b.stochD()).isBetween(0.0, 100.0);
        assertThat(Double.isFinite(b.bollingerPercent())).isTrue();
        assertThat(b.atr()).isPositive();
        assertThat(b.macdDiff()).isEqualTo(b.macdLine() - b.macdSignal());
        assertThat(b.volumeRatio()).isZero();
        assertThat(b.trend()).isNotNull();
        assertThat(b.momentum()).isNotNull();
    }

    @Test
    void sameSeriesGivesSameBundle() {
        CandleSeries s = series("EURUSD", wave(120, 1.08, 0.00001, 0.0005));
        IndicatorEngine other = new IndicatorEngine(props, new TrendDetector(props), new MetricsCollector(), clock);

        assertThat(engine.compute(s, tuning)).isEqualTo(other.compute(s, tuning));
    }

    @Test
    void risingCloseReadsOverboughtWithUpMomentum() {
        IndicatorBundle b = engine.compute(series("EURUSD", trend(120, 1.0, 0.001)), tuning);

        assertThat(b.rsi()).isGreaterThan(70.0);
        assertThat(b.momentum().direction()).isEqualTo(MomentumDirection.UP);
        assertThat(b.price()).isEqualTo(1.0 + 119 * 0.001);
    }

    @Test
    void bundleIsCachedPerSeriesVersion() {
        CandleSeries s = series("EURUSD", wave(120, 1.08, 0.00001, 0.0005));

        IndicatorBundle first = engine.compute(s, tuning);
        IndicatorBundle second = engine.compute(s, tuning);

        assertThat(second).isSameAs(first);
        assertThat(metrics.getCounter("cache.hits.indicators")).isEqualTo(1);
        assertThat(metrics.getCounter("cache.misses.indicators")).isEqualTo(1);

        clock.advance(Duration.ofSeconds(31));
        engine.compute(s, tuning);
        assertThat(metrics.getCounter("cache.misses.indicators")).isEqualTo(2);
    }

    @Test
    void concurrentCallersComputeOnce() throws Exception {
        CandleSeries s = series("EURUSD", wave(120, 1.08, 0.00001, 0.0005));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<IndicatorBundle>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return engine.compute(s, tuning);
                }));
            }
            go.countDown();
            IndicatorBundle first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<IndicatorBundle> f : results) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(metrics.getCounter("cache.misses.indicators")).isEqualTo(1);
        assertThat(metrics.getCounter("cache.hits.indicators")).isEqualTo(7);
    }
}
