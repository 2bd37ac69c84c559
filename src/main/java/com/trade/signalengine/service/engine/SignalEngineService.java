package com.trade.signalengine.service.engine;

import com.trade.signalengine.common.Instruments;
import com.trade.signalengine.common.Result;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.common.exception.SignalEngineException;
import com.trade.signalengine.config.EngineSettings;
import com.trade.signalengine.dto.AdvisoryOpinion;
import com.trade.signalengine.dto.AdvisorySnapshot;
import com.trade.signalengine.dto.CandleSeries;
import com.trade.signalengine.dto.Evaluation;
import com.trade.signalengine.dto.IndicatorBundle;
import com.trade.signalengine.dto.Instrument;
import com.trade.signalengine.dto.ScoreResult;
import com.trade.signalengine.enums.CandleInterval;
import com.trade.signalengine.service.advisory.AdvisoryService;
import com.trade.signalengine.service.decision.DecisionService;
import com.trade.signalengine.service.decision.MarketHoursFilter;
import com.trade.signalengine.service.indicators.IndicatorEngine;
import com.trade.signalengine.service.market.MarketDataService;
import com.trade.signalengine.service.market.MetricsCollector;
import com.trade.signalengine.service.pacing.SignalRateLimiter;
import com.trade.signalengine.service.scoring.ScoringEngine;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the pipeline: acquire, indicators, advisory, score, decide, pace, publish.
 * <p>
 * Scheduled cycles never overlap: a tick that arrives while a cycle is running is skipped and counted.
 * No failure escapes a cycle; each one becomes a skip with its error code.
 */
@Slf4j
@Service
public class SignalEngineService {

    private final EngineSettings settings;
    private final MarketDataService marketData;
    private final IndicatorEngine indicatorEngine;
    private final AdvisoryService advisoryService;
    private final ScoringEngine scoring;
    private final DecisionService decision;
    private final MarketHoursFilter marketHours;
    private final SignalRateLimiter rateLimiter;
    private final MetricsCollector metrics;
    private final List<SignalPublisher> publishers;
    private final Retry marketDataRetry;
    private final ExecutorService cycleExecutor;
    private final SignalEngineProperties props;
    private final Clock clock;
    private final CandleInterval interval;

    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private volatile CycleReport lastCycle;

    public SignalEngineService(EngineSettings settings,
                               MarketDataService marketData,
                               IndicatorEngine indicatorEngine,
                               AdvisoryService advisoryService,
                               ScoringEngine scoring,
                               DecisionService decision,
                               MarketHoursFilter marketHours,
                               SignalRateLimiter rateLimiter,
                               MetricsCollector metrics,
                               List<SignalPublisher> publishers,
                               Retry marketDataRetry,
                               @Qualifier("cycleExecutor") ExecutorService cycleExecutor,
                               SignalEngineProperties props,
                               Clock clock) {
        this.settings = settings;
        this.marketData = marketData;
        this.indicatorEngine = indicatorEngine;
        this.advisoryService = advisoryService;
        this.scoring = scoring;
        this.decision = decision;
        this.marketHours = marketHours;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
        this.publishers = publishers;
        this.marketDataRetry = marketDataRetry;
        this.cycleExecutor = cycleExecutor;
        this.props = props;
        this.clock = clock;
        this.interval = CandleInterval.parse(props.getData().getInterval());
    }

    /**
     * One evaluation for one instrument. Pipeline errors come back as failures carrying their error code.
     */
    public Result<Evaluation> evaluate(String instrument) {
        String symbol;
        try {
            symbol = Instruments.normalize(instrument);
        } catch (SignalEngineException e) {
            return Result.fail("UNKNOWN_INSTRUMENT", e.getMessage());
        }
        try {
            return runPipeline(symbol);
        } catch (SignalEngineException e) {
            metrics.recordCycleSkip(e.getErrorCode());
            log.warn("Evaluation of {} skipped [{}]: {}", symbol, e.getErrorCode(), e.getMessage());
            return Result.fail(e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordCycleSkip("ERR-SYS-001");
            log.error("Evaluation of {} failed unexpectedly", symbol, e);
            return Result.fail("ERR-SYS-001", e);
        }
    }

    /**
     * Scheduler entry point. Hands the cycle to its own thread and returns at once.
     */
    @Scheduled(fixedRateString = "${signal-engine.schedule.interval:PT2M}", initialDelayString = "PT10S")
    public void tick() {
        if (!props.getSchedule().isEnabled()) return;
        if (cycleRunning.get()) {
            skipTick();
            return;
        }
        try {
            cycleExecutor.execute(this::runCycle);
        } catch (RejectedExecutionException e) {
            log.error("Cycle executor rejected tick: {}", e.getMessage());
        }
    }

    /**
     * Evaluates every configured instrument once.
     *
     * @return empty when another cycle was still running
     */
    public Optional<CycleReport> runCycle() {
        if (!cycleRunning.compareAndSet(false, true)) {
            skipTick();
            return Optional.empty();
        }
        try {
            Instant started = clock.instant();
            Map<String, String> outcomes = new LinkedHashMap<>();
            for (String instrument : props.getInstruments()) {
                Result<Evaluation> r = evaluate(instrument);
                outcomes.put(instrument, r.isOk() ? r.getData().signal().action().name() : r.getErrorCode());
            }
            CycleReport report = new CycleReport(cycles.incrementAndGet(), started, clock.instant(), outcomes);
            lastCycle = report;
            log.info("Cycle #{} done: {}", report.number(), outcomes);
            return Optional.of(report);
        } catch (RuntimeException e) {
            log.error("Cycle failed", e);
            return Optional.empty();
        } finally {
            cycleRunning.set(false);
        }
    }

    public boolean isCycleRunning() {
        return cycleRunning.get();
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }

    public CycleReport getLastCycle() {
        return lastCycle;
    }

    private Result<Evaluation> runPipeline(String symbol) {
        SignalTuning tuning = settings.snapshot();
        Instrument inst = Instruments.resolve(symbol);
        Instant now = clock.instant();

        Optional<String> closed = marketHours.closedReason(inst, now);
        if (closed.isPresent()) {
            metrics.recordCycleSkip("MARKET_CLOSED");
            log.info("Skipping {}: {}", symbol, closed.get());
            return Result.fail("MARKET_CLOSED", closed.get());
        }

        CandleSeries series = Retry.decorateSupplier(marketDataRetry, () -> marketData.fetch(symbol, interval)).get();
        IndicatorBundle ind = indicatorEngine.compute(series, tuning);
        AdvisoryOpinion advisory = advisoryService.requestOpinion(AdvisorySnapshot.of(symbol, ind)).orElse(null);
        ScoreResult score = scoring.score(ind, ind.trend(), ind.momentum(), advisory, tuning);
        Evaluation evaluation = decision.decide(symbol, series.getSource(), ind, score, tuning, now);
        metrics.recordEvaluation(symbol, evaluation.signal().action().name());

        if (!rateLimiter.admit(evaluation.signal(), tuning.getMaxSignalsPerHour())) {
            metrics.recordCycleSkip("RATE_LIMITED");
            return Result.fail("RATE_LIMITED", symbol + " " + evaluation.signal().action()
                    + " dropped: hourly signal limit " + tuning.getMaxSignalsPerHour() + " reached");
        }
        if (evaluation.signal().isDirectional()) {
            metrics.recordSignal(symbol, evaluation.signal().action().name(), evaluation.signal().confidence());
        }
        publish(evaluation);
        return Result.ok(evaluation);
    }

    private void publish(Evaluation evaluation) {
        for (SignalPublisher p : publishers) {
            try {
                p.publish(evaluation);
            } catch (RuntimeException e) {
                log.error("Publisher {} failed for {}", p.getClass().getSimpleName(),
                        evaluation.signal().instrument(), e);
            }
        }
    }

    private void skipTick() {
        long n = skippedTicks.incrementAndGet();
        metrics.recordCycleSkip("OVERLAP");
        log.warn("Previous cycle still running; tick skipped ({} so far)", n);
    }

    public record CycleReport(long number, Instant startedAt, Instant finishedAt, Map<String, String> outcomes) {
    }
}
