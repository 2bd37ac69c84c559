package com.trade.signalengine.service.market;

import com.trade.signalengine.common.Instruments;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.exception.NoDataAvailableException;
import com.trade.signalengine.common.exception.SourceUnavailableException;
import com.trade.signalengine.core.TtlLruCache;
import com.trade.signalengine.dto.Candle;
import com.trade.signalengine.dto.CandleSeries;
import com.trade.signalengine.dto.Instrument;
import com.trade.signalengine.enums.CandleInterval;
import com.trade.signalengine.enums.SourceErrorKind;
import com.trade.signalengine.enums.SourceMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Candle acquisition with ranked fallback, an optional parallel race, an adaptive-TTL cache and
 * single-flight de-duplication of concurrent misses.
 * <p>
 * Single-source failures are logged at debug and recorded in {@link MetricsCollector}; only total exhaustion
 * reaches the caller, as {@link NoDataAvailableException}.
 */
@Slf4j
@Service
public class MarketDataService {

    private static final String CACHE_NAME = "series";

    private final Map<String, MarketDataSource> sources;
    private final SignalEngineProperties props;
    private final AdaptiveCachePolicy cachePolicy;
    private final MetricsCollector metrics;
    private final ExecutorService executor;
    private final Clock clock;

    private final TtlLruCache<String, CandleSeries> cache;
    private final Map<String, CompletableFuture<CandleSeries>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, Instant> quotaCooldownUntil = new ConcurrentHashMap<>();
    private final Map<String, DailyCount> callsToday = new ConcurrentHashMap<>();

    public MarketDataService(List<MarketDataSource> sources,
                             SignalEngineProperties props,
                             AdaptiveCachePolicy cachePolicy,
                             MetricsCollector metrics,
                             @Qualifier("marketDataExecutor") ExecutorService executor,
                             Clock clock) {
        this.sources = sources.stream().collect(Collectors.toMap(
                MarketDataSource::name, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        this.props = props;
        this.cachePolicy = cachePolicy;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
        this.cache = new TtlLruCache<>(props.getData().getCacheMaxEntries(), clock);
    }

    /**
     * Latest series for the key, from cache when still fresh.
     *
     * @throws NoDataAvailableException when every source failed
     */
    public CandleSeries fetch(String instrument, CandleInterval interval) {
        Instrument inst = Instruments.resolve(instrument);
        String key = cacheKey(inst.symbol(), interval);

        Optional<CandleSeries> hit = cache.get(key);
        if (hit.isPresent()) {
            metrics.recordCacheHit(CACHE_NAME);
            log.debug("Series cache hit for {}", key);
            return hit.get();
        }
        metrics.recordCacheMiss(CACHE_NAME);

        CompletableFuture<CandleSeries> mine = new CompletableFuture<>();
        CompletableFuture<CandleSeries> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("Joining in-flight fetch for {}", key);
            return await(existing);
        }
        try {
            // a concurrent loader may have finished between the cache check and the registration
            CandleSeries series = cache.get(key).orElseGet(() -> load(inst, interval, key));
            mine.complete(series);
            return series;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public void invalidate(String instrument, CandleInterval interval) {
        cache.invalidate(cacheKey(Instruments.normalize(instrument), interval));
    }

    /**
     * Sources in the order the next fetch would try them. Quota-limited sources move to the end.
     */
    public List<String> currentRanking() {
        Instant now = clock.instant();
        List<String> order = new ArrayList<>();
        for (String name : props.getData().getSourceOrder()) {
            if (sources.containsKey(name)) order.add(name);
        }
        // stable sort keeps the configured order within each group
        order.sort(Comparator.comparing(name -> isQuotaLimited(name, now)));
        return order;
    }

    public Map<String, SourceStatus> getSourceStatus() {
        Instant now = clock.instant();
        Map<String, SourceStatus> out = new LinkedHashMap<>();
        for (String name : currentRanking()) {
            MarketDataSource s = sources.get(name);
            Instant until = quotaCooldownUntil.get(name);
            out.put(name, new SourceStatus(s.isConfigured(), callsFor(name, now),
                    until != null && until.isAfter(now) ? until : null, isQuotaLimited(name, now)));
        }
        return out;
    }

    private CandleSeries load(Instrument inst, CandleInterval interval, String key) {
        List<MarketDataSource> ranked = currentRanking().stream().map(sources::get).collect(Collectors.toList());
        if (ranked.isEmpty()) {
            throw new NoDataAvailableException(inst.symbol(), "no sources configured");
        }
        CandleSeries series = props.getData().getMode() == SourceMode.PARALLEL
                ? race(inst, interval, ranked)
                : sequential(inst, interval, ranked);
        Duration ttl = cachePolicy.ttlFor(series);
        cache.put(key, series, ttl);
        log.debug("Cached {} from {} for {}s", key, series.getSource(), ttl.toSeconds());
        return series;
    }

    private CandleSeries sequential(Instrument inst, CandleInterval interval, List<MarketDataSource> ranked) {
        List<SourceUnavailableException> failures = new ArrayList<>();
        long timeoutMs = props.getData().getSourceTimeout().toMillis();
        for (MarketDataSource source : ranked) {
            if (!source.isConfigured()) {
                failures.add(notConfigured(source));
                continue;
            }
            Future<CandleSeries> f = executor.submit(() -> callSource(source, inst, interval));
            try {
                return f.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                f.cancel(true);
                failures.add(recordFailure(new SourceUnavailableException(source.name(), SourceErrorKind.TIMEOUT,
                        "no reply within " + timeoutMs + "ms")));
            } catch (ExecutionException e) {
                failures.add(unwrap(source, e.getCause()));
            } catch (InterruptedException e) {
                f.cancel(true);
                Thread.currentThread().interrupt();
                failures.add(new SourceUnavailableException(source.name(), SourceErrorKind.TIMEOUT, "interrupted", e));
                break;
            }
        }
        throw new NoDataAvailableException(inst.symbol(), failures);
    }

    /**
     * Queries every configured source at once; the first structurally valid series wins and the rest are ignored.
     */
    private CandleSeries race(Instrument inst, CandleInterval interval, List<MarketDataSource> ranked) {
        List<SourceUnavailableException> failures = Collections.synchronizedList(new ArrayList<>());
        List<MarketDataSource> callable = new ArrayList<>();
        for (MarketDataSource s : ranked) {
            if (s.isConfigured()) callable.add(s);
            else failures.add(notConfigured(s));
        }
        if (callable.isEmpty()) throw new NoDataAvailableException(inst.symbol(), failures);

        long perSourceMs = props.getData().getSourceTimeout().toMillis();
        CompletableFuture<CandleSeries> winner = new CompletableFuture<>();
        AtomicInteger pending = new AtomicInteger(callable.size());
        List<CompletableFuture<CandleSeries>> calls = new ArrayList<>();

        for (MarketDataSource source : callable) {
            CompletableFuture<CandleSeries> call = CompletableFuture
                    .supplyAsync(() -> callSource(source, inst, interval), executor)
                    .orTimeout(perSourceMs, TimeUnit.MILLISECONDS);
            call.whenComplete((series, err) -> {
                if (err != null && (winner.isDone() || err instanceof CancellationException)) {
                    // loser abandoned after the race was decided; not a source failure
                    return;
                }
                if (err == null) {
                    if (winner.complete(series)) log.debug("Race for {} won by {}", inst.symbol(), source.name());
                } else {
                    Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                    if (cause instanceof TimeoutException) {
                        failures.add(recordFailure(new SourceUnavailableException(source.name(),
                                SourceErrorKind.TIMEOUT, "no reply within " + perSourceMs + "ms")));
                    } else {
                        failures.add(unwrap(source, cause));
                    }
                }
                if (pending.decrementAndGet() == 0 && !winner.isDone()) {
                    winner.completeExceptionally(new NoDataAvailableException(inst.symbol(), List.copyOf(failures)));
                }
            });
            calls.add(call);
        }

        try {
            return winner.get(props.getData().getRaceTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new NoDataAvailableException(inst.symbol(), "parallel race timed out");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof NoDataAvailableException nd) throw nd;
            throw new NoDataAvailableException(inst.symbol(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NoDataAvailableException(inst.symbol(), "interrupted");
        } finally {
            calls.forEach(c -> c.cancel(true));
        }
    }

    private CandleSeries callSource(MarketDataSource source, Instrument inst, CandleInterval interval) {
        int lookback = props.getData().getLookbackWindow();
        long start = System.currentTimeMillis();
        countCall(source.name());
        try {
            List<Candle> raw = source.fetchCandles(inst, interval, lookback);
            CandleSeries series = CandleSeries.normalize(inst.symbol(), interval, source.name(), raw, lookback, clock.instant());
            if (series.size() < AbstractHttpMarketDataSource.MIN_CANDLES) {
                throw new SourceUnavailableException(source.name(), SourceErrorKind.MALFORMED,
                        "only " + series.size() + " candles after normalization");
            }
            return series;
        } finally {
            metrics.recordSourceCall(source.name(), System.currentTimeMillis() - start);
        }
    }

    private SourceUnavailableException unwrap(MarketDataSource source, Throwable cause) {
        SourceUnavailableException sue = cause instanceof SourceUnavailableException s
                ? s
                : new SourceUnavailableException(source.name(), SourceErrorKind.PROVIDER_ERROR,
                String.valueOf(cause), cause);
        return recordFailure(sue);
    }

    private SourceUnavailableException recordFailure(SourceUnavailableException e) {
        metrics.recordSourceFailure(e.getSource(), e.getKind().name());
        if (e.getKind() == SourceErrorKind.QUOTA) {
            Instant until = clock.instant().plus(props.getData().getQuotaCooldown());
            quotaCooldownUntil.put(e.getSource(), until);
            log.info("Source {} hit its quota; ranked last until {}", e.getSource(), until);
        }
        log.debug("Source {} failed: {}", e.getSource(), e.getMessage());
        return e;
    }

    private SourceUnavailableException notConfigured(MarketDataSource source) {
        log.debug("Skipping {}: not configured", source.name());
        return new SourceUnavailableException(source.name(), SourceErrorKind.NOT_CONFIGURED, "not configured");
    }

    private boolean isQuotaLimited(String name, Instant now) {
        Instant until = quotaCooldownUntil.get(name);
        if (until != null && until.isAfter(now)) return true;
        int quota = dailyQuota(name);
        return quota > 0 && callsFor(name, now) >= quota;
    }

    private int dailyQuota(String name) {
        SignalEngineProperties.Sources s = props.getSources();
        SignalEngineProperties.Provider p = switch (name) {
            case TwelveDataSource.NAME -> s.getTwelvedata();
            case AlphaVantageSource.NAME -> s.getAlphavantage();
            case BinanceSource.NAME -> s.getBinance();
            default -> null;
        };
        return p == null ? 0 : p.getDailyQuota();
    }

    private void countCall(String name) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        callsToday.compute(name, (k, c) -> (c == null || !c.day().equals(today))
                ? new DailyCount(today, 1) : new DailyCount(today, c.count() + 1));
    }

    private int callsFor(String name, Instant now) {
        DailyCount c = callsToday.get(name);
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        return (c == null || !c.day().equals(today)) ? 0 : c.count();
    }

    private static CandleSeries await(CompletableFuture<CandleSeries> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    private static String cacheKey(String symbol, CandleInterval interval) {
        return symbol + "|" + interval.name();
    }

    private record DailyCount(LocalDate day, int count) {
    }

    /**
     * @param cooldownUntil set while a quota reply keeps the source ranked last
     */
    public record SourceStatus(boolean configured, int callsToday, Instant cooldownUntil, boolean deprioritized) {
    }
}
