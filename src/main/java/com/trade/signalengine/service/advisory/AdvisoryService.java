package com.trade.signalengine.service.advisory;

import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.exception.AdvisoryTimeoutException;
import com.trade.signalengine.dto.AdvisoryOpinion;
import com.trade.signalengine.dto.AdvisorySnapshot;
import com.trade.signalengine.service.market.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the advisory call off the evaluation thread and waits a bounded time for it.
 * A late call is abandoned, not cancelled: it finishes in the background and only its metrics are kept.
 */
@Slf4j
@Service
public class AdvisoryService {

    private final AdvisoryProvider provider;
    private final MetricsCollector metrics;
    private final ExecutorService executor;
    private final Duration waitTimeout;

    @Autowired
    public AdvisoryService(AdvisoryProvider provider, MetricsCollector metrics,
                           @Qualifier("advisoryExecutor") ExecutorService executor,
                           SignalEngineProperties props) {
        this(provider, metrics, executor, props.getAdvisory().getWaitTimeout());
    }

    public AdvisoryService(AdvisoryProvider provider, MetricsCollector metrics, ExecutorService executor,
                           Duration waitTimeout) {
        this.provider = provider;
        this.metrics = metrics;
        this.executor = executor;
        this.waitTimeout = waitTimeout;
    }

    public boolean isEnabled() {
        return provider != null && provider.isConfigured();
    }

    /**
     * Advisory opinion, or empty when disabled, failed or later than the wait budget.
     */
    public Optional<AdvisoryOpinion> requestOpinion(AdvisorySnapshot snapshot) {
        if (!isEnabled()) return Optional.empty();
        try {
            return await(submit(snapshot), snapshot.instrument());
        } catch (AdvisoryTimeoutException e) {
            log.info("Scoring {} without advisory: {}", snapshot.instrument(), e.getMessage());
            return Optional.empty();
        }
    }

    private CompletableFuture<Optional<AdvisoryOpinion>> submit(AdvisorySnapshot snapshot) {
        long start = System.currentTimeMillis();
        CompletableFuture<Optional<AdvisoryOpinion>> call =
                CompletableFuture.supplyAsync(() -> {
                    Optional<AdvisoryOpinion> opinion = provider.advise(snapshot);
                    return opinion == null ? Optional.<AdvisoryOpinion>empty() : opinion;
                }, executor);
        call.whenComplete((opinion, err) -> {
            metrics.recordAdvisoryCall(err == null && opinion != null && opinion.isPresent(), System.currentTimeMillis() - start);
            if (err != null) log.debug("Advisory call for {} failed: {}", snapshot.instrument(), err.getMessage());
        });
        return call;
    }

    private Optional<AdvisoryOpinion> await(CompletableFuture<Optional<AdvisoryOpinion>> call, String instrument) {
        try {
            return call.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new AdvisoryTimeoutException("no advisory for " + instrument + " within " + waitTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            log.warn("Advisory call for {} failed: {}", instrument, String.valueOf(e.getCause()));
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdvisoryTimeoutException("interrupted while waiting for advisory on " + instrument, e);
        }
    }
}
