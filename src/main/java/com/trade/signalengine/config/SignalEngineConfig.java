package com.trade.signalengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.exception.NoDataAvailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(SignalEngineProperties.class)
public class SignalEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    @Bean
    @Qualifier("marketDataRestTemplate")
    public RestTemplate marketDataRestTemplate(RestTemplateBuilder builder, SignalEngineProperties props) {
        return builder
                .setConnectTimeout(props.getData().getSourceTimeout())
                .setReadTimeout(props.getData().getSourceTimeout())
                .build();
    }

    @Bean
    @Qualifier("advisoryRestTemplate")
    public RestTemplate advisoryRestTemplate(RestTemplateBuilder builder, SignalEngineProperties props) {
        return builder
                .setConnectTimeout(props.getAdvisory().getRequestTimeout())
                .setReadTimeout(props.getAdvisory().getRequestTimeout())
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("marketDataExecutor")
    public ExecutorService marketDataExecutor(SignalEngineProperties props) {
        int threads = Math.max(2, props.getData().getSourceOrder().size() * 2);
        return Executors.newFixedThreadPool(threads, daemonThreads("market-data-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("advisoryExecutor")
    public ExecutorService advisoryExecutor() {
        return Executors.newFixedThreadPool(2, daemonThreads("advisory-"));
    }

    /**
     * Runs scheduled evaluation cycles so a slow cycle never backs up the scheduler thread.
     */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("cycleExecutor")
    public ExecutorService cycleExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("signal-cycle-"));
    }

    /**
     * Bounded retry of a whole acquisition attempt inside one cycle. Only total exhaustion is retried;
     * single-source failures are already handled by the fallback chain.
     */
    @Bean
    public Retry marketDataRetry(RetryRegistry registry, SignalEngineProperties props) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(props.getData().getMaxFetchAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(props.getData().getRetryBackoff(), 2.0))
                .retryExceptions(NoDataAvailableException.class)
                .build();
        return registry.retry("marketData", config);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
