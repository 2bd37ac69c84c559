package com.trade.signalengine.test.web;

import com.trade.signalengine.common.Result;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.constants.SignalTuning;
import com.trade.signalengine.common.exception.GlobalExceptionHandler;
import com.trade.signalengine.config.EngineSettings;
import com.trade.signalengine.service.engine.HealthMonitor;
import com.trade.signalengine.service.engine.RecentSignalsPublisher;
import com.trade.signalengine.service.engine.SignalEngineService;
import com.trade.signalengine.service.market.MarketDataService;
import com.trade.signalengine.service.market.MetricsCollector;
import com.trade.signalengine.service.pacing.SignalRateLimiter;
import com.trade.signalengine.service.pacing.UserRequestThrottle;
import com.trade.signalengine.test.support.MutableClock;
import com.trade.signalengine.web.EngineController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static com.trade.signalengine.test.support.Fixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class EngineControllerTest {

    private SignalEngineService engine;
    private EngineSettings settings;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        SignalEngineProperties props = new SignalEngineProperties();
        props.getPacing().setMaxUserRequestsPerMinute(2);
        MutableClock clock = new MutableClock(T0);
        MetricsCollector metrics = new MetricsCollector();
        MarketDataService marketData = mock(MarketDataService.class);
        when(marketData.getSourceStatus()).thenReturn(Map.of());
        engine = mock(SignalEngineService.class);
        settings = new EngineSettings(new SignalTuning());

        EngineController controller = new EngineController(engine, new UserRequestThrottle(props, clock),
                new RecentSignalsPublisher(), new HealthMonitor(metrics, props, clock), metrics, marketData,
                new SignalRateLimiter(clock), settings);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void noDataMapsToBadGateway() throws Exception {
        when(engine.evaluate("EURUSD")).thenReturn(Result.fail("NO_DATA", "No market data for EURUSD"));

        mvc.perform(post("/api/engine/evaluate/EURUSD").header("X-User-Id", "alice"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("NO_DATA"));
    }

    @Test
    void throttledUserGetsTooManyRequests() throws Exception {
        when(engine.evaluate(any())).thenReturn(Result.fail("MARKET_CLOSED", "FX weekend closure"));

        mvc.perform(post("/api/engine/evaluate/EURUSD").header("X-User-Id", "alice"))
                .andExpect(status().isServiceUnavailable());
        mvc.perform(post("/api/engine/evaluate/EURUSD").header("X-User-Id", "alice"))
                .andExpect(status().isServiceUnavailable());
        mvc.perform(post("/api/engine/evaluate/EURUSD").header("X-User-Id", "alice"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("THROTTLED"));

        verify(engine, times(2)).evaluate("EURUSD");
    }

    @Test
    void settingsCanBeReadAndChanged() throws Exception {
        mvc.perform(get("/api/engine/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['min-buy-score']").value(60.0));

        mvc.perform(put("/api/engine/settings/min-confidence").param("value", "72"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['min-confidence']").value(72.0));
    }

    @Test
    void invalidSettingIsBadRequestAndNotApplied() throws Exception {
        mvc.perform(put("/api/engine/settings/min-buy-score").param("value", "30"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ERR-VAL-001"));
        mvc.perform(put("/api/engine/settings/secret-key").param("value", "1"))
                .andExpect(status().isBadRequest());

        assertThat(settings.snapshot().getMinBuyScore()).isEqualTo(60.0);
    }

    @Test
    void statusReportsEngineState() throws Exception {
        when(engine.isCycleRunning()).thenReturn(false);
        when(engine.getSkippedTicks()).thenReturn(3L);

        mvc.perform(get("/api/engine/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skippedTicks").value(3))
                .andExpect(jsonPath("$.health.healthy").value(true))
                .andExpect(jsonPath("$.signalsLastHour").value(0));

        verify(engine, never()).evaluate(any());
    }
}
