package com.trade.signalengine.test.service.market;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.signalengine.common.Instruments;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.exception.SourceUnavailableException;
import com.trade.signalengine.dto.Candle;
import com.trade.signalengine.enums.CandleInterval;
import com.trade.signalengine.enums.SourceErrorKind;
import com.trade.signalengine.service.market.BinanceSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class BinanceSourceTest {

    private static final long OPEN_MS = Instant.parse("2024-03-06T09:00:00Z").toEpochMilli();

    private MockRestServiceServer server;
    private BinanceSource source;

    @BeforeEach
    void setUp() {
        RestTemplate template = new RestTemplate();
        server = MockRestServiceServer.bindTo(template).build();
        source = new BinanceSource(template, new ObjectMapper(), new SignalEngineProperties());
    }

    private static String klines(int rows) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < rows; i++) {
            double c = 1.0840 + i * 0.0001;
            if (i > 0) sb.append(',');
            sb.append(String.format(Locale.ROOT,
                    "[%d,\"%.5f\",\"%.5f\",\"%.5f\",\"%.5f\",\"%.1f\",%d,\"0\",10,\"0\",\"0\",\"0\"]",
                    OPEN_MS + i * 60_000L, c, c + 0.0002, c - 0.0002, c, 1000.0 + i, OPEN_MS + i * 60_000L + 59_999));
        }
        return sb.append(']').toString();
    }

    private SourceUnavailableException failure() {
        return catchThrowableOfType(
                () -> source.fetchCandles(Instruments.resolve("EURUSD"), CandleInterval.ONE_MINUTE, 100),
                SourceUnavailableException.class);
    }

    @Test
    void needsNoKey() {
        assertThat(source.isConfigured()).isTrue();
    }

    @Test
    void parsesKlinesOfTheUsdtProxy() {
        server.expect(requestTo(startsWith("https://api.binance.com/api/v3/klines")))
                .andExpect(queryParam("symbol", "EURUSDT"))
                .andExpect(queryParam("interval", "1m"))
                .andExpect(queryParam("limit", "100"))
                .andRespond(withSuccess(klines(15), MediaType.APPLICATION_JSON));

        List<Candle> candles = source.fetchCandles(Instruments.resolve("EURUSD"), CandleInterval.ONE_MINUTE, 100);

        assertThat(candles).hasSize(15);
        assertThat(candles.get(0).timestamp()).isEqualTo(Instant.ofEpochMilli(OPEN_MS));
        assertThat(candles.get(14).volume()).isEqualTo(1014.0);
        server.verify();
    }

    @Test
    void weightLimitCodeIsQuota() {
        server.expect(requestTo(startsWith("https://api.binance.com/api/v3/klines")))
                .andRespond(withSuccess("{\"code\":-1003,\"msg\":\"Too much request weight used\"}", MediaType.APPLICATION_JSON));

        assertThat(failure().getKind()).isEqualTo(SourceErrorKind.QUOTA);
    }

    @Test
    void tooManyRequestsStatusIsQuota() {
        server.expect(requestTo(startsWith("https://api.binance.com/api/v3/klines")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThat(failure().getKind()).isEqualTo(SourceErrorKind.QUOTA);
    }

    @Test
    void ipBanStatusIsQuota() {
        server.expect(requestTo(startsWith("https://api.binance.com/api/v3/klines")))
                .andRespond(withStatus(HttpStatus.I_AM_A_TEAPOT));

        assertThat(failure().getKind()).isEqualTo(SourceErrorKind.QUOTA);
    }

    @Test
    void invalidSymbolIsProviderError() {
        server.expect(requestTo(startsWith("https://api.binance.com/api/v3/klines")))
                .andRespond(withSuccess("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}", MediaType.APPLICATION_JSON));

        assertThat(failure().getKind()).isEqualTo(SourceErrorKind.PROVIDER_ERROR);
    }
}
