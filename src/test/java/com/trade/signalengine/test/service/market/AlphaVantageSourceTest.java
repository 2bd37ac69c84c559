package com.trade.signalengine.test.service.market;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.signalengine.common.Instruments;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.exception.SourceUnavailableException;
import com.trade.signalengine.dto.Candle;
import com.trade.signalengine.enums.CandleInterval;
import com.trade.signalengine.enums.SourceErrorKind;
import com.trade.signalengine.service.market.AlphaVantageSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AlphaVantageSourceTest {

    private MockRestServiceServer server;
    private AlphaVantageSource source;

    @BeforeEach
    void setUp() {
        SignalEngineProperties props = new SignalEngineProperties();
        props.getSources().getAlphavantage().setApiKey("av-key");
        RestTemplate template = new RestTemplate();
        server = MockRestServiceServer.bindTo(template).build();
        source = new AlphaVantageSource(template, new ObjectMapper(), props);
    }

    private static String series(int rows) {
        StringBuilder sb = new StringBuilder("{\"Meta Data\":{\"1. Information\":\"FX Intraday (1min) Time Series\"},"
                + "\"Time Series FX (1min)\":{");
        for (int i = 0; i < rows; i++) {
            double c = 1.0850 - i * 0.0001;
            if (i > 0) sb.append(',');
            sb.append(String.format(Locale.ROOT,
                    "\"2024-03-06 10:%02d:00\":{\"1. open\":\"%.5f\",\"2. high\":\"%.5f\",\"3. low\":\"%.5f\",\"4. close\":\"%.5f\"}",
                    i, c, c + 0.0003, c - 0.0003, c));
        }
        return sb.append("}}").toString();
    }

    private SourceUnavailableException failure() {
        return catchThrowableOfType(
                () -> source.fetchCandles(Instruments.resolve("EURUSD"), CandleInterval.ONE_MINUTE, 100),
                SourceUnavailableException.class);
    }

    @Test
    void parsesIntradaySeries() {
        server.expect(requestTo(startsWith("https://www.alphavantage.co/query")))
                .andExpect(queryParam("function", "FX_INTRADAY"))
                .andExpect(queryParam("from_symbol", "EUR"))
                .andExpect(queryParam("to_symbol", "USD"))
                .andExpect(queryParam("outputsize", "compact"))
                .andRespond(withSuccess(series(20), MediaType.APPLICATION_JSON));

        List<Candle> candles = source.fetchCandles(Instruments.resolve("EURUSD"), CandleInterval.ONE_MINUTE, 100);

        assertThat(candles).hasSize(20).allMatch(c -> c.volume() == 0.0 && c.high() > c.low());
        server.verify();
    }

    @Test
    void noteIsQuota() {
        server.expect(requestTo(startsWith("https://www.alphavantage.co/query")))
                .andRespond(withSuccess("{\"Note\":\"Thank you for using Alpha Vantage! Our standard API call frequency is 5 calls per minute.\"}",
                        MediaType.APPLICATION_JSON));

        assertThat(failure().getKind()).isEqualTo(SourceErrorKind.QUOTA);
    }

    @Test
    void informationIsQuota() {
        server.expect(requestTo(startsWith("https://www.alphavantage.co/query")))
                .andRespond(withSuccess("{\"Information\":\"daily rate limit reached\"}", MediaType.APPLICATION_JSON));

        assertThat(failure().getKind()).isEqualTo(SourceErrorKind.QUOTA);
    }

    @Test
    void errorMessageIsProviderError() {
        server.expect(requestTo(startsWith("https://www.alphavantage.co/query")))
                .andRespond(withSuccess("{\"Error Message\":\"Invalid API call.\"}", MediaType.APPLICATION_JSON));

        assertThat(failure().getKind()).isEqualTo(SourceErrorKind.PROVIDER_ERROR);
    }

    @Test
    void missingSeriesIsMalformed() {
        server.expect(requestTo(startsWith("https://www.alphavantage.co/query")))
                .andRespond(withSuccess("{\"Meta Data\":{}}", MediaType.APPLICATION_JSON));

        assertThat(failure().getKind()).isEqualTo(SourceErrorKind.MALFORMED);
    }
}
