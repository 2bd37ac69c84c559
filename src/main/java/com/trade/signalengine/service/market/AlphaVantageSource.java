package com.trade.signalengine.service.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.exception.SourceUnavailableException;
import com.trade.signalengine.dto.Candle;
import com.trade.signalengine.dto.Instrument;
import com.trade.signalengine.enums.CandleInterval;
import com.trade.signalengine.enums.SourceErrorKind;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Alpha Vantage {@code FX_INTRADAY}. Quota replies come back as HTTP 200 with a {@code Note} or
 * {@code Information} field; bad requests carry {@code Error Message}.
 */
@Component
public class AlphaVantageSource extends AbstractHttpMarketDataSource {

    public static final String NAME = "alphavantage";

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public AlphaVantageSource(@Qualifier("marketDataRestTemplate") RestTemplate template, ObjectMapper mapper,
                              SignalEngineProperties props) {
        super(template, mapper, props.getSources().getAlphavantage());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected URI buildUri(Instrument instrument, CandleInterval interval, int outputSize) {
        return UriComponentsBuilder.fromHttpUrl(provider.getBaseUrl())
                .path("/query")
                .queryParam("function", "FX_INTRADAY")
                .queryParam("from_symbol", instrument.fromCurrency())
                .queryParam("to_symbol", instrument.toCurrency())
                .queryParam("interval", interval.getAlphaVantage())
                .queryParam("outputsize", outputSize > 100 ? "full" : "compact")
                .queryParam("apikey", provider.getApiKey())
                .encode()
                .build()
                .toUri();
    }

    @Override
    protected void checkEnvelope(JsonNode body) {
        if (body.has("Error Message")) {
            throw new SourceUnavailableException(NAME, SourceErrorKind.PROVIDER_ERROR, body.get("Error Message").asText());
        }
        if (body.has("Note")) {
            throw new SourceUnavailableException(NAME, SourceErrorKind.QUOTA, body.get("Note").asText());
        }
        if (body.has("Information")) {
            throw new SourceUnavailableException(NAME, SourceErrorKind.QUOTA, body.get("Information").asText());
        }
    }

    @Override
    protected List<Candle> parseCandles(JsonNode body, CandleInterval interval) {
        JsonNode series = body.get("Time Series FX (" + interval.getAlphaVantage() + ")");
        if (series == null || !series.isObject() || series.isEmpty()) {
            throw malformed("missing time series");
        }
        List<Candle> out = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = series.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            LocalDateTime ts;
            try {
                ts = LocalDateTime.parse(e.getKey(), TS);
            } catch (DateTimeParseException ex) {
                continue;
            }
            JsonNode v = e.getValue();
            out.add(new Candle(ts.toInstant(ZoneOffset.UTC),
                    num(v, "1. open"), num(v, "2. high"), num(v, "3. low"), num(v, "4. close"), 0.0));
        }
        return out;
    }
}
