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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Twelve Data {@code /time_series}. Timestamps are requested in UTC; values arrive newest first as strings.
 */
@Component
public class TwelveDataSource extends AbstractHttpMarketDataSource {

    public static final String NAME = "twelvedata";

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    public TwelveDataSource(@Qualifier("marketDataRestTemplate") RestTemplate template, ObjectMapper mapper,
                            SignalEngineProperties props) {
        super(template, mapper, props.getSources().getTwelvedata());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected URI buildUri(Instrument instrument, CandleInterval interval, int outputSize) {
        return UriComponentsBuilder.fromHttpUrl(provider.getBaseUrl())
                .path("/time_series")
                .queryParam("symbol", instrument.pair())
                .queryParam("interval", interval.getTwelveData())
                .queryParam("outputsize", outputSize)
                .queryParam("timezone", "UTC")
                .queryParam("apikey", provider.getApiKey())
                .encode()
                .build()
                .toUri();
    }

    @Override
    protected void checkEnvelope(JsonNode body) {
        if ("error".equalsIgnoreCase(body.path("status").asText())
                || (body.has("code") && body.path("code").asInt(200) != 200)) {
            int code = body.path("code").asInt(0);
            String message = body.path("message").asText("unknown error");
            SourceErrorKind kind = (code == 429 || message.toLowerCase(Locale.ROOT).contains("api credits"))
                    ? SourceErrorKind.QUOTA : SourceErrorKind.PROVIDER_ERROR;
            throw new SourceUnavailableException(NAME, kind, message);
        }
        if (!body.path("values").isArray()) {
            throw malformed("missing values array");
        }
    }

    @Override
    protected List<Candle> parseCandles(JsonNode body, CandleInterval interval) {
        List<Candle> out = new ArrayList<>();
        for (JsonNode row : body.path("values")) {
            String dt = row.path("datetime").asText(null);
            if (dt == null) continue;
            LocalDateTime ts;
            try {
                ts = dt.length() == 10 ? LocalDate.parse(dt, DAY).atStartOfDay() : LocalDateTime.parse(dt, TS);
            } catch (DateTimeParseException e) {
                continue;
            }
            double volume = num(row, "volume");
            out.add(new Candle(ts.toInstant(ZoneOffset.UTC),
                    num(row, "open"), num(row, "high"), num(row, "low"), num(row, "close"),
                    Double.isFinite(volume) ? volume : 0.0));
        }
        return out;
    }
}
