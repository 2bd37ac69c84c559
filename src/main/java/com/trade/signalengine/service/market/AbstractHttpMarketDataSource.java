package com.trade.signalengine.service.market;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.exception.SourceUnavailableException;
import com.trade.signalengine.dto.Candle;
import com.trade.signalengine.dto.Instrument;
import com.trade.signalengine.enums.CandleInterval;
import com.trade.signalengine.enums.SourceErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;

/**
 * Shared HTTP plumbing for REST providers: credentials check, GET + JSON parse, and classification of
 * transport failures into {@link SourceErrorKind}s.
 */
@Slf4j
public abstract class AbstractHttpMarketDataSource implements MarketDataSource {

    /** Shorter payloads are treated as malformed rather than handed to the indicator engine. */
    public static final int MIN_CANDLES = 10;

    protected final RestTemplate template;
    protected final ObjectMapper mapper;
    protected final SignalEngineProperties.Provider provider;

    protected AbstractHttpMarketDataSource(RestTemplate template, ObjectMapper mapper,
                                           SignalEngineProperties.Provider provider) {
        this.template = template;
        this.mapper = mapper;
        this.provider = provider;
    }

    protected boolean requiresApiKey() {
        return true;
    }

    @Override
    public boolean isConfigured() {
        if (provider == null || !provider.isEnabled()) return false;
        return !requiresApiKey() || (provider.getApiKey() != null && !provider.getApiKey().isBlank());
    }

    @Override
    public final List<Candle> fetchCandles(Instrument instrument, CandleInterval interval, int outputSize) {
        if (!isConfigured()) {
            throw new SourceUnavailableException(name(), SourceErrorKind.NOT_CONFIGURED, "no API key or disabled");
        }
        JsonNode body = getJson(buildUri(instrument, interval, outputSize));
        checkEnvelope(body);
        List<Candle> candles = parseCandles(body, interval);
        long finite = candles.stream().filter(Candle::isFinite).count();
        if (finite < MIN_CANDLES) {
            throw new SourceUnavailableException(name(), SourceErrorKind.MALFORMED,
                    "only " + finite + " usable candles");
        }
        return candles;
    }

    protected abstract URI buildUri(Instrument instrument, CandleInterval interval, int outputSize);

    /**
     * Throws when the body is a provider error or quota envelope rather than data.
     */
    protected abstract void checkEnvelope(JsonNode body);

    protected abstract List<Candle> parseCandles(JsonNode body, CandleInterval interval);

    protected JsonNode getJson(URI uri) {
        String raw;
        try {
            raw = template.getForObject(uri, String.class);
        } catch (HttpStatusCodeException e) {
            HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
            if (status == HttpStatus.TOO_MANY_REQUESTS || e.getStatusCode().value() == 418) {
                throw new SourceUnavailableException(name(), SourceErrorKind.QUOTA, "HTTP " + e.getStatusCode().value(), e);
            }
            throw new SourceUnavailableException(name(), SourceErrorKind.HTTP_ERROR, "HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new SourceUnavailableException(name(), SourceErrorKind.TIMEOUT, String.valueOf(e.getMessage()), e);
        } catch (RestClientException e) {
            throw new SourceUnavailableException(name(), SourceErrorKind.HTTP_ERROR, String.valueOf(e.getMessage()), e);
        }
        if (raw == null || raw.isBlank()) {
            throw new SourceUnavailableException(name(), SourceErrorKind.MALFORMED, "empty body");
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException(name(), SourceErrorKind.MALFORMED, "not JSON", e);
        }
    }

    protected SourceUnavailableException malformed(String message) {
        return new SourceUnavailableException(name(), SourceErrorKind.MALFORMED, message);
    }

    /**
     * Numeric field that may be sent as a string. Missing or unparseable values become NaN.
     */
    protected static double num(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return Double.NaN;
        if (v.isNumber()) return v.asDouble();
        try {
            return Double.parseDouble(v.asText().trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    protected static double num(JsonNode array, int index) {
        JsonNode v = array.get(index);
        if (v == null || v.isNull()) return Double.NaN;
        if (v.isNumber()) return v.asDouble();
        try {
            return Double.parseDouble(v.asText().trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
