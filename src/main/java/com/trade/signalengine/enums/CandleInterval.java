package com.trade.signalengine.enums;

import com.trade.signalengine.common.exception.ValidationException;
import lombok.Getter;

import java.time.Duration;
import java.util.Locale;

/**
 * Candle interval with each provider's spelling of it.
 */
@Getter
public enum CandleInterval {
    ONE_MINUTE("1min", "1min", "1m", Duration.ofMinutes(1)),
    FIVE_MINUTES("5min", "5min", "5m", Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("15min", "15min", "15m", Duration.ofMinutes(15)),
    THIRTY_MINUTES("30min", "30min", "30m", Duration.ofMinutes(30)),
    ONE_HOUR("1h", "60min", "1h", Duration.ofHours(1));

    private final String twelveData;
    private final String alphaVantage;
    private final String binance;
    private final Duration duration;

    CandleInterval(String twelveData, String alphaVantage, String binance, Duration duration) {
        this.twelveData = twelveData;
        this.alphaVantage = alphaVantage;
        this.binance = binance;
        this.duration = duration;
    }

    /**
     * Accepts the enum name or any provider spelling ("1min", "1m", "60min").
     */
    public static CandleInterval parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("interval is required");
        }
        String v = value.trim();
        for (CandleInterval i : values()) {
            if (i.name().equalsIgnoreCase(v) || i.twelveData.equalsIgnoreCase(v)
                    || i.alphaVantage.equalsIgnoreCase(v) || i.binance.equals(v.toLowerCase(Locale.ROOT))) {
                return i;
            }
        }
        throw new ValidationException("Unsupported interval: " + value);
    }
}
