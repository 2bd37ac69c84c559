package com.trade.signalengine.common;

import com.trade.signalengine.common.exception.ValidationException;
import com.trade.signalengine.dto.Instrument;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Symbol normalization and provider symbol lookup.
 */
public final class Instruments {

    private static final Map<String, Instrument> KNOWN = Map.of(
            "EURUSD", new Instrument("EURUSD", "EUR/USD", "EUR", "USD", "EURUSDT", 1.0800, true),
            "XAUUSD", new Instrument("XAUUSD", "XAU/USD", "XAU", "USD", "PAXGUSDT", 2700.0, true)
    );

    private static final Set<String> CRYPTO_BASES = Set.of("BTC", "ETH", "SOL", "BNB", "XRP");

    private Instruments() {
    }

    /**
     * EURUSD, EUR/USD, eur-usd and "eur usd" all normalize to EURUSD.
     */
    public static String normalize(String symbol) {
        if (symbol == null) throw new ValidationException("instrument is required");
        String n = symbol.toUpperCase(Locale.ROOT)
                .replace("/", "").replace("-", "").replace("_", "").replace(" ", "");
        if (KNOWN.containsKey(n)) return n;
        if (n.length() == 6 && n.chars().allMatch(Character::isLetter)) return n;
        throw new ValidationException("Unsupported instrument: " + symbol);
    }

    public static Instrument resolve(String symbol) {
        String n = normalize(symbol);
        Instrument known = KNOWN.get(n);
        if (known != null) return known;
        String from = n.substring(0, 3);
        String to = n.substring(3);
        String binance = "USD".equals(to) ? from + "USDT" : n;
        return new Instrument(n, from + "/" + to, from, to, binance, Double.NaN, !CRYPTO_BASES.contains(from));
    }
}
