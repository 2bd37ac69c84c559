package com.trade.signalengine.dto;

import com.trade.signalengine.enums.CandleInterval;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, strictly time-ordered candle window for one (instrument, interval) key.
 * Replaced wholesale on every successful fetch; the candle list is unmodifiable.
 */
public final class CandleSeries {

    private final String instrument;
    private final CandleInterval interval;
    private final String source;
    private final List<Candle> candles;
    private final Instant fetchedAt;

    private CandleSeries(String instrument, CandleInterval interval, String source,
                         List<Candle> candles, Instant fetchedAt) {
        this.instrument = instrument;
        this.interval = interval;
        this.source = source;
        this.candles = candles;
        this.fetchedAt = fetchedAt;
    }

    /**
     * Drops non-finite rows, sorts by time, keeps the last bar per timestamp and trims to {@code lookback}.
     */
    public static CandleSeries normalize(String instrument, CandleInterval interval, String source,
                                         List<Candle> raw, int lookback, Instant fetchedAt) {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(interval, "interval");
        List<Candle> sorted = new ArrayList<>();
        if (raw != null) {
            for (Candle c : raw) {
                if (c != null && c.isFinite()) sorted.add(c);
            }
        }
        sorted.sort(Comparator.comparing(Candle::timestamp));

        List<Candle> unique = new ArrayList<>(sorted.size());
        for (Candle c : sorted) {
            int last = unique.size() - 1;
            if (last >= 0 && unique.get(last).timestamp().equals(c.timestamp())) {
                unique.set(last, c);
            } else {
                unique.add(c);
            }
        }
        int from = lookback > 0 ? Math.max(0, unique.size() - lookback) : 0;
        List<Candle> window = Collections.unmodifiableList(new ArrayList<>(unique.subList(from, unique.size())));
        return new CandleSeries(instrument, interval, source, window, fetchedAt == null ? Instant.now() : fetchedAt);
    }

    public String getInstrument() {
        return instrument;
    }

    public CandleInterval getInterval() {
        return interval;
    }

    public String getSource() {
        return source;
    }

    public List<Candle> getCandles() {
        return candles;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public Candle last() {
        return candles.isEmpty() ? null : candles.get(candles.size() - 1);
    }

    public double lastClose() {
        Candle c = last();
        return c == null ? Double.NaN : c.close();
    }

    public Instant lastTimestamp() {
        Candle c = last();
        return c == null ? null : c.timestamp();
    }

    public SeriesVersion version() {
        return new SeriesVersion(instrument, interval, lastTimestamp(), candles.size());
    }

    /**
     * Plain mean of the last {@code period} true ranges. Used for volatility checks before the indicator engine runs.
     */
    public double averageTrueRange(int period) {
        if (candles.size() < 2 || period <= 0) return Double.NaN;
        int from = Math.max(1, candles.size() - period);
        double sum = 0.0;
        int n = 0;
        for (int i = from; i < candles.size(); i++) {
            sum += candles.get(i).getTrueRange(candles.get(i - 1));
            n++;
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    @Override
    public String toString() {
        return "CandleSeries{" + instrument + "/" + interval + " from " + source
                + ", size=" + candles.size() + ", last=" + lastTimestamp() + "}";
    }
}
