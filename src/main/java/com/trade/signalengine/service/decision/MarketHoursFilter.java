package com.trade.signalengine.service.decision;

import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.dto.Instrument;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Vetoes evaluation outside the configured UTC trading window and during the FX weekend.
 */
@Component
public class MarketHoursFilter {

    /** FX closes Friday and reopens Sunday at this UTC hour. */
    static final int FX_ROLLOVER_HOUR = 22;

    private final SignalEngineProperties.TradingHours cfg;

    public MarketHoursFilter(SignalEngineProperties props) {
        this.cfg = props.getTradingHours();
    }

    /**
     * @return the reason the market is closed, empty when open
     */
    public Optional<String> closedReason(Instrument instrument, Instant at) {
        if (!cfg.isEnabled()) return Optional.empty();
        ZonedDateTime t = at.atZone(ZoneOffset.UTC);

        if (cfg.isWeekendClosed() && instrument.fx() && isFxWeekend(t)) {
            return Optional.of("FX weekend closure");
        }
        int hour = t.getHour();
        int start = cfg.getStartHour();
        int end = cfg.getEndHour();
        // equal hours mean the window covers the whole day
        boolean inside = start == end
                || (start < end ? hour >= start && hour < end : hour >= start || hour < end);
        if (!inside) {
            return Optional.of(String.format("outside trading hours %02d:00-%02d:00 UTC", start, end));
        }
        return Optional.empty();
    }

    public boolean isOpen(Instrument instrument, Instant at) {
        return closedReason(instrument, at).isEmpty();
    }

    static boolean isFxWeekend(ZonedDateTime t) {
        DayOfWeek d = t.getDayOfWeek();
        return (d == DayOfWeek.FRIDAY && t.getHour() >= FX_ROLLOVER_HOUR)
                || d == DayOfWeek.SATURDAY
                || (d == DayOfWeek.SUNDAY && t.getHour() < FX_ROLLOVER_HOUR);
    }
}
