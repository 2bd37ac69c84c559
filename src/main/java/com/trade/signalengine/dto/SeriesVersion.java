package com.trade.signalengine.dto;

import com.trade.signalengine.enums.CandleInterval;

import java.time.Instant;

/**
 * Identity of one fetched series: same instrument, interval, last bar and length means same data.
 */
public record SeriesVersion(String instrument, CandleInterval interval, Instant lastTimestamp, int size) {
}
