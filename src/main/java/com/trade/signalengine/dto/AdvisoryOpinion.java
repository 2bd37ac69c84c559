package com.trade.signalengine.dto;

/**
 * @param score 0..100, above 50 bullish
 */
public record AdvisoryOpinion(double score, String rationale, String provider) {
}
