package com.trade.signalengine.dto;

/**
 * Effective decision thresholds for one evaluation.
 */
public record Thresholds(double minBuyScore, double maxSellScore, String label) {
}
