package com.trade.signalengine.enums;

/**
 * How the acquisition layer consults its providers.
 */
public enum SourceMode {
    /** Try providers in ranked order, falling through on failure. */
    SEQUENTIAL,
    /** Query all providers at once and take the first valid series. */
    PARALLEL
}
