package com.trade.signalengine.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * Every configured source failed or returned an unusable payload.
 */
@Getter
public class NoDataAvailableException extends SignalEngineException {

    private final String instrument;
    private final List<SourceUnavailableException> failures;

    public NoDataAvailableException(String instrument, List<SourceUnavailableException> failures) {
        super("No market data for " + instrument + " (" + describe(failures) + ")");
        this.instrument = instrument;
        this.failures = List.copyOf(failures);
    }

    public NoDataAvailableException(String instrument, String reason) {
        super("No market data for " + instrument + " (" + reason + ")");
        this.instrument = instrument;
        this.failures = List.of();
    }

    private static String describe(List<SourceUnavailableException> failures) {
        if (failures == null || failures.isEmpty()) return "no sources configured";
        StringBuilder sb = new StringBuilder();
        for (SourceUnavailableException f : failures) {
            if (sb.length() > 0) sb.append("; ");
            sb.append(f.getSource()).append('=').append(f.getKind());
        }
        return sb.toString();
    }

    @Override
    protected String getDefaultErrorCode() {
        return "NO_DATA";
    }
}
