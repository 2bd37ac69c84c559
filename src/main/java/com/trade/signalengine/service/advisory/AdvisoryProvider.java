package com.trade.signalengine.service.advisory;

import com.trade.signalengine.dto.AdvisoryOpinion;
import com.trade.signalengine.dto.AdvisorySnapshot;

import java.util.Optional;

public interface AdvisoryProvider {

    boolean isConfigured();

    /**
     * Fetches a normalized advisory score (0..100) for the snapshot. May block for the provider's
     * request timeout; callers bound the wait themselves.
     */
    Optional<AdvisoryOpinion> advise(AdvisorySnapshot snapshot);
}
