package com.trade.signalengine.service.engine;

import com.trade.signalengine.dto.Evaluation;

/**
 * Receives every admitted evaluation. Delivery and persistence collaborators implement this;
 * implementations must not block for long and must not mutate the evaluation.
 */
public interface SignalPublisher {

    void publish(Evaluation evaluation);
}
