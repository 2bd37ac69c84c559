package com.trade.signalengine.service.engine;

import com.trade.signalengine.dto.Evaluation;
import com.trade.signalengine.dto.Signal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingSignalPublisher implements SignalPublisher {

    @Override
    public void publish(Evaluation evaluation) {
        Signal s = evaluation.signal();
        if (s.isDirectional()) {
            log.info("SIGNAL {} {} @ {} score={} conf={} SL={} TP={} via {}",
                    s.instrument(), s.action(), s.price(), round(s.score()), round(s.confidence()),
                    s.stopLoss(), s.takeProfit(), evaluation.dataSource());
        } else {
            log.debug("No signal for {} (score={}, conf={})", s.instrument(), round(s.score()), round(s.confidence()));
        }
    }

    private static double round(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
