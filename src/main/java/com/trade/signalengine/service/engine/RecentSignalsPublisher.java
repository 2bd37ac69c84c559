package com.trade.signalengine.service.engine;

import com.trade.signalengine.dto.Evaluation;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded buffer of the latest directional evaluations, newest first.
 */
@Component
public class RecentSignalsPublisher implements SignalPublisher {

    static final int CAPACITY = 50;

    private final Deque<Evaluation> recent = new ArrayDeque<>();

    @Override
    public synchronized void publish(Evaluation evaluation) {
        if (!evaluation.signal().isDirectional()) return;
        recent.addFirst(evaluation);
        while (recent.size() > CAPACITY) recent.removeLast();
    }

    public synchronized List<Evaluation> recent(int limit) {
        List<Evaluation> out = new ArrayList<>(Math.min(Math.max(limit, 0), recent.size()));
        for (Evaluation e : recent) {
            if (out.size() >= limit) break;
            out.add(e);
        }
        return out;
    }
}
