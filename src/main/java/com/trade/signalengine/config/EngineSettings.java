package com.trade.signalengine.config;

import com.trade.signalengine.common.constants.SignalEngineProperties;
import com.trade.signalengine.common.constants.SignalTuning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the live tuning snapshot. Readers get a private copy; writers publish a validated copy atomically.
 */
@Slf4j
@Component
public class EngineSettings {

    private final AtomicReference<SignalTuning> current;
    private final Object writeLock = new Object();

    @Autowired
    public EngineSettings(SignalEngineProperties props) {
        this(props.getTuning());
    }

    public EngineSettings(SignalTuning initial) {
        SignalTuning t = (initial == null ? new SignalTuning() : initial).copy();
        t.validate();
        this.current = new AtomicReference<>(t);
    }

    /**
     * Snapshot for one evaluation cycle.
     */
    public SignalTuning snapshot() {
        return current.get().copy();
    }

    /**
     * Applies one whitelisted option. The previous snapshot stays in force if the new value is rejected.
     *
     * @return the value now in force
     */
    public Object update(String key, String value) {
        TuningKey tk = TuningKey.of(key);
        synchronized (writeLock) {
            SignalTuning before = current.get();
            SignalTuning next = before.copy();
            tk.apply(next, value);
            next.validate();
            current.set(next);
            log.info("Tuning {} changed: {} -> {}", tk.key(), tk.read(before), tk.read(next));
            return tk.read(next);
        }
    }

    public Map<String, Object> describe() {
        SignalTuning t = current.get();
        Map<String, Object> out = new LinkedHashMap<>();
        for (TuningKey k : TuningKey.values()) {
            out.put(k.key(), k.read(t));
        }
        out.put("ta-weight", t.getTaWeight());
        return out;
    }
}
