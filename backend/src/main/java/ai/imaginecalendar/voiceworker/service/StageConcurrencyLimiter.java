package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.model.Stage;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-stage in-flight limits within this process.
 * Stages without a configured limit are bounded by the pool size only.
 */
@Component
public class StageConcurrencyLimiter {

    private final Map<Stage, Integer> limits;
    private final Map<Stage, AtomicInteger> running = new EnumMap<>(Stage.class);

    @Autowired
    public StageConcurrencyLimiter(PipelineProperties properties) {
        Map<Stage, Integer> configured = properties.getWorker().getStageConcurrency();
        this.limits = configured.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(configured));
        for (Stage stage : Stage.values()) {
            running.put(stage, new AtomicInteger());
        }
    }

    /**
     * Stages a slot may currently take work from. Jobs waiting at
     * clarification_response are parked and never dequeued.
     */
    public Set<Stage> eligibleStages() {
        Set<Stage> eligible = EnumSet.noneOf(Stage.class);
        for (Stage stage : Stage.values()) {
            if (stage != Stage.CLARIFICATION_RESPONSE && hasCapacity(stage)) {
                eligible.add(stage);
            }
        }
        return eligible;
    }

    public boolean tryAcquire(Stage stage) {
        Integer limit = limits.get(stage);
        AtomicInteger count = running.get(stage);
        if (limit == null) {
            count.incrementAndGet();
            return true;
        }
        while (true) {
            int current = count.get();
            if (current >= limit) {
                return false;
            }
            if (count.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release(Stage stage) {
        running.get(stage).decrementAndGet();
    }

    public int running(Stage stage) {
        return running.get(stage).get();
    }

    private boolean hasCapacity(Stage stage) {
        Integer limit = limits.get(stage);
        return limit == null || running.get(stage).get() < limit;
    }
}
