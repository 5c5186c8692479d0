package ai.imaginecalendar.voiceworker.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of queue depths for operators
 */
@Value
@Builder
public class QueueStats {

    /**
     * Jobs waiting per stage, including those delayed by backoff
     */
    Map<Stage, Long> depthByStage;

    long inFlight;

    long awaitingInput;

    long deadLettered;

    Instant timestamp;

    public long getTotalQueued() {
        return depthByStage.values().stream().mapToLong(Long::longValue).sum();
    }
}
