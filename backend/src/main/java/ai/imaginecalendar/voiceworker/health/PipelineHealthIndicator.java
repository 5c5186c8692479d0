package ai.imaginecalendar.voiceworker.health;

import ai.imaginecalendar.voiceworker.model.QueueStats;
import ai.imaginecalendar.voiceworker.service.VoicePipelineService;
import ai.imaginecalendar.voiceworker.service.WorkerPoolService;
import ai.imaginecalendar.voiceworker.service.queue.JobQueue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports worker pool state and queue depths. DOWN when the queue store is unreachable.
 */
@Slf4j
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final JobQueue jobQueue;
    private final VoicePipelineService pipelineService;
    private final WorkerPoolService workerPoolService;

    @Autowired
    public PipelineHealthIndicator(JobQueue jobQueue,
                                   VoicePipelineService pipelineService,
                                   WorkerPoolService workerPoolService) {
        this.jobQueue = jobQueue;
        this.pipelineService = pipelineService;
        this.workerPoolService = workerPoolService;
    }

    @Override
    public Health health() {
        WorkerPoolService.WorkerPoolStats pool = workerPoolService.getPoolStats();

        if (!jobQueue.isAvailable()) {
            return Health.down()
                    .withDetail("queueStore", "unreachable")
                    .withDetail("poolRunning", pool.isPoolRunning())
                    .build();
        }

        try {
            QueueStats stats = pipelineService.getQueueStats();
            Map<String, Long> depth = new LinkedHashMap<>();
            stats.getDepthByStage().forEach((stage, count) -> depth.put(stage.getValue(), count));

            return Health.up()
                    .withDetail("poolRunning", pool.isPoolRunning())
                    .withDetail("paused", pool.isPaused())
                    .withDetail("activeWorkers", pool.getActiveWorkers())
                    .withDetail("configuredWorkers", pool.getConfiguredWorkers())
                    .withDetail("queueDepth", depth)
                    .withDetail("inFlight", stats.getInFlight())
                    .withDetail("awaitingInput", stats.getAwaitingInput())
                    .withDetail("deadLettered", stats.getDeadLettered())
                    .build();
        } catch (Exception e) {
            log.error("Pipeline health check failed: {}", e.getMessage(), e);
            return Health.down(e).build();
        }
    }
}
