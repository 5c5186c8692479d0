package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.model.ErrorCategory;
import ai.imaginecalendar.voiceworker.model.Stage;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters for the voice pipeline.
 *
 * <ul>
 *   <li>{@code voice_pipeline_jobs_ingested_total}</li>
 *   <li>{@code voice_pipeline_stage_duration} tagged by stage and outcome</li>
 *   <li>{@code voice_pipeline_retries_total} tagged by stage</li>
 *   <li>{@code voice_pipeline_dead_letters_total} tagged by stage and category</li>
 *   <li>{@code voice_pipeline_jobs_completed_total}, {@code voice_pipeline_redeliveries_total},
 *       {@code voice_pipeline_jobs_expired_total}, {@code voice_pipeline_infrastructure_failures_total}</li>
 * </ul>
 */
@Slf4j
@Service
public class PipelineMetricsService {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_TIMEOUT = "timeout";

    private final MeterRegistry meterRegistry;

    private final Counter ingestedCounter;
    private final Counter completedCounter;
    private final Counter redeliveryCounter;
    private final Counter expiredCounter;
    private final Counter infrastructureFailureCounter;

    private final Map<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> taggedCounters = new ConcurrentHashMap<>();

    @Autowired
    public PipelineMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.ingestedCounter = Counter.builder("voice_pipeline_jobs_ingested_total")
                .description("Voice messages accepted into the pipeline")
                .register(meterRegistry);
        this.completedCounter = Counter.builder("voice_pipeline_jobs_completed_total")
                .description("Jobs that went through every stage")
                .register(meterRegistry);
        this.redeliveryCounter = Counter.builder("voice_pipeline_redeliveries_total")
                .description("Jobs handed out again after their visibility lock expired")
                .register(meterRegistry);
        this.expiredCounter = Counter.builder("voice_pipeline_jobs_expired_total")
                .description("Jobs dropped because a clarification reply never arrived")
                .register(meterRegistry);
        this.infrastructureFailureCounter = Counter.builder("voice_pipeline_infrastructure_failures_total")
                .description("Queue store failures seen by workers")
                .register(meterRegistry);
    }

    public void recordIngested() {
        ingestedCounter.increment();
    }

    public void recordStageExecution(Stage stage, String outcome, Duration duration) {
        String key = stage.getValue() + ":" + outcome;
        Timer timer = stageTimers.computeIfAbsent(key, k -> Timer.builder("voice_pipeline_stage_duration")
                .description("Stage handler execution time")
                .tag("stage", stage.getValue())
                .tag("outcome", outcome)
                .register(meterRegistry));
        timer.record(duration);
    }

    public void recordRetry(Stage stage) {
        counter("voice_pipeline_retries_total", "stage", stage.getValue(), null, null).increment();
    }

    public void recordDeadLetter(Stage stage, ErrorCategory category) {
        counter("voice_pipeline_dead_letters_total", "stage", stage.getValue(),
                "category", category.name().toLowerCase()).increment();
    }

    public void recordCompleted() {
        completedCounter.increment();
    }

    public void recordRedelivery() {
        redeliveryCounter.increment();
    }

    public void recordExpired() {
        expiredCounter.increment();
    }

    public void recordInfrastructureFailure() {
        infrastructureFailureCounter.increment();
    }

    private Counter counter(String name, String tag1, String value1, String tag2, String value2) {
        String key = name + ":" + value1 + ":" + value2;
        return taggedCounters.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(name).tag(tag1, value1);
            if (tag2 != null) {
                builder.tag(tag2, value2);
            }
            return builder.register(meterRegistry);
        });
    }
}
