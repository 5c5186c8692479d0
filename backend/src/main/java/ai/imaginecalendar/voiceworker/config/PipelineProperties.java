package ai.imaginecalendar.voiceworker.config;

import ai.imaginecalendar.voiceworker.model.Stage;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pipeline settings bound from the {@code pipeline.*} namespace.
 * Injected into the queue, retry policy and worker pool.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @Valid
    private Queue queue = new Queue();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Worker worker = new Worker();

    @Valid
    private Dlq dlq = new Dlq();

    @Valid
    private Clarification clarification = new Clarification();

    @AssertTrue(message = "pipeline.worker.handler-timeout must be shorter than pipeline.queue.lock-duration")
    public boolean isHandlerTimeoutBelowLockDuration() {
        return worker.getHandlerTimeout().compareTo(queue.getLockDuration()) < 0;
    }

    @Data
    public static class Queue {

        @NotBlank
        private String keyPrefix = "voice-pipeline";

        @NotNull
        private Duration lockDuration = Duration.ofSeconds(60);

        @NotNull
        private Duration lockCheckInterval = Duration.ofSeconds(5);

        @NotNull
        private Duration pollInterval = Duration.ofMillis(500);

        @NotNull
        private Duration completedRetention = Duration.ofHours(1);
    }

    @Data
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration baseDelay = Duration.ofSeconds(5);

        /**
         * Optional cap on the computed backoff; null means uncapped
         */
        private Duration maxDelay;

        private Map<Stage, Duration> stageBaseDelays = new EnumMap<>(Stage.class);
    }

    @Data
    public static class Worker {

        @Min(1)
        private int concurrency = 3;

        /**
         * Optional per-stage in-flight limits; stages not listed are only bounded by concurrency
         */
        private Map<Stage, Integer> stageConcurrency = new EnumMap<>(Stage.class);

        @NotNull
        private Duration handlerTimeout = Duration.ofSeconds(50);

        private boolean autoStart = true;

        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration infrastructureBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Dlq {

        /**
         * Age after which dead letters are purged automatically; null disables the purge
         */
        private Duration retention;

        @NotNull
        private Duration cleanupInterval = Duration.ofHours(1);
    }

    @Data
    public static class Clarification {

        @NotNull
        private Duration timeout = Duration.ofMinutes(5);

        @NotNull
        private Duration reminderBefore = Duration.ofMinutes(2);

        @NotNull
        private Duration checkInterval = Duration.ofSeconds(60);
    }
}
