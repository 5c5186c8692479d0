package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.model.ErrorCategory;
import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.Stage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff retry policy.
 * Delay for attempt n is base * 2^(n-1): 5s, 10s, 20s with the default base.
 */
@Slf4j
@Component
public class RetryPolicy {

    // 2^62 ms overflows long arithmetic well before this
    private static final int MAX_SHIFT = 62;

    private final PipelineProperties.Retry config;

    @Autowired
    public RetryPolicy(PipelineProperties properties) {
        this.config = properties.getRetry();
    }

    /**
     * True while the job still has attempts left
     */
    public boolean shouldRetry(JobRecord job) {
        return job.getAttemptCount() < job.getMaxAttempts();
    }

    public boolean isRetryable(ErrorCategory category) {
        return category.isRetryable();
    }

    public int getMaxAttempts() {
        return config.getMaxAttempts();
    }

    /**
     * @param attemptNumber the attempt that just failed, starting at 1
     * @throws IllegalArgumentException for attempt numbers below 1
     */
    public Duration backoffDelay(int attemptNumber) {
        return computeDelay(config.getBaseDelay(), attemptNumber);
    }

    /**
     * Same as {@link #backoffDelay(int)} with the stage's own base delay where one is configured
     */
    public Duration backoffDelay(Stage stage, int attemptNumber) {
        Duration base = config.getStageBaseDelays().getOrDefault(stage, config.getBaseDelay());
        return computeDelay(base, attemptNumber);
    }

    private Duration computeDelay(Duration base, int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be at least 1, got " + attemptNumber);
        }

        int shift = Math.min(attemptNumber - 1, MAX_SHIFT);
        long baseMillis = base.toMillis();
        long delayMillis;
        if (baseMillis > 0 && Long.numberOfLeadingZeros(baseMillis) <= shift) {
            delayMillis = Long.MAX_VALUE;
        } else {
            delayMillis = baseMillis << shift;
        }

        Duration delay = Duration.ofMillis(delayMillis);
        Duration maxDelay = config.getMaxDelay();
        if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
            delay = maxDelay;
        }

        log.debug("Backoff for attempt {}: {}ms", attemptNumber, delay.toMillis());
        return delay;
    }
}
