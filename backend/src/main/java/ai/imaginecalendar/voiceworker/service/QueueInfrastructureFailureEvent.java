package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.service.exception.QueueInfrastructureException;

import org.springframework.context.ApplicationEvent;

import java.time.Instant;

/**
 * Published when a worker cannot reach the queue store.
 * Listeners hook process-level alerting onto it.
 */
public class QueueInfrastructureFailureEvent extends ApplicationEvent {

    private final String workerId;
    private final QueueInfrastructureException failure;
    private final Instant occurredAt;

    public QueueInfrastructureFailureEvent(Object source, String workerId,
                                           QueueInfrastructureException failure, Instant occurredAt) {
        super(source);
        this.workerId = workerId;
        this.failure = failure;
        this.occurredAt = occurredAt;
    }

    public String getWorkerId() {
        return workerId;
    }

    public QueueInfrastructureException getFailure() {
        return failure;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
