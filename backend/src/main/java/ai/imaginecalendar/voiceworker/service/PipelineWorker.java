package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.service.exception.QueueInfrastructureException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * One execution slot of the worker pool.
 *
 * <p>{@link #runCycle()} is scheduled with a fixed delay equal to the poll
 * interval; each run drains ready jobs one at a time and returns as soon as
 * the queue is empty, so an idle slot polls instead of blocking.
 */
@Slf4j
public class PipelineWorker {

    private static final int MAX_CONSECUTIVE_FAILURES = 5;

    private final String workerId;
    private final StageExecutionService executionService;
    private final PipelineMetricsService metrics;
    private final ApplicationEventPublisher eventPublisher;
    private final BooleanSupplier paused;
    private final Clock clock;
    private final Duration infrastructureBackoff;

    // Worker state management
    private final AtomicBoolean isRunning = new AtomicBoolean(true);
    private final AtomicBoolean isFailed = new AtomicBoolean(false);
    private ScheduledFuture<?> workerTask;

    // Statistics
    private final AtomicLong totalJobsProcessed = new AtomicLong(0);
    private final AtomicLong infrastructureFailures = new AtomicLong(0);
    private volatile Instant lastProcessingTime;
    private volatile Instant backoffUntil;
    private volatile int consecutiveFailures = 0;

    public PipelineWorker(String workerId,
                          StageExecutionService executionService,
                          PipelineMetricsService metrics,
                          ApplicationEventPublisher eventPublisher,
                          BooleanSupplier paused,
                          Clock clock,
                          Duration infrastructureBackoff) {
        this.workerId = workerId;
        this.executionService = executionService;
        this.metrics = metrics;
        this.eventPublisher = eventPublisher;
        this.paused = paused;
        this.clock = clock;
        this.infrastructureBackoff = infrastructureBackoff;
        log.info("PipelineWorker {} initialized", workerId);
    }

    /**
     * Processes ready jobs until the queue is empty, the pool is paused or the slot is stopped
     */
    public void runCycle() {
        while (isRunning.get() && !isFailed.get() && !paused.getAsBoolean() && !inBackoff()) {
            lastProcessingTime = clock.instant();
            try {
                if (!executionService.processNext(workerId)) {
                    return;
                }
                totalJobsProcessed.incrementAndGet();
                resetFailureCounter();
            } catch (QueueInfrastructureException e) {
                handleInfrastructureFailure(e);
                return;
            } catch (Exception e) {
                handleWorkerError(e);
                return;
            } catch (Error e) {
                // the scheduler stops re-running a task that throws, so hand the slot to the monitor
                log.error("Worker {} hit a fatal error, marking as failed: {}", workerId, e.toString(), e);
                isFailed.set(true);
                isRunning.set(false);
                return;
            }
        }
    }

    private boolean inBackoff() {
        Instant until = backoffUntil;
        return until != null && clock.instant().isBefore(until);
    }

    private void handleInfrastructureFailure(QueueInfrastructureException e) {
        infrastructureFailures.incrementAndGet();
        metrics.recordInfrastructureFailure();
        backoffUntil = clock.instant().plus(infrastructureBackoff);
        log.error("Worker {} cannot reach the queue store, pausing for {}ms: {}",
                workerId, infrastructureBackoff.toMillis(), e.getMessage(), e);
        eventPublisher.publishEvent(new QueueInfrastructureFailureEvent(this, workerId, e, clock.instant()));
    }

    /**
     * Handle worker-level errors
     */
    private void handleWorkerError(Exception e) {
        log.error("Worker {} encountered error: {}", workerId, e.getMessage(), e);
        consecutiveFailures++;
        if (consecutiveFailures >= MAX_CONSECUTIVE_FAILURES) {
            log.error("Worker {} failed {} consecutive times, marking as failed", workerId, consecutiveFailures);
            isFailed.set(true);
            isRunning.set(false);
        }
    }

    private void resetFailureCounter() {
        if (consecutiveFailures > 0) {
            log.debug("Worker {} - Resetting failure counter after successful processing", workerId);
            consecutiveFailures = 0;
        }
    }

    public void shutdown() {
        log.info("Shutting down worker {}", workerId);
        isRunning.set(false);

        if (workerTask != null && !workerTask.isCancelled()) {
            workerTask.cancel(false);
        }
    }

    // Getters for monitoring
    public String getWorkerId() { return workerId; }
    public boolean isRunning() { return isRunning.get(); }
    public boolean isFailed() { return isFailed.get(); }
    public long getTotalJobsProcessed() { return totalJobsProcessed.get(); }
    public long getInfrastructureFailures() { return infrastructureFailures.get(); }
    public Instant getLastProcessingTime() { return lastProcessingTime; }
    public int getConsecutiveFailures() { return consecutiveFailures; }

    public void setWorkerTask(ScheduledFuture<?> workerTask) {
        this.workerTask = workerTask;
    }
}
