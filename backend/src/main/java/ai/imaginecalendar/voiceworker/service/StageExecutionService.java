package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.model.ErrorCategory;
import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.JobStatus;
import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.service.exception.HandlerTimeoutException;
import ai.imaginecalendar.voiceworker.service.exception.LockExpiredException;
import ai.imaginecalendar.voiceworker.service.exception.PayloadValidationException;
import ai.imaginecalendar.voiceworker.service.exception.PermanentStageException;
import ai.imaginecalendar.voiceworker.service.exception.PipelineException;
import ai.imaginecalendar.voiceworker.service.exception.QueueInfrastructureException;
import ai.imaginecalendar.voiceworker.service.exception.TransientStageException;
import ai.imaginecalendar.voiceworker.service.handler.StageHandler;
import ai.imaginecalendar.voiceworker.service.handler.StageHandlerRegistry;
import ai.imaginecalendar.voiceworker.service.handler.StageResult;
import ai.imaginecalendar.voiceworker.service.queue.JobQueue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One worker cycle: claim a job, run its stage handler under a deadline and
 * route the outcome (advance, retry with backoff, or dead-letter).
 *
 * <p>Stateless and shared by all worker slots; the queue's visibility lock
 * guarantees that a job has a single owner at a time.
 */
@Slf4j
@Service
public class StageExecutionService {

    private final JobQueue jobQueue;
    private final StageRegistry stageRegistry;
    private final StageHandlerRegistry handlerRegistry;
    private final JobLifecycleService lifecycle;
    private final RetryPolicy retryPolicy;
    private final DeadLetterQueueService deadLetterQueue;
    private final ErrorClassificationService errorClassificationService;
    private final StageConcurrencyLimiter limiter;
    private final PipelineMetricsService metrics;
    private final ExecutorService handlerExecutor;
    private final Clock clock;
    private final Duration lockDuration;
    private final Duration handlerTimeout;

    @Autowired
    public StageExecutionService(JobQueue jobQueue,
                                 StageRegistry stageRegistry,
                                 StageHandlerRegistry handlerRegistry,
                                 JobLifecycleService lifecycle,
                                 RetryPolicy retryPolicy,
                                 DeadLetterQueueService deadLetterQueue,
                                 ErrorClassificationService errorClassificationService,
                                 StageConcurrencyLimiter limiter,
                                 PipelineMetricsService metrics,
                                 @Qualifier("stageHandlerExecutor") ExecutorService handlerExecutor,
                                 PipelineProperties properties,
                                 Clock clock) {
        this.jobQueue = jobQueue;
        this.stageRegistry = stageRegistry;
        this.handlerRegistry = handlerRegistry;
        this.lifecycle = lifecycle;
        this.retryPolicy = retryPolicy;
        this.deadLetterQueue = deadLetterQueue;
        this.errorClassificationService = errorClassificationService;
        this.limiter = limiter;
        this.metrics = metrics;
        this.handlerExecutor = handlerExecutor;
        this.clock = clock;
        this.lockDuration = properties.getQueue().getLockDuration();
        this.handlerTimeout = properties.getWorker().getHandlerTimeout();
    }

    /**
     * Runs one cycle without blocking on an empty queue.
     *
     * @return true if a job was claimed and handled
     * @throws QueueInfrastructureException if the queue store is unreachable
     */
    public boolean processNext(String workerId) {
        Optional<JobRecord> next = jobQueue.dequeue(limiter.eligibleStages(), lockDuration);
        if (next.isEmpty()) {
            return false;
        }

        JobRecord job = next.get();
        Stage stage = job.getStage();
        if (!limiter.tryAcquire(stage)) {
            // another slot took the last permit for this stage in the meantime
            jobQueue.release(job, clock.instant());
            return false;
        }

        try {
            process(workerId, job);
        } finally {
            limiter.release(stage);
        }
        return true;
    }

    private void process(String workerId, JobRecord claimed) {
        JobRecord job = claimed;
        log.debug("Worker {} claimed job {} (message {}) at stage {}",
                workerId, job.getJobId(), job.getMessageId(), job.getStage().getValue());

        if (job.isRedelivered()) {
            metrics.recordRedelivery();
            LockExpiredException lost = new LockExpiredException(job.getJobId(), lockDuration);
            job = lifecycle.recordFailure(job, lost);
            log.warn("Worker {} - job {} at stage {} was redelivered, counting lost attempt {}/{}",
                    workerId, job.getJobId(), job.getStage().getValue(), job.getAttemptCount(), job.getMaxAttempts());
            if (!retryPolicy.shouldRetry(job)) {
                deadLetter(workerId, job, lost);
                return;
            }
            if (!jobQueue.update(job)) {
                logLostLock(workerId, job);
                return;
            }
        }

        if (!stageRegistry.accepts(job.getStage(), job.getPayload())) {
            handleFailure(workerId, job, new PayloadValidationException(String.format(
                    "Stage %s does not accept payload %s", job.getStage().getValue(),
                    job.getPayload() == null ? "null" : job.getPayload().getClass().getSimpleName())));
            return;
        }

        long startNanos = System.nanoTime();
        StageResult result;
        try {
            StageHandler handler = handlerRegistry.resolve(job.getStage());
            result = invokeWithDeadline(handler, job);
            if (result == null) {
                throw new PermanentStageException("Handler for " + job.getStage().getValue() + " returned no result");
            }
        } catch (QueueInfrastructureException e) {
            throw e;
        } catch (HandlerTimeoutException e) {
            metrics.recordStageExecution(job.getStage(), PipelineMetricsService.OUTCOME_TIMEOUT, elapsedSince(startNanos));
            handleFailure(workerId, job, e);
            return;
        } catch (RuntimeException e) {
            metrics.recordStageExecution(job.getStage(), PipelineMetricsService.OUTCOME_FAILURE, elapsedSince(startNanos));
            handleFailure(workerId, job, e);
            return;
        }

        if (!result.isSuccess()) {
            metrics.recordStageExecution(job.getStage(), PipelineMetricsService.OUTCOME_FAILURE, elapsedSince(startNanos));
            PipelineException error = result.getError() != null
                    ? result.getError()
                    : new TransientStageException("Handler reported failure without an error");
            handleFailure(workerId, job, error);
            return;
        }

        metrics.recordStageExecution(job.getStage(), PipelineMetricsService.OUTCOME_SUCCESS, elapsedSince(startNanos));
        handleSuccess(workerId, job, result);
    }

    private StageResult invokeWithDeadline(StageHandler handler, JobRecord job) {
        Future<StageResult> future = handlerExecutor.submit(() -> handler.handle(job));
        try {
            return future.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // best effort, the lock expiry path covers a handler that ignores interruption
            future.cancel(true);
            throw new HandlerTimeoutException(job.getStage(), handlerTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            // an Error stays confined to the handler thread and counts as a failed attempt
            throw new TransientStageException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransientStageException("Interrupted while waiting for stage handler", e);
        }
    }

    private void handleSuccess(String workerId, JobRecord job, StageResult result) {
        JobRecord next;
        try {
            next = lifecycle.advance(job, result.getPayload(), result.getRoute());
        } catch (PayloadValidationException e) {
            handleFailure(workerId, job, e);
            return;
        }

        if (next.getStatus() == JobStatus.COMPLETED) {
            if (!jobQueue.complete(next)) {
                logLostLock(workerId, job);
                return;
            }
            jobQueue.releaseMessage(next.getMessageId(), next.getJobId());
            metrics.recordCompleted();
            log.info("Job {} (message {}) completed after stage {}",
                    next.getJobId(), next.getMessageId(), job.getStage().getValue());
        } else if (next.getStage() == Stage.CLARIFICATION_RESPONSE) {
            if (!jobQueue.park(lifecycle.awaitInput(next))) {
                logLostLock(workerId, job);
                return;
            }
            log.info("Job {} (message {}) is awaiting a clarification reply",
                    next.getJobId(), next.getMessageId());
        } else {
            if (!jobQueue.release(next, clock.instant())) {
                logLostLock(workerId, job);
                return;
            }
            log.info("Job {} (message {}) advanced {} -> {}", next.getJobId(), next.getMessageId(),
                    job.getStage().getValue(), next.getStage().getValue());
        }
    }

    private void handleFailure(String workerId, JobRecord job, RuntimeException error) {
        if (error instanceof QueueInfrastructureException) {
            throw error;
        }

        ErrorCategory category = errorClassificationService.classify(error);
        JobRecord failed = lifecycle.recordFailure(job, error);

        if (!retryPolicy.isRetryable(category) || !retryPolicy.shouldRetry(failed)) {
            deadLetter(workerId, failed, error);
            return;
        }

        Duration delay = retryPolicy.backoffDelay(failed.getStage(), failed.getAttemptCount());
        if (!jobQueue.release(failed, clock.instant().plus(delay))) {
            logLostLock(workerId, failed);
            return;
        }
        metrics.recordRetry(failed.getStage());
        log.warn("Worker {} - job {} failed at stage {} (attempt {}/{}), retrying in {}ms: {}",
                workerId, failed.getJobId(), failed.getStage().getValue(), failed.getAttemptCount(),
                failed.getMaxAttempts(), delay.toMillis(), error.getMessage());
    }

    private void deadLetter(String workerId, JobRecord job, Throwable error) {
        if (!jobQueue.holdsLock(job)) {
            logLostLock(workerId, job);
            return;
        }
        deadLetterQueue.moveToDLQ(job, error);
    }

    private void logLostLock(String workerId, JobRecord job) {
        log.warn("Worker {} - lock on job {} at stage {} was lost before the outcome was stored; "
                + "the outcome is dropped and the stage runs again", workerId, job.getJobId(), job.getStage().getValue());
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
