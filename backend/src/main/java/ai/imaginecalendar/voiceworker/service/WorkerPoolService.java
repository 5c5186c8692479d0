package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.service.queue.JobQueue;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the fixed set of worker slots plus the lock reaper.
 */
@Slf4j
@Service
public class WorkerPoolService {

    private static final long MONITOR_INTERVAL_SECONDS = 30;

    private final StageExecutionService executionService;
    private final JobQueue jobQueue;
    private final PipelineMetricsService metrics;
    private final ApplicationEventPublisher eventPublisher;
    private final PipelineProperties properties;
    private final Clock clock;

    // Worker pool management
    private ScheduledExecutorService schedulerService;
    private final List<PipelineWorker> workers = new CopyOnWriteArrayList<>();
    private final AtomicInteger workerIdCounter = new AtomicInteger(1);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    // Pool statistics
    private volatile boolean poolRunning = false;
    private volatile int totalWorkersCreated = 0;
    private final AtomicLong locksReleased = new AtomicLong(0);

    @Autowired
    public WorkerPoolService(StageExecutionService executionService,
                             JobQueue jobQueue,
                             PipelineMetricsService metrics,
                             ApplicationEventPublisher eventPublisher,
                             PipelineProperties properties,
                             Clock clock) {
        this.executionService = executionService;
        this.jobQueue = jobQueue;
        this.metrics = metrics;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (properties.getWorker().isAutoStart()) {
            start();
        } else {
            log.info("Worker pool auto-start disabled");
        }
    }

    public synchronized void start() {
        if (poolRunning) {
            log.debug("Worker pool already running");
            return;
        }

        int concurrency = properties.getWorker().getConcurrency();
        log.info("Starting worker pool with {} slots", concurrency);

        // +2 for the lock reaper and the monitor
        schedulerService = Executors.newScheduledThreadPool(concurrency + 2);
        for (int i = 0; i < concurrency; i++) {
            startWorker();
        }

        long lockCheckMs = properties.getQueue().getLockCheckInterval().toMillis();
        schedulerService.scheduleWithFixedDelay(this::releaseExpiredLocks, lockCheckMs, lockCheckMs, TimeUnit.MILLISECONDS);
        schedulerService.scheduleWithFixedDelay(this::monitorWorkerPool,
                MONITOR_INTERVAL_SECONDS, MONITOR_INTERVAL_SECONDS, TimeUnit.SECONDS);

        poolRunning = true;
        log.info("Worker pool started successfully with {} workers", workers.size());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!poolRunning) {
            return;
        }
        log.info("Shutting down worker pool...");
        poolRunning = false;

        workers.forEach(PipelineWorker::shutdown);
        workers.clear();

        if (schedulerService != null) {
            schedulerService.shutdown();
            try {
                long timeoutMs = properties.getWorker().getShutdownTimeout().toMillis();
                if (!schedulerService.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                    log.warn("Worker pool shutdown timeout, forcing shutdown");
                    schedulerService.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                schedulerService.shutdownNow();
            }
        }
        log.info("Worker pool shutdown complete");
    }

    /**
     * Stops slots from claiming new jobs; jobs already running finish normally
     */
    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Worker pool paused");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Worker pool resumed");
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    public boolean isRunning() {
        return poolRunning;
    }

    /**
     * Returns jobs with expired visibility locks to their stage queues
     *
     * @return number of jobs released
     */
    public int releaseExpiredLocks() {
        try {
            int released = jobQueue.releaseExpiredLocks(clock.instant());
            if (released > 0) {
                locksReleased.addAndGet(released);
                log.warn("Released {} job(s) whose visibility lock expired", released);
            }
            return released;
        } catch (Exception e) {
            log.error("Lock reaper failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    private void startWorker() {
        PipelineWorker worker = new PipelineWorker(
                "pipeline-worker-" + workerIdCounter.getAndIncrement(),
                executionService,
                metrics,
                eventPublisher,
                paused::get,
                clock,
                properties.getWorker().getInfrastructureBackoff());

        ScheduledFuture<?> workerTask = schedulerService.scheduleWithFixedDelay(
                worker::runCycle,
                0,
                properties.getQueue().getPollInterval().toMillis(),
                TimeUnit.MILLISECONDS);

        worker.setWorkerTask(workerTask);
        workers.add(worker);
        totalWorkersCreated++;
        log.info("Started worker: {}", worker.getWorkerId());
    }

    /**
     * Replaces slots that gave up after repeated unexpected errors
     */
    void monitorWorkerPool() {
        try {
            for (PipelineWorker worker : new ArrayList<>(workers)) {
                if (worker.isFailed()) {
                    log.warn("Worker {} has failed, restarting", worker.getWorkerId());
                    workers.remove(worker);
                    worker.shutdown();
                    startWorker();
                }
            }
            log.debug("Worker pool - slots: {}, paused: {}, in flight: {}",
                    workers.size(), paused.get(), jobQueue.inFlightCount());
        } catch (Exception e) {
            log.error("Error during worker pool monitoring: {}", e.getMessage(), e);
        }
    }

    public WorkerPoolStats getPoolStats() {
        long processed = workers.stream().mapToLong(PipelineWorker::getTotalJobsProcessed).sum();
        long infraFailures = workers.stream().mapToLong(PipelineWorker::getInfrastructureFailures).sum();
        int active = (int) workers.stream().filter(PipelineWorker::isRunning).count();

        return WorkerPoolStats.builder()
                .poolRunning(poolRunning)
                .paused(paused.get())
                .configuredWorkers(properties.getWorker().getConcurrency())
                .activeWorkers(active)
                .totalWorkersCreated(totalWorkersCreated)
                .totalJobsProcessed(processed)
                .infrastructureFailures(infraFailures)
                .locksReleased(locksReleased.get())
                .build();
    }

    /**
     * Worker pool statistics
     */
    @Value
    @Builder
    public static class WorkerPoolStats {
        boolean poolRunning;
        boolean paused;
        int configuredWorkers;
        int activeWorkers;
        int totalWorkersCreated;
        long totalJobsProcessed;
        long infrastructureFailures;
        long locksReleased;
    }
}
