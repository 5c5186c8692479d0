package ai.imaginecalendar.voiceworker.controller;

import ai.imaginecalendar.voiceworker.model.DeadLetterEntry;
import ai.imaginecalendar.voiceworker.model.DeadLetterFilter;
import ai.imaginecalendar.voiceworker.model.ErrorCategory;
import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.QueueStats;
import ai.imaginecalendar.voiceworker.model.dto.ClarificationReplyRequest;
import ai.imaginecalendar.voiceworker.service.DeadLetterQueueService;
import ai.imaginecalendar.voiceworker.service.StageRegistry;
import ai.imaginecalendar.voiceworker.service.VoicePipelineService;
import ai.imaginecalendar.voiceworker.service.WorkerPoolService;
import ai.imaginecalendar.voiceworker.service.exception.InvalidJobStateException;
import ai.imaginecalendar.voiceworker.service.exception.JobNotFoundException;
import ai.imaginecalendar.voiceworker.service.exception.PayloadValidationException;
import ai.imaginecalendar.voiceworker.service.exception.PipelineException;
import ai.imaginecalendar.voiceworker.service.exception.UnknownStageException;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints: queue depth, worker pool control and dead letter handling
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineAdminController {

    private final VoicePipelineService pipelineService;
    private final WorkerPoolService workerPoolService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final StageRegistry stageRegistry;

    @Autowired
    public PipelineAdminController(VoicePipelineService pipelineService,
                                   WorkerPoolService workerPoolService,
                                   DeadLetterQueueService deadLetterQueueService,
                                   StageRegistry stageRegistry) {
        this.pipelineService = pipelineService;
        this.workerPoolService = workerPoolService;
        this.deadLetterQueueService = deadLetterQueueService;
        this.stageRegistry = stageRegistry;
    }

    @GetMapping("/queues")
    public ResponseEntity<QueueStats> getQueueStats() {
        try {
            return ResponseEntity.ok(pipelineService.getQueueStats());
        } catch (Exception e) {
            log.error("Failed to read queue stats: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/workers")
    public ResponseEntity<WorkerPoolService.WorkerPoolStats> getWorkerStats() {
        return ResponseEntity.ok(workerPoolService.getPoolStats());
    }

    @PostMapping("/workers/pause")
    public ResponseEntity<Map<String, Object>> pauseWorkers() {
        workerPoolService.pause();
        return ResponseEntity.ok(Map.of("paused", true));
    }

    @PostMapping("/workers/resume")
    public ResponseEntity<Map<String, Object>> resumeWorkers() {
        workerPoolService.resume();
        return ResponseEntity.ok(Map.of("paused", false));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobRecord> getJob(@PathVariable String jobId) {
        try {
            return pipelineService.getJob(jobId)
                    .map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (Exception e) {
            log.error("Failed to read job {}: {}", jobId, e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/jobs/{jobId}/clarification")
    public ResponseEntity<JobRecord> submitClarification(@PathVariable String jobId,
                                                         @Valid @RequestBody ClarificationReplyRequest request) {
        try {
            return ResponseEntity.ok(pipelineService.resumeWithClarification(jobId, request.getReply()));
        } catch (JobNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (InvalidJobStateException e) {
            log.warn("Rejected clarification for job {}: {}", jobId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        } catch (PayloadValidationException e) {
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            log.error("Failed to resume job {}: {}", jobId, e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/dlq")
    public ResponseEntity<List<DeadLetterEntry>> listDeadLetters(
            @RequestParam(value = "stage", required = false) String stage,
            @RequestParam(value = "category", required = false) ErrorCategory category,
            @RequestParam(value = "messageId", required = false) String messageId,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        try {
            DeadLetterFilter filter = DeadLetterFilter.builder()
                    .stage(stage != null ? stageRegistry.stage(stage) : null)
                    .errorCategory(category)
                    .messageId(messageId)
                    .limit(limit)
                    .build();
            return ResponseEntity.ok(deadLetterQueueService.listDLQ(filter));
        } catch (UnknownStageException e) {
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            log.error("Failed to list dead letters: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/dlq/{entryId}")
    public ResponseEntity<DeadLetterEntry> inspectDeadLetter(@PathVariable String entryId) {
        return deadLetterQueueService.inspect(entryId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/dlq/{entryId}/requeue")
    public ResponseEntity<JobRecord> requeueDeadLetter(@PathVariable String entryId) {
        try {
            JobRecord job = deadLetterQueueService.requeue(entryId);
            log.info("Operator requeued dead letter {}", entryId);
            return ResponseEntity.ok(job);
        } catch (JobNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (InvalidJobStateException e) {
            log.warn("Rejected requeue of {}: {}", entryId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        } catch (PipelineException e) {
            log.error("Failed to requeue dead letter {}: {}", entryId, e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @DeleteMapping("/dlq/{entryId}")
    public ResponseEntity<Void> deleteDeadLetter(@PathVariable String entryId) {
        return deadLetterQueueService.delete(entryId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * Deletes dead letters older than the given age, e.g. {@code ?olderThan=7d}
     */
    @PostMapping("/dlq/purge")
    public ResponseEntity<Map<String, Object>> purgeDeadLetters(@RequestParam("olderThan") Duration olderThan) {
        int purged = deadLetterQueueService.purgeOlderThan(olderThan);
        return ResponseEntity.ok(Map.of("purged", purged, "olderThan", olderThan.toString()));
    }
}
