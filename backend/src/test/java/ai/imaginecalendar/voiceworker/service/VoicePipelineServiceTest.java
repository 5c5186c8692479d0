package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.JobStatus;
import ai.imaginecalendar.voiceworker.model.QueueStats;
import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.service.exception.InvalidJobStateException;
import ai.imaginecalendar.voiceworker.service.exception.JobNotFoundException;
import ai.imaginecalendar.voiceworker.service.exception.PayloadValidationException;
import ai.imaginecalendar.voiceworker.service.exception.TransientStageException;
import ai.imaginecalendar.voiceworker.support.PipelineFixtures;
import ai.imaginecalendar.voiceworker.support.PipelineHarness;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class VoicePipelineServiceTest {

    private PipelineHarness harness;
    private VoicePipelineService pipeline;

    @BeforeEach
    void setUp() {
        harness = new PipelineHarness(List.of());
        pipeline = harness.pipeline;
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void ingest_NewMessage_ShouldEnqueueAtWebhookReceived() {
        // When
        String jobId = pipeline.ingest("wamid-1", PipelineFixtures.voiceMessage());

        // Then
        assertThat(harness.jobQueue.queuedIds(Stage.WEBHOOK_RECEIVED)).containsExactly(jobId);
        assertThat(harness.jobQueue.activeJobForMessage("wamid-1")).contains(jobId);
        assertThat(harness.meterRegistry.get("voice_pipeline_jobs_ingested_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void ingest_SameMessageTwice_ShouldReturnExistingJob() {
        String first = pipeline.ingest("wamid-1", PipelineFixtures.voiceMessage());
        String second = pipeline.ingest("wamid-1", PipelineFixtures.voiceMessage());

        assertThat(second).isEqualTo(first);
        assertThat(harness.jobQueue.depth(Stage.WEBHOOK_RECEIVED)).isEqualTo(1);
    }

    @Test
    void ingest_SameMessageConcurrently_ShouldCreateOneJob() throws Exception {
        // Given
        int callers = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        Set<String> jobIds = ConcurrentHashMap.newKeySet();

        // When
        List<Future<String>> futures = IntStream.range(0, callers)
                .mapToObj(i -> executor.submit((Callable<String>) () -> {
                    start.await();
                    String jobId = pipeline.ingest("wamid-1", PipelineFixtures.voiceMessage());
                    jobIds.add(jobId);
                    return jobId;
                }))
                .collect(Collectors.toList());
        start.countDown();
        for (Future<String> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(jobIds).hasSize(1);
        assertThat(harness.jobQueue.depth(Stage.WEBHOOK_RECEIVED)).isEqualTo(1);
        assertThat(harness.jobQueue.activeJobForMessage("wamid-1")).contains(jobIds.iterator().next());
    }

    @Test
    void ingest_PreviousJobDeadLettered_ShouldCreateNewJob() {
        // Given
        String first = pipeline.ingest("wamid-1", PipelineFixtures.voiceMessage());
        JobRecord failed = harness.jobQueue.find(first).orElseThrow();
        harness.deadLetterQueue.moveToDLQ(failed, new PayloadValidationException("no audio"));

        // When
        String second = pipeline.ingest("wamid-1", PipelineFixtures.voiceMessage());

        // Then
        assertThat(second).isNotEqualTo(first);
        assertThat(harness.jobQueue.activeJobForMessage("wamid-1")).contains(second);
    }

    @Test
    void ingest_StaleBindingToTerminalJob_ShouldBeReleased() {
        // Given: a completed job whose binding was never released
        harness.jobQueue.enqueue(PipelineFixtures.job("old", Stage.NOTIFICATION_SEND, PipelineFixtures.applied(),
                harness.clock.instant()), harness.clock.instant());
        JobRecord claimed = harness.jobQueue.dequeue(EnumSet.allOf(Stage.class), Duration.ofSeconds(60)).orElseThrow();
        harness.jobQueue.complete(claimed.toBuilder().status(JobStatus.COMPLETED).build());
        harness.jobQueue.claimMessage("wamid-1", "old");

        // When
        String jobId = pipeline.ingest("wamid-1", PipelineFixtures.voiceMessage());

        // Then
        assertThat(jobId).isNotEqualTo("old");
    }

    @Test
    void ingest_MissingMessageId_ShouldThrow() {
        assertThatThrownBy(() -> pipeline.ingest(" ", PipelineFixtures.voiceMessage()))
                .isInstanceOf(PayloadValidationException.class);
    }

    @Test
    void resumeWithClarification_UnknownJob_ShouldThrowNotFound() {
        assertThatThrownBy(() -> pipeline.resumeWithClarification("missing", "yes"))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void resumeWithClarification_JobNotWaiting_ShouldThrow() {
        String jobId = pipeline.ingest("wamid-1", PipelineFixtures.voiceMessage());

        assertThatThrownBy(() -> pipeline.resumeWithClarification(jobId, "yes"))
                .isInstanceOf(InvalidJobStateException.class);
    }

    @Test
    void resumeWithClarification_BlankReply_ShouldThrowValidation() {
        assertThatThrownBy(() -> pipeline.resumeWithClarification("job-1", ""))
                .isInstanceOf(PayloadValidationException.class);
    }

    @Test
    void getJob_DeadLetteredJob_ShouldFallBackToEntry() {
        JobRecord job = PipelineFixtures.job("job-1", Stage.TRANSCRIPTION, PipelineFixtures.audio(),
                harness.clock.instant()).toBuilder().attemptCount(3).build();
        harness.deadLetterQueue.moveToDLQ(job, new TransientStageException("whisper 503"));

        assertThat(pipeline.getJob("job-1")).map(JobRecord::getStatus).contains(JobStatus.DEAD_LETTERED);
    }

    @Test
    void getQueueStats_ShouldReportEveryStage() {
        pipeline.ingest("wamid-1", PipelineFixtures.voiceMessage());
        pipeline.ingest("wamid-2", PipelineFixtures.voiceMessage());

        QueueStats stats = pipeline.getQueueStats();

        assertThat(stats.getDepthByStage()).hasSize(Stage.values().length);
        assertThat(stats.getDepthByStage().get(Stage.WEBHOOK_RECEIVED)).isEqualTo(2L);
        assertThat(stats.getTotalQueued()).isEqualTo(2L);
        assertThat(stats.getDeadLettered()).isZero();
    }
}
