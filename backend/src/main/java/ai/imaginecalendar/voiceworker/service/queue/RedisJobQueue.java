package ai.imaginecalendar.voiceworker.service.queue;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.JobStatus;
import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.service.exception.QueueInfrastructureException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis-backed job queue.
 *
 * <p>Layout (all keys under the configured prefix):
 * <ul>
 *   <li>{@code jobs:{id}} - job record as JSON</li>
 *   <li>{@code queue:{stage}} - sorted set of job ids scored by not-before epoch millis</li>
 *   <li>{@code inflight} - sorted set of locked job ids scored by lock expiry</li>
 *   <li>{@code locks} - hash of job id to the token of the current lock</li>
 *   <li>{@code awaiting} - sorted set of parked job ids scored by parking time</li>
 *   <li>{@code messages:{messageId}} - id of the active job for a message</li>
 * </ul>
 * Every move between these keys runs as one Lua script, so a connection
 * failure half way through cannot leave a job outside all of them.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisJobQueue implements JobQueue {

    private static final String JOB_KEY = "jobs:";
    private static final String QUEUE_KEY = "queue:";
    private static final String INFLIGHT_KEY = "inflight";
    private static final String LOCKS_KEY = "locks";
    private static final String AWAITING_KEY = "awaiting";
    private static final String MESSAGE_KEY = "messages:";

    private static final String NO_VALUE = "";

    /**
     * Moves a job from its stage queue into the in-flight set if its record is
     * still the one the caller read.
     * Returns 1 when claimed, 0 when another worker took it, -1 when the record changed.
     *
     * KEYS[1] = stage queue, KEYS[2] = inflight, KEYS[3] = locks, KEYS[4] = job record
     * ARGV[1] = job id, ARGV[2] = record as read, ARGV[3] = claimed record,
     * ARGV[4] = lock expiry, ARGV[5] = lock token
     */
    static final RedisScript<Long> CLAIM_SCRIPT = new DefaultRedisScript<>("""
            if (redis.call('get', KEYS[4]) or '') ~= ARGV[2] then
                return -1
            end
            if redis.call('zrem', KEYS[1], ARGV[1]) == 0 then
                return 0
            end
            redis.call('zadd', KEYS[2], ARGV[4], ARGV[1])
            redis.call('hset', KEYS[3], ARGV[1], ARGV[5])
            redis.call('set', KEYS[4], ARGV[3])
            return 1
            """, Long.class);

    /**
     * Drops a stale queue entry unless the record changed since it was read.
     *
     * KEYS[1] = stage queue, KEYS[2] = job record
     * ARGV[1] = job id, ARGV[2] = record as read
     */
    static final RedisScript<Long> DISCARD_SCRIPT = new DefaultRedisScript<>("""
            if (redis.call('get', KEYS[2]) or '') ~= ARGV[2] then
                return 0
            end
            return redis.call('zrem', KEYS[1], ARGV[1])
            """, Long.class);

    /**
     * Runs a write on behalf of the lock owner. Returns 0 without writing
     * anything if the token no longer matches.
     *
     * KEYS[1] = inflight, KEYS[2] = locks, KEYS[3] = job record, KEYS[4] = optional target set
     * ARGV[1] = job id, ARGV[2] = token, ARGV[3] = record or '', ARGV[4] = target score,
     * ARGV[5] = record ttl millis or 0, ARGV[6] = 1 to keep the lock
     */
    static final RedisScript<Long> OWNER_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('hget', KEYS[2], ARGV[1]) ~= ARGV[2] then
                return 0
            end
            if ARGV[3] ~= '' then
                if tonumber(ARGV[5]) > 0 then
                    redis.call('set', KEYS[3], ARGV[3], 'px', ARGV[5])
                else
                    redis.call('set', KEYS[3], ARGV[3])
                end
            end
            if #KEYS > 3 then
                redis.call('zadd', KEYS[4], ARGV[4], ARGV[1])
            end
            if ARGV[6] ~= '1' then
                redis.call('zrem', KEYS[1], ARGV[1])
                redis.call('hdel', KEYS[2], ARGV[1])
            end
            return 1
            """, Long.class);

    /**
     * Returns a job with an expired lock to its stage queue.
     * Returns 1 when released, 0 when the lock is gone or not yet due, -1 when the record changed.
     *
     * KEYS[1] = inflight, KEYS[2] = locks, KEYS[3] = job record, KEYS[4] = optional stage queue
     * ARGV[1] = job id, ARGV[2] = now, ARGV[3] = record as read, ARGV[4] = redelivered record or ''
     */
    static final RedisScript<Long> REAP_SCRIPT = new DefaultRedisScript<>("""
            local expiry = redis.call('zscore', KEYS[1], ARGV[1])
            if not expiry or tonumber(expiry) > tonumber(ARGV[2]) then
                return 0
            end
            if (redis.call('get', KEYS[3]) or '') ~= ARGV[3] then
                return -1
            end
            redis.call('zrem', KEYS[1], ARGV[1])
            redis.call('hdel', KEYS[2], ARGV[1])
            if ARGV[4] ~= '' then
                redis.call('set', KEYS[3], ARGV[4])
                redis.call('zadd', KEYS[4], ARGV[2], ARGV[1])
            end
            return 1
            """, Long.class);

    /**
     * Acts on a parked job only while it is still in the awaiting set.
     *
     * KEYS[1] = awaiting, KEYS[2] = job record, KEYS[3] = stage queue (unpark only)
     * ARGV[1] = job id, ARGV[2] = record, ARGV[3] = update | archive | unpark,
     * ARGV[4] = ttl millis (archive) or queue score (unpark)
     */
    static final RedisScript<Long> PARKED_SCRIPT = new DefaultRedisScript<>("""
            if not redis.call('zscore', KEYS[1], ARGV[1]) then
                return 0
            end
            if ARGV[3] == 'update' then
                redis.call('set', KEYS[2], ARGV[2])
                return 1
            end
            redis.call('zrem', KEYS[1], ARGV[1])
            if ARGV[3] == 'archive' then
                redis.call('set', KEYS[2], ARGV[2], 'px', ARGV[4])
            else
                redis.call('set', KEYS[2], ARGV[2])
                redis.call('zadd', KEYS[3], ARGV[4], ARGV[1])
            end
            return 1
            """, Long.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration completedRetention;

    @Autowired
    public RedisJobQueue(@Qualifier("pipelineRedisTemplate") RedisTemplate<String, String> redisTemplate,
                         ObjectMapper objectMapper,
                         PipelineProperties properties,
                         Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = properties.getQueue().getKeyPrefix() + ":";
        this.completedRetention = properties.getQueue().getCompletedRetention();
    }

    @Override
    public void enqueue(JobRecord job, Instant notBefore) {
        execute("enqueue job " + job.getJobId(), () -> {
            writeRecord(job.toBuilder().lockToken(null).build());
            redisTemplate.opsForZSet().add(queueKey(job.getStage()), job.getJobId(), notBefore.toEpochMilli());
            return null;
        });
    }

    @Override
    public Optional<JobRecord> dequeue(Collection<Stage> eligibleStages, Duration lockDuration) {
        return execute("dequeue", () -> {
            Instant now = clock.instant();
            while (true) {
                Stage bestStage = null;
                String bestId = null;
                double bestScore = Double.MAX_VALUE;

                for (Stage stage : eligibleStages) {
                    Set<ZSetOperations.TypedTuple<String>> head = redisTemplate.opsForZSet()
                            .rangeByScoreWithScores(queueKey(stage), 0, now.toEpochMilli(), 0, 1);
                    if (head == null || head.isEmpty()) {
                        continue;
                    }
                    ZSetOperations.TypedTuple<String> candidate = head.iterator().next();
                    if (candidate.getScore() != null && candidate.getScore() < bestScore) {
                        bestScore = candidate.getScore();
                        bestId = candidate.getValue();
                        bestStage = stage;
                    }
                }
                if (bestId == null) {
                    return Optional.empty();
                }

                String raw = redisTemplate.opsForValue().get(jobKey(bestId));
                JobRecord record = parse(bestId, raw);
                if (record == null || record.getStage() != bestStage || record.isTerminal()) {
                    log.debug("Discarding stale queue entry {} at stage {}", bestId, bestStage.getValue());
                    runScript(DISCARD_SCRIPT, List.of(queueKey(bestStage), jobKey(bestId)),
                            bestId, orEmpty(raw));
                    continue;
                }

                String token = UUID.randomUUID().toString();
                JobRecord claimed = record.toBuilder()
                        .status(JobStatus.PROCESSING)
                        .lockToken(token)
                        .updatedAt(now)
                        .build();
                long outcome = runScript(CLAIM_SCRIPT,
                        List.of(queueKey(bestStage), key(INFLIGHT_KEY), key(LOCKS_KEY), jobKey(bestId)),
                        bestId, raw, toJson(claimed), millis(now.plus(lockDuration)), token);
                if (outcome == 1) {
                    return Optional.of(claimed);
                }
                // another worker claimed it first, or the record moved on; look again
            }
        });
    }

    @Override
    public boolean holdsLock(JobRecord claimed) {
        return execute("read lock of job " + claimed.getJobId(), () -> {
            Object token = redisTemplate.opsForHash().get(key(LOCKS_KEY), claimed.getJobId());
            return token != null && Objects.equals(token, claimed.getLockToken());
        });
    }

    @Override
    public boolean ack(JobRecord claimed) {
        return execute("ack job " + claimed.getJobId(), () ->
                ownerWrite(claimed, NO_VALUE, null, 0, 0, false));
    }

    @Override
    public boolean update(JobRecord claimed) {
        return execute("update job " + claimed.getJobId(), () ->
                ownerWrite(claimed, toJson(claimed), null, 0, 0, true));
    }

    @Override
    public boolean release(JobRecord claimed, Instant notBefore) {
        return execute("release job " + claimed.getJobId(), () -> {
            JobRecord queued = claimed.toBuilder().status(JobStatus.QUEUED).lockToken(null).build();
            return ownerWrite(claimed, toJson(queued), queueKey(claimed.getStage()),
                    notBefore.toEpochMilli(), 0, false);
        });
    }

    @Override
    public boolean park(JobRecord claimed) {
        return execute("park job " + claimed.getJobId(), () -> {
            Instant since = claimed.getAwaitingSince() != null ? claimed.getAwaitingSince() : clock.instant();
            return ownerWrite(claimed, toJson(claimed.toBuilder().lockToken(null).build()), key(AWAITING_KEY),
                    since.toEpochMilli(), 0, false);
        });
    }

    @Override
    public boolean complete(JobRecord claimed) {
        return execute("complete job " + claimed.getJobId(), () ->
                ownerWrite(claimed, toJson(claimed.toBuilder().lockToken(null).build()), null,
                        0, completedRetention.toMillis(), false));
    }

    @Override
    public int releaseExpiredLocks(Instant now) {
        return execute("release expired locks", () -> {
            Set<String> expired = redisTemplate.opsForZSet().rangeByScore(key(INFLIGHT_KEY), 0, now.toEpochMilli());
            if (expired == null || expired.isEmpty()) {
                return 0;
            }

            int released = 0;
            for (String jobId : expired) {
                String raw = redisTemplate.opsForValue().get(jobKey(jobId));
                JobRecord record = parse(jobId, raw);
                List<String> keys = new ArrayList<>(List.of(key(INFLIGHT_KEY), key(LOCKS_KEY), jobKey(jobId)));
                String redelivered = NO_VALUE;
                if (record != null) {
                    keys.add(queueKey(record.getStage()));
                    redelivered = toJson(record.toBuilder()
                            .status(JobStatus.QUEUED)
                            .redelivered(true)
                            .lockToken(null)
                            .updatedAt(now)
                            .build());
                } else {
                    log.warn("Lock expired for job {} but its record is gone or unreadable", jobId);
                }
                long outcome = runScript(REAP_SCRIPT, keys, jobId, millis(now), orEmpty(raw), redelivered);
                if (outcome == 1 && record != null) {
                    released++;
                } else if (outcome == -1) {
                    log.debug("Job {} changed while its expired lock was being released; next run retries", jobId);
                }
            }
            return released;
        });
    }

    @Override
    public long depth(Stage stage) {
        return execute("read depth of " + stage.getValue(), () -> zCard(queueKey(stage)));
    }

    @Override
    public long inFlightCount() {
        return execute("read in-flight count", () -> zCard(key(INFLIGHT_KEY)));
    }

    @Override
    public boolean updateParked(JobRecord job) {
        return execute("update parked job " + job.getJobId(), () ->
                runScript(PARKED_SCRIPT, List.of(key(AWAITING_KEY), jobKey(job.getJobId())),
                        job.getJobId(), toJson(job), "update", "0") == 1);
    }

    @Override
    public boolean unpark(JobRecord job) {
        return execute("unpark job " + job.getJobId(), () ->
                runScript(PARKED_SCRIPT,
                        List.of(key(AWAITING_KEY), jobKey(job.getJobId()), queueKey(job.getStage())),
                        job.getJobId(), toJson(job), "unpark", millis(clock.instant())) == 1);
    }

    @Override
    public boolean archiveParked(JobRecord job) {
        return execute("archive parked job " + job.getJobId(), () ->
                runScript(PARKED_SCRIPT, List.of(key(AWAITING_KEY), jobKey(job.getJobId())),
                        job.getJobId(), toJson(job), "archive", String.valueOf(completedRetention.toMillis())) == 1);
    }

    @Override
    public List<JobRecord> parked() {
        return execute("list parked jobs", () -> {
            Set<String> ids = redisTemplate.opsForZSet().range(key(AWAITING_KEY), 0, -1);
            if (ids == null || ids.isEmpty()) {
                return Collections.emptyList();
            }
            List<JobRecord> jobs = new ArrayList<>(ids.size());
            for (String id : ids) {
                JobRecord record = readRecord(id);
                if (record != null) {
                    jobs.add(record);
                }
            }
            return jobs;
        });
    }

    @Override
    public long parkedCount() {
        return execute("read parked count", () -> zCard(key(AWAITING_KEY)));
    }

    @Override
    public void remove(String jobId) {
        execute("remove job " + jobId, () -> {
            for (Stage stage : Stage.values()) {
                redisTemplate.opsForZSet().remove(queueKey(stage), jobId);
            }
            redisTemplate.opsForZSet().remove(key(INFLIGHT_KEY), jobId);
            redisTemplate.opsForHash().delete(key(LOCKS_KEY), jobId);
            redisTemplate.opsForZSet().remove(key(AWAITING_KEY), jobId);
            redisTemplate.delete(jobKey(jobId));
            return null;
        });
    }

    @Override
    public Optional<JobRecord> find(String jobId) {
        return execute("read job " + jobId, () -> Optional.ofNullable(readRecord(jobId)));
    }

    @Override
    public boolean claimMessage(String messageId, String jobId) {
        return execute("claim message " + messageId, () ->
                Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(messageKey(messageId), jobId)));
    }

    @Override
    public Optional<String> activeJobForMessage(String messageId) {
        return execute("read message " + messageId, () ->
                Optional.ofNullable(redisTemplate.opsForValue().get(messageKey(messageId))));
    }

    @Override
    public void releaseMessage(String messageId, String jobId) {
        execute("release message " + messageId, () -> {
            String current = redisTemplate.opsForValue().get(messageKey(messageId));
            if (Objects.equals(current, jobId)) {
                redisTemplate.delete(messageKey(messageId));
            }
            return null;
        });
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return pong != null;
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean ownerWrite(JobRecord claimed, String json, String targetKey, long score,
                               long ttlMillis, boolean keepLock) {
        if (claimed.getLockToken() == null) {
            return false;
        }
        List<String> keys = new ArrayList<>(List.of(key(INFLIGHT_KEY), key(LOCKS_KEY), jobKey(claimed.getJobId())));
        if (targetKey != null) {
            keys.add(targetKey);
        }
        return runScript(OWNER_SCRIPT, keys, claimed.getJobId(), claimed.getLockToken(), json,
                String.valueOf(score), String.valueOf(ttlMillis), keepLock ? "1" : "0") == 1;
    }

    private long runScript(RedisScript<Long> script, List<String> keys, Object... args) {
        Long result = redisTemplate.execute(script, keys, args);
        return result != null ? result : 0L;
    }

    private void writeRecord(JobRecord job) {
        redisTemplate.opsForValue().set(jobKey(job.getJobId()), toJson(job));
    }

    private JobRecord readRecord(String jobId) {
        return parse(jobId, redisTemplate.opsForValue().get(jobKey(jobId)));
    }

    private JobRecord parse(String jobId, String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, JobRecord.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize job {}: {}", jobId, e.getMessage(), e);
            return null;
        }
    }

    private String toJson(JobRecord job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + job.getJobId(), e);
        }
    }

    private long zCard(String key) {
        Long size = redisTemplate.opsForZSet().zCard(key);
        return size != null ? size : 0L;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Redis failure during {}: {}", operation, e.getMessage(), e);
            throw new QueueInfrastructureException("Queue store unavailable during " + operation, e);
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : NO_VALUE;
    }

    private static String millis(Instant instant) {
        return String.valueOf(instant.toEpochMilli());
    }

    private String key(String suffix) {
        return keyPrefix + suffix;
    }

    private String jobKey(String jobId) {
        return keyPrefix + JOB_KEY + jobId;
    }

    private String queueKey(Stage stage) {
        return keyPrefix + QUEUE_KEY + stage.getValue();
    }

    private String messageKey(String messageId) {
        return keyPrefix + MESSAGE_KEY + messageId;
    }
}
