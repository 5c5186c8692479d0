package ai.imaginecalendar.voiceworker.service.queue;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.model.DeadLetterEntry;
import ai.imaginecalendar.voiceworker.service.exception.QueueInfrastructureException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Dead letter entries in a Redis hash ({@code dlq:entries}) with a sorted
 * index by failure time ({@code dlq:index}).
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisDeadLetterStore implements DeadLetterStore {

    private static final String ENTRIES_KEY = "dlq:entries";
    private static final String INDEX_KEY = "dlq:index";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String entriesKey;
    private final String indexKey;

    @Autowired
    public RedisDeadLetterStore(@Qualifier("pipelineRedisTemplate") RedisTemplate<String, String> redisTemplate,
                                ObjectMapper objectMapper,
                                PipelineProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        String prefix = properties.getQueue().getKeyPrefix() + ":";
        this.entriesKey = prefix + ENTRIES_KEY;
        this.indexKey = prefix + INDEX_KEY;
    }

    @Override
    public boolean putIfAbsent(DeadLetterEntry entry) {
        return execute("store dead letter " + entry.getEntryId(), () -> {
            Boolean stored = redisTemplate.opsForHash().putIfAbsent(entriesKey, entry.getEntryId(), toJson(entry));
            if (Boolean.TRUE.equals(stored)) {
                redisTemplate.opsForZSet().add(indexKey, entry.getEntryId(), entry.getFailedAt().toEpochMilli());
                return true;
            }
            return false;
        });
    }

    @Override
    public Optional<DeadLetterEntry> get(String entryId) {
        return execute("read dead letter " + entryId, () -> Optional.ofNullable(read(entryId)));
    }

    @Override
    public List<DeadLetterEntry> listNewestFirst() {
        return execute("list dead letters", () -> {
            Set<String> ids = redisTemplate.opsForZSet().reverseRange(indexKey, 0, -1);
            if (ids == null || ids.isEmpty()) {
                return Collections.emptyList();
            }
            List<DeadLetterEntry> entries = new ArrayList<>(ids.size());
            for (String id : ids) {
                DeadLetterEntry entry = read(id);
                if (entry != null) {
                    entries.add(entry);
                }
            }
            return entries;
        });
    }

    @Override
    public boolean delete(String entryId) {
        return execute("delete dead letter " + entryId, () -> {
            Long removed = redisTemplate.opsForHash().delete(entriesKey, entryId);
            redisTemplate.opsForZSet().remove(indexKey, entryId);
            return removed != null && removed > 0;
        });
    }

    @Override
    public List<String> idsFailedBefore(Instant cutoff) {
        return execute("scan dead letters", () -> {
            // rangeByScore is inclusive; step back one milli to keep the cutoff exclusive
            Set<String> ids = redisTemplate.opsForZSet().rangeByScore(indexKey, 0, cutoff.toEpochMilli() - 1);
            return ids == null ? Collections.<String>emptyList() : new ArrayList<>(ids);
        });
    }

    @Override
    public long size() {
        return execute("count dead letters", () -> {
            Long size = redisTemplate.opsForHash().size(entriesKey);
            return size != null ? size : 0L;
        });
    }

    private DeadLetterEntry read(String entryId) {
        Object json = redisTemplate.opsForHash().get(entriesKey, entryId);
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json.toString(), DeadLetterEntry.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize dead letter {}: {}", entryId, e.getMessage(), e);
            return null;
        }
    }

    private String toJson(DeadLetterEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize dead letter " + entry.getEntryId(), e);
        }
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Redis failure during {}: {}", operation, e.getMessage(), e);
            throw new QueueInfrastructureException("Dead letter store unavailable during " + operation, e);
        }
    }
}
