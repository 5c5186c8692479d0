package ai.imaginecalendar.voiceworker.service.queue;

import ai.imaginecalendar.voiceworker.model.DeadLetterEntry;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Service
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "false")
public class InMemoryDeadLetterStore implements DeadLetterStore {

    private final Map<String, DeadLetterEntry> entries = new ConcurrentHashMap<>();

    @Override
    public boolean putIfAbsent(DeadLetterEntry entry) {
        return entries.putIfAbsent(entry.getEntryId(), entry) == null;
    }

    @Override
    public Optional<DeadLetterEntry> get(String entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    @Override
    public List<DeadLetterEntry> listNewestFirst() {
        return entries.values().stream()
                .sorted(Comparator.comparing(DeadLetterEntry::getFailedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String entryId) {
        return entries.remove(entryId) != null;
    }

    @Override
    public List<String> idsFailedBefore(Instant cutoff) {
        return entries.values().stream()
                .filter(entry -> entry.getFailedAt().isBefore(cutoff))
                .map(DeadLetterEntry::getEntryId)
                .collect(Collectors.toList());
    }

    @Override
    public long size() {
        return entries.size();
    }
}
