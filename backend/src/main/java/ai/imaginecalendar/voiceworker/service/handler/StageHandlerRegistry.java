package ai.imaginecalendar.voiceworker.service.handler;

import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.service.exception.PermanentStageException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the handler for a stage. Exactly one handler per stage.
 */
@Slf4j
@Component
public class StageHandlerRegistry {

    private final Map<Stage, StageHandler> handlers = new EnumMap<>(Stage.class);

    @Autowired
    public StageHandlerRegistry(List<StageHandler> stageHandlers) {
        for (StageHandler handler : stageHandlers) {
            StageHandler existing = handlers.putIfAbsent(handler.stage(), handler);
            if (existing != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate handlers for stage %s: %s and %s", handler.stage().getValue(),
                        existing.getClass().getName(), handler.getClass().getName()));
            }
        }
        log.info("Registered stage handlers for {}", handlers.keySet());
    }

    /**
     * @throws PermanentStageException if no handler is registered; retrying would not help
     */
    public StageHandler resolve(Stage stage) {
        StageHandler handler = handlers.get(stage);
        if (handler == null) {
            throw new PermanentStageException("No handler registered for stage " + stage.getValue());
        }
        return handler;
    }

    public Set<Stage> registeredStages() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
