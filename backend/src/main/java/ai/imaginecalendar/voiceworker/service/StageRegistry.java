package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.model.payload.AudioDownloaded;
import ai.imaginecalendar.voiceworker.model.payload.ClarificationAnswered;
import ai.imaginecalendar.voiceworker.model.payload.ClarificationRequested;
import ai.imaginecalendar.voiceworker.model.payload.EventApplied;
import ai.imaginecalendar.voiceworker.model.payload.IntentAnalyzed;
import ai.imaginecalendar.voiceworker.model.payload.IntentResolved;
import ai.imaginecalendar.voiceworker.model.payload.StagePayload;
import ai.imaginecalendar.voiceworker.model.payload.Transcribed;
import ai.imaginecalendar.voiceworker.model.payload.VoiceMessageReceived;
import ai.imaginecalendar.voiceworker.service.exception.PayloadValidationException;
import ai.imaginecalendar.voiceworker.service.exception.UnknownStageException;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static description of the pipeline graph: stage order, the default
 * successor of each stage, the allowed branches and the payload variants
 * each stage accepts.
 */
@Component
public class StageRegistry {

    /**
     * The only transition that moves backwards: a user reply re-enters intent resolution
     */
    public static final Transition CLARIFICATION_ROUND_TRIP =
            new Transition(Stage.CLARIFICATION_RESPONSE, Stage.INTENT_REQUEST);

    private static final Map<Stage, Stage> DEFAULT_NEXT = new EnumMap<>(Stage.class);
    private static final Map<Stage, Set<Stage>> SUCCESSORS = new EnumMap<>(Stage.class);
    private static final Map<Stage, List<Class<? extends StagePayload>>> ACCEPTED = new EnumMap<>(Stage.class);

    static {
        DEFAULT_NEXT.put(Stage.WEBHOOK_RECEIVED, Stage.AUDIO_DOWNLOAD);
        DEFAULT_NEXT.put(Stage.AUDIO_DOWNLOAD, Stage.TRANSCRIPTION);
        DEFAULT_NEXT.put(Stage.TRANSCRIPTION, Stage.INTENT_ANALYSIS);
        DEFAULT_NEXT.put(Stage.INTENT_ANALYSIS, Stage.INTENT_REQUEST);
        DEFAULT_NEXT.put(Stage.INTENT_BUILD_CONTEXT, Stage.INTENT_REQUEST);
        DEFAULT_NEXT.put(Stage.INTENT_REQUEST, Stage.EVENT_CREATE);
        DEFAULT_NEXT.put(Stage.CLARIFICATION_DISPATCH, Stage.CLARIFICATION_RESPONSE);
        DEFAULT_NEXT.put(Stage.CLARIFICATION_RESPONSE, Stage.INTENT_REQUEST);
        DEFAULT_NEXT.put(Stage.EVENT_CREATE, Stage.NOTIFICATION_SEND);
        DEFAULT_NEXT.put(Stage.EVENT_UPDATE, Stage.NOTIFICATION_SEND);
        DEFAULT_NEXT.put(Stage.EVENT_DELETE, Stage.NOTIFICATION_SEND);

        for (Map.Entry<Stage, Stage> entry : DEFAULT_NEXT.entrySet()) {
            SUCCESSORS.computeIfAbsent(entry.getKey(), s -> EnumSet.noneOf(Stage.class)).add(entry.getValue());
        }
        SUCCESSORS.get(Stage.INTENT_ANALYSIS).add(Stage.INTENT_BUILD_CONTEXT);
        SUCCESSORS.get(Stage.INTENT_REQUEST).addAll(EnumSet.of(
                Stage.EVENT_UPDATE, Stage.EVENT_DELETE, Stage.CLARIFICATION_DISPATCH));

        ACCEPTED.put(Stage.WEBHOOK_RECEIVED, List.of(VoiceMessageReceived.class));
        ACCEPTED.put(Stage.AUDIO_DOWNLOAD, List.of(VoiceMessageReceived.class));
        ACCEPTED.put(Stage.TRANSCRIPTION, List.of(AudioDownloaded.class));
        ACCEPTED.put(Stage.INTENT_ANALYSIS, List.of(Transcribed.class));
        ACCEPTED.put(Stage.INTENT_BUILD_CONTEXT, List.of(IntentAnalyzed.class));
        ACCEPTED.put(Stage.INTENT_REQUEST, List.of(IntentAnalyzed.class, ClarificationAnswered.class));
        ACCEPTED.put(Stage.CLARIFICATION_DISPATCH, List.of(ClarificationRequested.class));
        ACCEPTED.put(Stage.CLARIFICATION_RESPONSE, List.of(ClarificationRequested.class));
        ACCEPTED.put(Stage.EVENT_CREATE, List.of(IntentResolved.class));
        ACCEPTED.put(Stage.EVENT_UPDATE, List.of(IntentResolved.class));
        ACCEPTED.put(Stage.EVENT_DELETE, List.of(IntentResolved.class));
        ACCEPTED.put(Stage.NOTIFICATION_SEND, List.of(EventApplied.class));
    }

    public int stageOrder(Stage stage) {
        return stage.getWeight();
    }

    /**
     * Default successor; empty when the stage is the last of the pipeline
     */
    public Optional<Stage> nextStage(Stage stage) {
        return Optional.ofNullable(DEFAULT_NEXT.get(stage));
    }

    public Set<Stage> successors(Stage stage) {
        Set<Stage> successors = SUCCESSORS.get(stage);
        return successors == null ? Collections.emptySet() : Collections.unmodifiableSet(successors);
    }

    public boolean isValidTransition(Stage from, Stage to) {
        return successors(from).contains(to);
    }

    public boolean isLast(Stage stage) {
        return !DEFAULT_NEXT.containsKey(stage);
    }

    /**
     * Resolves a wire identifier such as {@code "event_create"}.
     *
     * @throws UnknownStageException for an unregistered identifier
     */
    public Stage stage(String stageId) {
        return Stage.fromValue(stageId);
    }

    public boolean accepts(Stage stage, StagePayload payload) {
        if (payload == null) {
            return false;
        }
        for (Class<? extends StagePayload> type : ACCEPTED.getOrDefault(stage, List.of())) {
            if (type.isInstance(payload)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Picks the stage that follows {@code current} once it produced {@code produced}.
     *
     * <p>An explicit route wins if it is a valid transition. Otherwise intent
     * resolution branches on the produced payload, and every other stage takes
     * its default successor.
     *
     * @return the next stage, or empty when the pipeline is complete
     * @throws PayloadValidationException if the route or payload leads nowhere valid
     */
    public Optional<Stage> resolveNext(Stage current, StagePayload produced, Stage requestedRoute) {
        Stage next;
        if (requestedRoute != null) {
            next = requestedRoute;
        } else if (current == Stage.INTENT_REQUEST && produced instanceof IntentResolved) {
            next = ((IntentResolved) produced).getAction().getStage();
        } else if (current == Stage.INTENT_REQUEST && produced instanceof ClarificationRequested) {
            next = Stage.CLARIFICATION_DISPATCH;
        } else {
            Optional<Stage> defaultNext = nextStage(current);
            if (defaultNext.isEmpty()) {
                return Optional.empty();
            }
            next = defaultNext.get();
        }

        if (!isValidTransition(current, next)) {
            throw new PayloadValidationException(String.format(
                    "Invalid transition %s -> %s", current.getValue(), next.getValue()));
        }
        if (!accepts(next, produced)) {
            throw new PayloadValidationException(String.format(
                    "Stage %s does not accept payload %s",
                    next.getValue(), produced == null ? "null" : produced.getClass().getSimpleName()));
        }
        return Optional.of(next);
    }

    /**
     * A directed edge of the pipeline graph
     */
    public static final class Transition {
        private final Stage from;
        private final Stage to;

        public Transition(Stage from, Stage to) {
            this.from = from;
            this.to = to;
        }

        public Stage getFrom() { return from; }
        public Stage getTo() { return to; }
    }
}
