package ai.imaginecalendar.voiceworker.model;

import ai.imaginecalendar.voiceworker.service.exception.UnknownStageException;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline stages of a voice message, in canonical order.
 * The weight is used for ordering and display only.
 */
public enum Stage {
    WEBHOOK_RECEIVED("webhook_received", 5),
    AUDIO_DOWNLOAD("audio_download", 10),
    TRANSCRIPTION("transcription", 20),
    INTENT_ANALYSIS("intent_analysis", 25),
    INTENT_BUILD_CONTEXT("intent_build_context", 30),
    INTENT_REQUEST("intent_request", 40),
    CLARIFICATION_DISPATCH("clarification_dispatch", 50),
    CLARIFICATION_RESPONSE("clarification_response", 55),
    EVENT_CREATE("event_create", 60),
    EVENT_UPDATE("event_update", 70),
    EVENT_DELETE("event_delete", 80),
    NOTIFICATION_SEND("notification_send", 90);

    private final String value;
    private final int weight;

    Stage(String value, int weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * Looks up a stage by its wire identifier.
     *
     * @throws UnknownStageException if no stage carries the identifier
     */
    @JsonCreator
    public static Stage fromValue(String value) {
        for (Stage stage : values()) {
            if (stage.value.equals(value)) {
                return stage;
            }
        }
        throw new UnknownStageException(value);
    }
}
