package ai.imaginecalendar.voiceworker.model.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Data carried by a job between stages.
 *
 * <p>Each concrete variant is produced by exactly one kind of transition and
 * wraps the variant it was derived from, so a stage can only be reached with
 * the data it needs. Stored as JSON with a {@code type} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = VoiceMessageReceived.class, name = "voice_message_received"),
        @JsonSubTypes.Type(value = AudioDownloaded.class, name = "audio_downloaded"),
        @JsonSubTypes.Type(value = Transcribed.class, name = "transcribed"),
        @JsonSubTypes.Type(value = IntentAnalyzed.class, name = "intent_analyzed"),
        @JsonSubTypes.Type(value = ClarificationRequested.class, name = "clarification_requested"),
        @JsonSubTypes.Type(value = ClarificationAnswered.class, name = "clarification_answered"),
        @JsonSubTypes.Type(value = IntentResolved.class, name = "intent_resolved"),
        @JsonSubTypes.Type(value = EventApplied.class, name = "event_applied"),
        @JsonSubTypes.Type(value = NotificationDelivered.class, name = "notification_delivered")
})
public abstract class StagePayload {

    /**
     * The inbound message this payload was ultimately derived from
     */
    public abstract VoiceMessageReceived origin();
}
