package ai.imaginecalendar.voiceworker.model.payload;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Source data handed over by the ingestion collaborator
 */
@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class VoiceMessageReceived extends StagePayload {

    /**
     * Direct download URL of the audio, if the provider sent one
     */
    String audioUrl;

    /**
     * Provider media id, resolved to a URL by the download handler
     */
    String mediaId;

    String mimeType;

    String senderPhone;

    String userId;

    public boolean hasAudioReference() {
        return (audioUrl != null && !audioUrl.isBlank()) || (mediaId != null && !mediaId.isBlank());
    }

    @Override
    public VoiceMessageReceived origin() {
        return this;
    }
}
