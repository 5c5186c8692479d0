package ai.imaginecalendar.voiceworker.model.payload;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class AudioDownloaded extends StagePayload {

    @NonNull
    VoiceMessageReceived source;

    /**
     * Local reference to the fetched audio (file path or object key)
     */
    @NonNull
    String audioRef;

    long sizeBytes;

    String mimeType;

    @Override
    public VoiceMessageReceived origin() {
        return source;
    }
}
