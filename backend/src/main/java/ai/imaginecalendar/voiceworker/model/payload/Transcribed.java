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
public class Transcribed extends StagePayload {

    @NonNull
    AudioDownloaded audio;

    @NonNull
    String transcript;

    @Override
    public VoiceMessageReceived origin() {
        return audio.origin();
    }
}
