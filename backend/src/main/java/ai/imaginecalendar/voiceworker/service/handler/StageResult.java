package ai.imaginecalendar.voiceworker.service.handler;

import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.model.payload.StagePayload;
import ai.imaginecalendar.voiceworker.service.exception.PipelineException;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a handler invocation
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StageResult {

    private final boolean success;

    /**
     * Payload for the next stage, set on success
     */
    private final StagePayload payload;

    /**
     * Explicit branch, null to let the registry decide
     */
    private final Stage route;

    private final PipelineException error;

    public static StageResult success(StagePayload payload) {
        return new StageResult(true, payload, null, null);
    }

    public static StageResult routeTo(StagePayload payload, Stage route) {
        return new StageResult(true, payload, route, null);
    }

    public static StageResult failure(PipelineException error) {
        return new StageResult(false, null, null, error);
    }
}
