package ai.imaginecalendar.voiceworker.service.handler;

import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.Stage;

/**
 * Business logic of one pipeline stage.
 *
 * <p>Implementations are Spring beans picked up by {@link StageHandlerRegistry}.
 * They may either return {@link StageResult#failure} or throw; thrown
 * exceptions are classified by
 * {@link ai.imaginecalendar.voiceworker.service.ErrorClassificationService}.
 * A handler may be invoked more than once for the same job and stage
 * (retries, lock expiry) and must tolerate that.
 */
public interface StageHandler {

    Stage stage();

    StageResult handle(JobRecord job);
}
