package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.model.ErrorCategory;
import ai.imaginecalendar.voiceworker.service.exception.PipelineException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Maps exceptions thrown by stage handlers onto an {@link ErrorCategory}.
 * Handlers that throw a {@link PipelineException} decide for themselves;
 * anything else is classified by type and message, defaulting to TRANSIENT.
 */
@Slf4j
@Service
public class ErrorClassificationService {

    // evaluated in insertion order, first match wins
    private static final Map<Pattern, ErrorCategory> ERROR_PATTERNS = new LinkedHashMap<>();

    static {
        // Input validation errors - permanent for that input
        ERROR_PATTERNS.put(Pattern.compile("(?i).*(validation|invalid.?input|malformed|unparseable).*"), ErrorCategory.VALIDATION);

        // Authentication and missing resources - retrying cannot help
        ERROR_PATTERNS.put(Pattern.compile("(?i).*(unauthorized|forbidden|\\b401\\b|\\b403\\b|invalid.?token).*"), ErrorCategory.PERMANENT);
        ERROR_PATTERNS.put(Pattern.compile("(?i).*(not.?found|\\b404\\b|already.?deleted|\\b410\\b).*"), ErrorCategory.PERMANENT);
    }

    public ErrorCategory classify(Throwable error) {
        Throwable root = unwrap(error);

        if (root instanceof PipelineException) {
            return ((PipelineException) root).getCategory();
        }
        if (root instanceof TimeoutException || root instanceof SocketTimeoutException) {
            return ErrorCategory.TRANSIENT;
        }
        if (root instanceof IllegalArgumentException) {
            return ErrorCategory.VALIDATION;
        }

        String fullErrorText = root.getClass().getSimpleName() + ": "
                + (root.getMessage() != null ? root.getMessage() : "");
        for (Map.Entry<Pattern, ErrorCategory> entry : ERROR_PATTERNS.entrySet()) {
            if (entry.getKey().matcher(fullErrorText).matches()) {
                log.debug("Classified {} as {}", fullErrorText, entry.getValue());
                return entry.getValue();
            }
        }

        // network, rate limit, 5xx and everything unknown
        return ErrorCategory.TRANSIENT;
    }

    /**
     * Strips executor wrappers so the handler's own exception is classified
     */
    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
