package ai.paper.translator.translate;

import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import java.io.IOException;

/**
 * Decides whether a failure raised by a chat model is worth retrying.
 *
 * <p>Rate limiting, timeouts, server-side errors and I/O problems anywhere in the cause chain are transient.
 * Everything else (authentication, invalid requests, unknown models) is permanent.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof TranslationException translationException) {
                return translationException.kind();
            }
            if (cause instanceof RateLimitException
                    || cause instanceof TimeoutException
                    || cause instanceof InternalServerException
                    || cause instanceof java.util.concurrent.TimeoutException
                    || cause instanceof IOException) {
                return FailureKind.TRANSIENT;
            }
            if (cause instanceof HttpException httpException && isRetryableStatus(httpException.statusCode())) {
                return FailureKind.TRANSIENT;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return FailureKind.TRANSIENT;
            }
            if (cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
        }
        return FailureKind.PERMANENT;
    }

    static boolean isRetryableStatus(int statusCode) {
        return statusCode == 408 || statusCode == 429 || (statusCode >= 500 && statusCode < 600);
    }
}
