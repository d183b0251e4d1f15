package ai.paper.translator.service;

/**
 * Fatal failure while preparing a run, raised before any chunk is translated.
 */
public class TranslationSetupException extends RuntimeException {

    public TranslationSetupException(String message) {
        super(message);
    }

    public TranslationSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
