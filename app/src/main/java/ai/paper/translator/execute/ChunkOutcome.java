package ai.paper.translator.execute;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of translating one chunk.
 */
public record ChunkOutcome(int chunkIndex,
                           ChunkState state,
                           Optional<String> translatedText,
                           int attempts,
                           Optional<String> failureMessage) {

    public ChunkOutcome {
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be zero or greater");
        }
        Objects.requireNonNull(state, "state");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("outcome state must be terminal but was " + state);
        }
        translatedText = translatedText == null ? Optional.empty() : translatedText;
        failureMessage = failureMessage == null ? Optional.empty() : failureMessage;
        if (state == ChunkState.SUCCESS && translatedText.isEmpty()) {
            throw new IllegalArgumentException("successful outcome requires translated text");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be zero or greater");
        }
    }

    public static ChunkOutcome success(int chunkIndex, String text, int attempts) {
        return new ChunkOutcome(chunkIndex, ChunkState.SUCCESS, Optional.of(text), attempts, Optional.empty());
    }

    public static ChunkOutcome failed(int chunkIndex, int attempts, String reason) {
        return new ChunkOutcome(chunkIndex, ChunkState.FAILED, Optional.empty(), attempts, Optional.ofNullable(reason));
    }

    public boolean isSuccess() {
        return state == ChunkState.SUCCESS;
    }
}
