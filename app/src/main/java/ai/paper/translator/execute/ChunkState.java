package ai.paper.translator.execute;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single chunk inside one run.
 */
public enum ChunkState {
    PENDING,
    RUNNING,
    RETRYING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    public boolean canTransitionTo(ChunkState next) {
        return allowedSuccessors().contains(next);
    }

    private Set<ChunkState> allowedSuccessors() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(SUCCESS, RETRYING, FAILED);
            case RETRYING -> EnumSet.of(RUNNING, FAILED);
            case SUCCESS, FAILED -> EnumSet.noneOf(ChunkState.class);
        };
    }
}
