package ai.paper.translator.execute;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe view of every chunk's {@link ChunkState}; rejects transitions the state machine does not allow.
 */
public class ChunkStateTracker {

    private final int chunkCount;
    private final ConcurrentHashMap<Integer, ChunkState> states = new ConcurrentHashMap<>();

    public ChunkStateTracker(int chunkCount) {
        if (chunkCount < 0) {
            throw new IllegalArgumentException("chunkCount must be zero or greater");
        }
        this.chunkCount = chunkCount;
        for (int i = 0; i < chunkCount; i++) {
            states.put(i, ChunkState.PENDING);
        }
    }

    public ChunkState transition(int chunkIndex, ChunkState next) {
        checkIndex(chunkIndex);
        return states.compute(chunkIndex, (index, current) -> {
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("Chunk %d cannot move from %s to %s".formatted(index, current, next));
            }
            return next;
        });
    }

    public ChunkState stateOf(int chunkIndex) {
        checkIndex(chunkIndex);
        return states.get(chunkIndex);
    }

    public boolean allTerminal() {
        return states.values().stream().allMatch(ChunkState::isTerminal);
    }

    public Map<ChunkState, Integer> countsByState() {
        Map<ChunkState, Integer> counts = new EnumMap<>(ChunkState.class);
        for (ChunkState state : states.values()) {
            counts.merge(state, 1, Integer::sum);
        }
        return counts;
    }

    private void checkIndex(int chunkIndex) {
        if (chunkIndex < 0 || chunkIndex >= chunkCount) {
            throw new IllegalArgumentException("Unknown chunk index " + chunkIndex);
        }
    }
}
