package ai.paper.translator.execute;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ChunkStateTrackerTest {

    @Test
    void startsEveryChunkAsPending() {
        ChunkStateTracker tracker = new ChunkStateTracker(3);

        assertThat(tracker.countsByState()).containsExactly(Map.entry(ChunkState.PENDING, 3));
        assertThat(tracker.allTerminal()).isFalse();
    }

    @Test
    void followsRetryPathToTerminalState() {
        ChunkStateTracker tracker = new ChunkStateTracker(2);

        tracker.transition(0, ChunkState.RUNNING);
        tracker.transition(0, ChunkState.RETRYING);
        tracker.transition(0, ChunkState.RUNNING);
        tracker.transition(0, ChunkState.FAILED);
        tracker.transition(1, ChunkState.RUNNING);
        tracker.transition(1, ChunkState.SUCCESS);

        assertThat(tracker.stateOf(0)).isEqualTo(ChunkState.FAILED);
        assertThat(tracker.stateOf(1)).isEqualTo(ChunkState.SUCCESS);
        assertThat(tracker.allTerminal()).isTrue();
    }

    @Test
    void rejectsTransitionsOutsideTheStateMachine() {
        ChunkStateTracker tracker = new ChunkStateTracker(1);

        assertThatThrownBy(() -> tracker.transition(0, ChunkState.SUCCESS))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Chunk 0 cannot move from PENDING to SUCCESS");

        tracker.transition(0, ChunkState.RUNNING);
        tracker.transition(0, ChunkState.SUCCESS);
        assertThatThrownBy(() -> tracker.transition(0, ChunkState.RUNNING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsUnknownChunk() {
        assertThatThrownBy(() -> new ChunkStateTracker(2).stateOf(2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
