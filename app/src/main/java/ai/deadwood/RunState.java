package ai.deadwood;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of one analysis run. DONE and FAILED are terminal for the run; the next run starts from either. */
public enum RunState {
    IDLE,
    SCANNING,
    SCHEDULING,
    AGGREGATING,
    DONE,
    FAILED;

    public boolean canTransitionTo(RunState next) {
        return successors().contains(next);
    }

    private Set<RunState> successors() {
        return switch (this) {
            case IDLE, DONE, FAILED -> EnumSet.of(SCANNING);
            case SCANNING -> EnumSet.of(SCHEDULING, FAILED);
            case SCHEDULING -> EnumSet.of(AGGREGATING, FAILED);
            case AGGREGATING -> EnumSet.of(DONE, FAILED);
        };
    }
}
