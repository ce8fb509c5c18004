package ai.deadwood;

/** Observes run state transitions. Called on the thread driving the run; must not block. */
@FunctionalInterface
public interface RunListener {
    void onTransition(String runId, RunState from, RunState to);
}
