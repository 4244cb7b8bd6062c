package retrain.orchestrator.backend;

/**
 * Observed state of a submitted attempt.
 */
public record PollResult(State state, String error) {

    public enum State {
        RUNNING,
        SUCCEEDED,
        FAILED
    }

    public static PollResult running() {
        return new PollResult(State.RUNNING, null);
    }

    public static PollResult succeeded() {
        return new PollResult(State.SUCCEEDED, null);
    }

    public static PollResult failed(String error) {
        return new PollResult(State.FAILED, error != null ? error : "unknown error");
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }
}
