package retrain.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One attempt to run a job on the execution backend.
 * Execution numbers are per job, start at 1 and are never reused.
 * Once terminal, an execution is never modified again.
 */
public final class Execution {
    private final String jobId;
    private final int executionNumber;
    private final ExecutionStatus status;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Long durationSeconds;
    private final String errorMessage;
    private final String checkpointUsed;
    private final String backendHandle;

    private Execution(Builder builder) {
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        if (builder.executionNumber < 1) {
            throw new IllegalArgumentException("executionNumber must be >= 1");
        }
        this.executionNumber = builder.executionNumber;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt is required");
        this.completedAt = builder.completedAt;
        this.durationSeconds = builder.durationSeconds;
        this.errorMessage = builder.errorMessage;
        this.checkpointUsed = builder.checkpointUsed;
        this.backendHandle = builder.backendHandle;
    }

    public String jobId() {
        return jobId;
    }

    public int executionNumber() {
        return executionNumber;
    }

    public ExecutionStatus status() {
        return status;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Long durationSeconds() {
        return durationSeconds;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String checkpointUsed() {
        return checkpointUsed;
    }

    public String backendHandle() {
        return backendHandle;
    }

    public boolean isRunning() {
        return status == ExecutionStatus.RUNNING;
    }

    /**
     * Close this running execution with a terminal status.
     */
    public Execution finish(ExecutionStatus terminal, Instant at, String error) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + terminal);
        }
        if (!isRunning()) {
            throw new IllegalStateException("execution " + jobId + "#" + executionNumber + " already " + status);
        }
        return toBuilder()
                .status(terminal)
                .completedAt(at)
                .durationSeconds(Math.max(0, Duration.between(startedAt, at).getSeconds()))
                .errorMessage(error)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .jobId(jobId)
                .executionNumber(executionNumber)
                .status(status)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationSeconds(durationSeconds)
                .errorMessage(errorMessage)
                .checkpointUsed(checkpointUsed)
                .backendHandle(backendHandle);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String jobId;
        private int executionNumber;
        private ExecutionStatus status = ExecutionStatus.RUNNING;
        private Instant startedAt;
        private Instant completedAt;
        private Long durationSeconds;
        private String errorMessage;
        private String checkpointUsed;
        private String backendHandle;

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder executionNumber(int executionNumber) {
            this.executionNumber = executionNumber;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder durationSeconds(Long durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder checkpointUsed(String checkpointUsed) {
            this.checkpointUsed = checkpointUsed;
            return this;
        }

        public Builder backendHandle(String backendHandle) {
            this.backendHandle = backendHandle;
            return this;
        }

        public Execution build() {
            return new Execution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Execution other))
            return false;
        return executionNumber == other.executionNumber && Objects.equals(jobId, other.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, executionNumber);
    }

    @Override
    public String toString() {
        return "Execution{" + jobId + "#" + executionNumber + ", status=" + status + "}";
    }
}
