package retrain.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model representing a scheduled training job.
 * A job runs a container image on a cron schedule and is retried from its
 * checkpoint when an execution fails.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String image;
    private final List<String> command;
    private final String schedule;
    private final int maxRetries;
    private final int retryCount;
    private final String checkpointPath;
    private final JobStatus status;
    private final Instant lastStartedAt;
    private final Instant lastCompletedAt;
    private final String errorMessage;
    private final Instant lastCheckedAt; // schedule anchor for the due check
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.image = Objects.requireNonNull(builder.image, "image is required");
        this.command = List.copyOf(Objects.requireNonNull(builder.command, "command is required"));
        this.schedule = Objects.requireNonNull(builder.schedule, "schedule is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (builder.retryCount < 0 || builder.retryCount > builder.maxRetries) {
            throw new IllegalArgumentException(
                    "retryCount " + builder.retryCount + " outside 0.." + builder.maxRetries);
        }
        this.maxRetries = builder.maxRetries;
        this.retryCount = builder.retryCount;
        this.checkpointPath = builder.checkpointPath;
        this.lastStartedAt = builder.lastStartedAt;
        this.lastCompletedAt = builder.lastCompletedAt;
        this.errorMessage = builder.errorMessage;
        this.lastCheckedAt = builder.lastCheckedAt;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String image() {
        return image;
    }

    public List<String> command() {
        return command;
    }

    public String schedule() {
        return schedule;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int retryCount() {
        return retryCount;
    }

    public String checkpointPath() {
        return checkpointPath;
    }

    public JobStatus status() {
        return status;
    }

    public Instant lastStartedAt() {
        return lastStartedAt;
    }

    public Instant lastCompletedAt() {
        return lastCompletedAt;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant lastCheckedAt() {
        return lastCheckedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if another failed attempt may still be retried */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public boolean hasCheckpoint() {
        return checkpointPath != null && !checkpointPath.isBlank();
    }

    /** Reference time for the next cron fire: last check, else creation */
    public Instant scheduleAnchor() {
        return lastCheckedAt != null ? lastCheckedAt : createdAt;
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .image(image)
                .command(command)
                .schedule(schedule)
                .maxRetries(maxRetries)
                .retryCount(retryCount)
                .checkpointPath(checkpointPath)
                .status(status)
                .lastStartedAt(lastStartedAt)
                .lastCompletedAt(lastCompletedAt)
                .errorMessage(errorMessage)
                .lastCheckedAt(lastCheckedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String image;
        private List<String> command;
        private String schedule;
        private int maxRetries = 3;
        private int retryCount;
        private String checkpointPath;
        private JobStatus status = JobStatus.PENDING;
        private Instant lastStartedAt;
        private Instant lastCompletedAt;
        private String errorMessage;
        private Instant lastCheckedAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder command(List<String> command) {
            this.command = command;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder checkpointPath(String checkpointPath) {
            this.checkpointPath = checkpointPath;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastStartedAt(Instant lastStartedAt) {
            this.lastStartedAt = lastStartedAt;
            return this;
        }

        public Builder lastCompletedAt(Instant lastCompletedAt) {
            this.lastCompletedAt = lastCompletedAt;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder lastCheckedAt(Instant lastCheckedAt) {
            this.lastCheckedAt = lastCheckedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', name='" + name + "', status=" + status
                + ", retries=" + retryCount + "/" + maxRetries + "}";
    }
}
