package conveyor.orchestrator.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime record of a task within a run. Never deleted: a retry archives the
 * current attempt as a {@link TaskAttempt} and resets this record to PENDING.
 */
public final class TaskExecution {
    private final String runId;
    private final String taskId;
    private final TaskStatus status;
    private final Map<String, ResolvedInput> resolvedInputs;
    private final Map<String, String> outputs; // output name -> artifact URI
    private final String executionId;
    private final String handle; // launcher handle of the current attempt
    private final int retryCount;
    private final int infraRetryCount;
    private final Instant notBefore;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private TaskExecution(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.resolvedInputs = builder.resolvedInputs != null ? builder.resolvedInputs : Map.of();
        this.outputs = builder.outputs != null ? builder.outputs : Map.of();
        this.executionId = builder.executionId;
        this.handle = builder.handle;
        this.retryCount = builder.retryCount;
        this.infraRetryCount = builder.infraRetryCount;
        this.notBefore = builder.notBefore;
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String runId() {
        return runId;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus status() {
        return status;
    }

    public Map<String, ResolvedInput> resolvedInputs() {
        return resolvedInputs;
    }

    public Map<String, String> outputs() {
        return outputs;
    }

    public String executionId() {
        return executionId;
    }

    public String handle() {
        return handle;
    }

    public int retryCount() {
        return retryCount;
    }

    public int infraRetryCount() {
        return infraRetryCount;
    }

    public Instant notBefore() {
        return notBefore;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /** Backoff has elapsed (or none was set). */
    public boolean isDue(Instant now) {
        return notBefore == null || !notBefore.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
                .runId(runId)
                .taskId(taskId)
                .status(status)
                .resolvedInputs(resolvedInputs)
                .outputs(outputs)
                .executionId(executionId)
                .handle(handle)
                .retryCount(retryCount)
                .infraRetryCount(infraRetryCount)
                .notBefore(notBefore)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TaskExecution pending(String runId, String taskId, Instant createdAt) {
        return builder().runId(runId).taskId(taskId).status(TaskStatus.PENDING).createdAt(createdAt).build();
    }

    public static final class Builder {
        private String runId;
        private String taskId;
        private TaskStatus status = TaskStatus.PENDING;
        private Map<String, ResolvedInput> resolvedInputs;
        private Map<String, String> outputs;
        private String executionId;
        private String handle;
        private int retryCount = 0;
        private int infraRetryCount = 0;
        private Instant notBefore;
        private String errorMessage;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder resolvedInputs(Map<String, ResolvedInput> resolvedInputs) {
            this.resolvedInputs = resolvedInputs;
            return this;
        }

        public Builder outputs(Map<String, String> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder handle(String handle) {
            this.handle = handle;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder infraRetryCount(int infraRetryCount) {
            this.infraRetryCount = infraRetryCount;
            return this;
        }

        public Builder notBefore(Instant notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public TaskExecution build() {
            return new TaskExecution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskExecution other))
            return false;
        return Objects.equals(runId, other.runId) && Objects.equals(taskId, other.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, taskId);
    }

    @Override
    public String toString() {
        return "TaskExecution{run='" + runId + "', task='" + taskId + "', status=" + status
                + ", retries=" + retryCount + ", handle='" + handle + "'}";
    }
}
