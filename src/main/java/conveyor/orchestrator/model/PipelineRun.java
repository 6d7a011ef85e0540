package conveyor.orchestrator.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One execution of a pipeline. The pipeline itself is stored with the run so a
 * controller can resume it from the store alone.
 */
public final class PipelineRun {
    private final String id;
    private final PipelineSpec pipeline;
    private final Map<String, String> arguments;
    private final Map<String, Object> annotations;
    private final RunStatus status;
    private final boolean cancelRequested;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private PipelineRun(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.pipeline = Objects.requireNonNull(builder.pipeline, "pipeline is required");
        this.arguments = builder.arguments != null ? Map.copyOf(builder.arguments) : Map.of();
        this.annotations = builder.annotations != null ? builder.annotations : Map.of();
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.cancelRequested = builder.cancelRequested;
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public PipelineSpec pipeline() {
        return pipeline;
    }

    public Map<String, String> arguments() {
        return arguments;
    }

    public Map<String, Object> annotations() {
        return annotations;
    }

    public RunStatus status() {
        return status;
    }

    public boolean cancelRequested() {
        return cancelRequested;
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

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .pipeline(pipeline)
                .arguments(arguments)
                .annotations(annotations)
                .status(status)
                .cancelRequested(cancelRequested)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private PipelineSpec pipeline;
        private Map<String, String> arguments;
        private Map<String, Object> annotations;
        private RunStatus status = RunStatus.PENDING;
        private boolean cancelRequested;
        private String errorMessage;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder pipeline(PipelineSpec pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        public Builder arguments(Map<String, String> arguments) {
            this.arguments = arguments;
            return this;
        }

        public Builder annotations(Map<String, Object> annotations) {
            this.annotations = annotations;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
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

        public PipelineRun build() {
            return new PipelineRun(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PipelineRun run))
            return false;
        return Objects.equals(id, run.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "PipelineRun{id='" + id + "', pipeline='" + pipeline.name() + "', status=" + status
                + (cancelRequested ? ", cancelRequested" : "") + "}";
    }
}
