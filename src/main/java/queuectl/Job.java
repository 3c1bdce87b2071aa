package queuectl;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

@JsonPropertyOrder({"id", "command", "state", "attempts", "retry_limit", "created_at", "updated_at", "next_run_at", "last_error"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class Job {

    private final String id;
    private final String command;
    private final JobState state;
    private final int attempts;
    private final int retryLimit;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant nextRunAt;
    private final String lastError;

    public Job(String id,
               String command,
               JobState state,
               int attempts,
               int retryLimit,
               Instant createdAt,
               Instant updatedAt,
               Instant nextRunAt,
               String lastError) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.attempts = attempts;
        this.retryLimit = retryLimit;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.nextRunAt = nextRunAt;
        this.lastError = lastError;
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("command")
    public String command() {
        return command;
    }

    @JsonProperty("state")
    public JobState state() {
        return state;
    }

    @JsonProperty("attempts")
    public int attempts() {
        return attempts;
    }

    @JsonProperty("retry_limit")
    public int retryLimit() {
        return retryLimit;
    }

    @JsonProperty("created_at")
    public Instant createdAt() {
        return createdAt;
    }

    @JsonProperty("updated_at")
    public Instant updatedAt() {
        return updatedAt;
    }

    /**
     * Earliest time the job may be claimed again; null means immediately.
     */
    @JsonProperty("next_run_at")
    public Instant nextRunAt() {
        return nextRunAt;
    }

    @JsonProperty("last_error")
    public String lastError() {
        return lastError;
    }

    @Override
    public String toString() {
        return String.format(
            "Job[ID=%s, State=%s, Attempts=%d/%d, Command=%s]",
            id, state.dbValue(), attempts, retryLimit, command
        );
    }
}
