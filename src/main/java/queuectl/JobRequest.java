package queuectl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRequest(
        @JsonProperty("id") String id,
        @JsonProperty("command") String command,
        @JsonProperty("max_retries") Integer maxRetries
) {

    public static JobRequest ofCommand(String command) {
        return new JobRequest(null, command, null);
    }
}
