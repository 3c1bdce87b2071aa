package queuectl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobState {
    PENDING,
    PROCESSING,
    COMPLETED,
    DEAD;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobState fromDbValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job state: " + value, e);
        }
    }
}
