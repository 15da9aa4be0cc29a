package taskforge.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome reported by a worker for one dispatch attempt.
 */
public enum ResultStatus {
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    ResultStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ResultStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("result status is required");
        }
        for (ResultStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown result status: " + value);
    }
}
