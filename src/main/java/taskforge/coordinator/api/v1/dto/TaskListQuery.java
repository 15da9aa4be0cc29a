package taskforge.coordinator.api.v1.dto;

import taskforge.coordinator.model.TaskStatus;
import taskforge.exception.ValidationException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Query parameters for GET /api/v1/tasks.
 *
 * @param status filter, or null for every status
 * @param page   1-based page number
 * @param limit  page size
 */
public record TaskListQuery(TaskStatus status, int page, int limit) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public TaskListQuery {
        if (page < 1) {
            throw new ValidationException("page must be at least 1");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
    }

    /**
     * Build a query from decoded query-string parameters.
     *
     * @throws ValidationException if a parameter is malformed or out of range
     */
    public static TaskListQuery fromParameters(Map<String, List<String>> parameters) {
        String status = first(parameters, "status");
        return new TaskListQuery(
                status != null ? parseStatus(status) : null,
                parseInt(parameters, "page", DEFAULT_PAGE),
                parseInt(parameters, "limit", DEFAULT_LIMIT));
    }

    public int offset() {
        return (page - 1) * limit;
    }

    private static TaskStatus parseStatus(String value) {
        try {
            return TaskStatus.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown status: " + value);
        }
    }

    private static int parseInt(Map<String, List<String>> parameters, String name, int defaultValue) {
        String value = first(parameters, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    private static String first(Map<String, List<String>> parameters, String name) {
        List<String> values = parameters.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
