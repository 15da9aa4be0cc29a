package taskforge.coordinator.model;

/**
 * Fields supplied by the submission path when creating a task.
 */
public record NewTask(String prompt, String code, int timeout) {
}
