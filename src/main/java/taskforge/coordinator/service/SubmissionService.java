package taskforge.coordinator.service;

import taskforge.coordinator.api.v1.dto.SubmissionReceipt;
import taskforge.coordinator.api.v1.dto.SubmitTaskRequest;
import taskforge.coordinator.api.v1.dto.TaskListQuery;
import taskforge.coordinator.api.v1.dto.TaskPageResponse;
import taskforge.coordinator.api.v1.dto.TaskResponse;
import taskforge.coordinator.broker.EnqueueResult;
import taskforge.coordinator.broker.JobBroker;
import taskforge.coordinator.model.Task;
import taskforge.coordinator.model.TaskStatus;
import taskforge.coordinator.repository.TaskStore;
import taskforge.exception.BrokerUnavailableException;
import taskforge.exception.TaskNotFoundException;
import taskforge.protocol.DispatchMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Submission path: validate, persist, enqueue.
 * <p>
 * A broker failure after the task row was written leaves the task QUEUED;
 * the dispatch sweeper re-enqueues it later.
 */
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final TaskStore taskStore;
    private final JobBroker broker;

    public SubmissionService(TaskStore taskStore, JobBroker broker) {
        this.taskStore = taskStore;
        this.broker = broker;
    }

    /**
     * Submit a new task.
     *
     * @throws taskforge.exception.ValidationException if the request is invalid; nothing is stored
     * @throws BrokerUnavailableException              if the task was stored but could not be enqueued
     */
    public SubmissionReceipt submit(SubmitTaskRequest request) {
        request.validate();

        Task task = taskStore.create(request.toNewTask());

        try {
            EnqueueResult result = broker.enqueue(toDispatch(task));
            log.info("Task {} submitted (timeout={}s, {})", task.id(), task.timeout(), result);
        } catch (BrokerUnavailableException e) {
            log.error("Task {} stored but not enqueued: {}", task.id(), e.getMessage());
            throw e;
        }

        return SubmissionReceipt.from(task);
    }

    /**
     * Get a task by ID.
     *
     * @throws TaskNotFoundException if the task does not exist
     */
    public Task get(String taskId) {
        return taskStore.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * List tasks newest first. The total and the page are read separately and may disagree briefly.
     */
    public TaskPageResponse list(TaskListQuery query) {
        List<TaskResponse> tasks = taskStore.list(query.status(), query.offset(), query.limit()).stream()
                .map(TaskResponse::from)
                .toList();

        Map<TaskStatus, Integer> counts = taskStore.countByStatus();
        int total = query.status() != null
                ? counts.get(query.status())
                : counts.values().stream().mapToInt(Integer::intValue).sum();

        return TaskPageResponse.of(tasks, total, query);
    }

    /**
     * Delete a terminal task.
     */
    public void delete(String taskId) {
        taskStore.delete(taskId);
    }

    static DispatchMessage toDispatch(Task task) {
        return new DispatchMessage(task.id(), task.prompt(), task.code(), task.timeout());
    }
}
