package io.meshbroker.dispatch;

import io.meshbroker.model.FrameType;
import io.meshbroker.model.Priority;
import io.meshbroker.model.Task;
import io.meshbroker.model.TaskRequest;
import io.meshbroker.model.TaskResult;
import io.meshbroker.model.TaskState;
import io.meshbroker.observability.BrokerStats;
import io.meshbroker.registry.CapabilityIndex;
import io.meshbroker.registry.ConnectionRegistry;
import io.meshbroker.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Matches task requests to capable nodes and tracks them until a result or the timeout.
 *
 * <p>Selection never falls back to a second candidate. A timeout only notifies the
 * requester; the assigned node is not told to stop. Timers run on their own scheduler,
 * so a closed requester connection just turns the notification into a dropped write.
 */
public final class TaskDispatcher {
    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final ConnectionRegistry registry;
    private final CapabilityIndex capabilityIndex;
    private final NodeSelector selector;
    private final ScheduledExecutorService timers;
    private final BrokerStats stats;
    private final Clock clock;
    private final long defaultTimeoutMs;
    private final Map<String, InFlightTask> inFlight = new ConcurrentHashMap<>();

    public TaskDispatcher(
            ConnectionRegistry registry,
            CapabilityIndex capabilityIndex,
            NodeSelector selector,
            ScheduledExecutorService timers,
            BrokerStats stats,
            Clock clock,
            long defaultTimeoutMs
    ) {
        this.registry = registry;
        this.capabilityIndex = capabilityIndex;
        this.selector = selector;
        this.timers = timers;
        this.stats = stats;
        this.clock = clock;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public DispatchOutcome dispatch(String fromConnectionId, TaskRequest request) {
        String taskId = Ids.taskId();
        String capability = request.capability() == null ? "" : request.capability().trim();
        if (capability.isEmpty()) {
            return reject(fromConnectionId, taskId, DispatchStatus.INVALID_REQUEST, "Task capability is required");
        }
        Priority priority;
        try {
            priority = Priority.fromString(request.priority());
        } catch (IllegalArgumentException e) {
            return reject(fromConnectionId, taskId, DispatchStatus.INVALID_REQUEST, e.getMessage());
        }
        long timeoutMs = request.timeoutMs() == null || request.timeoutMs() <= 0L
                ? defaultTimeoutMs
                : request.timeoutMs();
        log.debug("Task request {}: {} from {}", taskId, capability, fromConnectionId);

        List<String> candidates = new ArrayList<>(capabilityIndex.nodesWith(capability));
        candidates.remove(fromConnectionId);
        if (candidates.isEmpty()) {
            return reject(fromConnectionId, taskId, DispatchStatus.NO_CAPABLE_NODE,
                    "No nodes available with capability: " + capability);
        }
        Collections.sort(candidates);
        String selected = selector.select(candidates);
        if (!registry.isConnected(selected)) {
            return reject(fromConnectionId, taskId, DispatchStatus.NODE_UNAVAILABLE, "Selected node not available");
        }

        Task task = new Task(
                taskId,
                capability,
                request.payload(),
                priority.wireName(),
                timeoutMs,
                fromConnectionId,
                Instant.now(clock).toString()
        );
        InFlightTask entry = new InFlightTask(task, selected, clock.millis());
        // registered before the assignment goes out, so a fast result finds it
        inFlight.put(taskId, entry);
        if (!registry.sendTo(selected, FrameType.TASK_ASSIGNED, task)) {
            inFlight.remove(taskId, entry);
            return reject(fromConnectionId, taskId, DispatchStatus.NODE_UNAVAILABLE, "Selected node not available");
        }
        stats.taskDispatched();

        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("taskId", taskId);
        ack.put("assignedTo", selected);
        registry.reply(fromConnectionId, FrameType.TASK_DISPATCHED, ack);

        entry.timer = timers.schedule(() -> expire(entry), timeoutMs, TimeUnit.MILLISECONDS);
        if (entry.state.get().terminal()) {
            entry.timer.cancel(false);
        }
        log.info("Task {} ({}) dispatched from {} to {} timeoutMs={}", taskId, capability, fromConnectionId, selected, timeoutMs);
        return DispatchOutcome.dispatched(taskId, selected);
    }

    /**
     * Applies a result from the assigned node. Anything else, including results that
     * arrive after the timeout, is refused.
     */
    public ResultOutcome complete(String fromConnectionId, TaskResult result) {
        String taskId = result.taskId();
        InFlightTask entry = taskId == null ? null : inFlight.get(taskId);
        if (entry == null) {
            return new ResultOutcome(taskId, false, null, "Unknown or expired task: " + taskId);
        }
        if (!entry.assignedTo.equals(fromConnectionId)) {
            return new ResultOutcome(taskId, false, null, "Task " + taskId + " is not assigned to this node");
        }
        TaskState next = result.failed() ? TaskState.FAILED : TaskState.COMPLETED;
        if (!entry.state.compareAndSet(TaskState.DISPATCHED, next)) {
            return new ResultOutcome(taskId, false, null, "Unknown or expired task: " + taskId);
        }
        inFlight.remove(taskId, entry);
        ScheduledFuture<?> timer = entry.timer;
        if (timer != null) {
            timer.cancel(false);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("taskId", taskId);
        body.put("assignedTo", entry.assignedTo);
        if (next == TaskState.FAILED) {
            stats.taskFailed();
            body.put("error", result.error());
            registry.reply(entry.task.from(), FrameType.TASK_FAILED, body);
            log.info("Task {} failed on {}: {}", taskId, entry.assignedTo, result.error());
        } else {
            stats.taskCompleted();
            body.put("result", result.result());
            registry.reply(entry.task.from(), FrameType.TASK_COMPLETED, body);
            log.info("Task {} completed by {}", taskId, entry.assignedTo);
        }
        return new ResultOutcome(taskId, true, next, null);
    }

    public Optional<TaskView> task(String taskId) {
        InFlightTask entry = inFlight.get(taskId);
        return entry == null ? Optional.empty() : Optional.of(entry.view());
    }

    public List<TaskView> inFlightTasks() {
        List<TaskView> out = new ArrayList<>();
        for (InFlightTask entry : inFlight.values()) {
            out.add(entry.view());
        }
        return out;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private void expire(InFlightTask entry) {
        if (!entry.state.compareAndSet(TaskState.DISPATCHED, TaskState.TIMED_OUT)) {
            return;
        }
        inFlight.remove(entry.task.taskId(), entry);
        stats.taskTimedOut();
        log.info("Task {} timed out after {}ms (assigned to {})",
                entry.task.taskId(), entry.task.timeoutMs(), entry.assignedTo);
        registry.reply(entry.task.from(), FrameType.TASK_TIMEOUT, Map.of("taskId", entry.task.taskId()));
    }

    private DispatchOutcome reject(String fromConnectionId, String taskId, DispatchStatus status, String error) {
        stats.taskRejected();
        log.info("Task {} rejected ({}): {}", taskId, status, error);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("taskId", taskId);
        body.put("error", error);
        registry.reply(fromConnectionId, FrameType.TASK_ERROR, body);
        return DispatchOutcome.rejected(taskId, status, error);
    }

    private static final class InFlightTask {
        private final Task task;
        private final String assignedTo;
        private final long dispatchedAtMs;
        private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.DISPATCHED);
        private volatile ScheduledFuture<?> timer;

        private InFlightTask(Task task, String assignedTo, long dispatchedAtMs) {
            this.task = task;
            this.assignedTo = assignedTo;
            this.dispatchedAtMs = dispatchedAtMs;
        }

        private TaskView view() {
            return new TaskView(
                    task.taskId(),
                    task.capability(),
                    task.priority(),
                    task.from(),
                    assignedTo,
                    state.get(),
                    dispatchedAtMs,
                    task.timeoutMs()
            );
        }
    }
}
