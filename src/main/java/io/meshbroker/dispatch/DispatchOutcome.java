package io.meshbroker.dispatch;

public record DispatchOutcome(
        String taskId,
        DispatchStatus status,
        String assignedTo,
        String error
) {
    static DispatchOutcome dispatched(String taskId, String assignedTo) {
        return new DispatchOutcome(taskId, DispatchStatus.DISPATCHED, assignedTo, null);
    }

    static DispatchOutcome rejected(String taskId, DispatchStatus status, String error) {
        return new DispatchOutcome(taskId, status, null, error);
    }

    public boolean dispatched() {
        return status == DispatchStatus.DISPATCHED;
    }
}
