package io.meshbroker.model;

public enum TaskState {
    DISPATCHED,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public boolean terminal() {
        return this != DISPATCHED;
    }
}
