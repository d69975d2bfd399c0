package io.meshbroker.model;

import java.util.Optional;

/**
 * Event names carried in the {@code event} field of every wire frame.
 */
public enum FrameType {
    REGISTER("register"),
    CAPABILITIES("capabilities"),
    MESSAGE("message"),
    TASK("task"),
    TASK_RESULT("task_result"),
    NODE_JOINED("node_joined"),
    NODE_LEFT("node_left"),
    NETWORK_STATUS("network_status"),
    MESSAGE_QUEUED("message_queued"),
    MESSAGE_ROUTED("message_routed"),
    BROADCAST("broadcast"),
    TASK_DISPATCHED("task_dispatched"),
    TASK_ERROR("task_error"),
    TASK_ASSIGNED("task_assigned"),
    TASK_TIMEOUT("task_timeout"),
    TASK_COMPLETED("task_completed"),
    TASK_FAILED("task_failed"),
    ERROR("error");

    private final String wireName;

    FrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FrameType> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (FrameType value : values()) {
            if (value.wireName.equals(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
