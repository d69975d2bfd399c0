package io.meshbroker.dispatch;

public enum DispatchStatus {
    DISPATCHED,
    INVALID_REQUEST,
    NO_CAPABLE_NODE,
    NODE_UNAVAILABLE
}
