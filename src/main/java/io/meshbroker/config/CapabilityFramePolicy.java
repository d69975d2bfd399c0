package io.meshbroker.config;

/**
 * Handling of {@code capabilities} frames that arrive before {@code register}.
 */
public enum CapabilityFramePolicy {
    IGNORE_UNREGISTERED,
    REJECT_UNREGISTERED
}
