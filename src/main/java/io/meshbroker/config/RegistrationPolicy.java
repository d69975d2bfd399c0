package io.meshbroker.config;

/**
 * What a second {@code register} frame on an already registered connection does.
 */
public enum RegistrationPolicy {
    /** Overwrite the node's fields and capabilities in place. */
    REPLACE,
    /** Refuse with {@link io.meshbroker.registry.DuplicateRegistrationException}. */
    REJECT
}
