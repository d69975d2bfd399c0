package io.meshbroker.runtime;

/**
 * Base type for broker failures raised to callers.
 */
public class BrokerException extends RuntimeException {
    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
