package io.meshbroker.transport;

import io.meshbroker.runtime.BrokerException;

public final class FrameFormatException extends BrokerException {
    public FrameFormatException(String message) {
        super(message);
    }

    public FrameFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
