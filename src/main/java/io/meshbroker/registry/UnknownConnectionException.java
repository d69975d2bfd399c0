package io.meshbroker.registry;

import io.meshbroker.runtime.BrokerException;

public final class UnknownConnectionException extends BrokerException {
    public UnknownConnectionException(String connectionId) {
        super("No open connection: " + connectionId);
    }
}
