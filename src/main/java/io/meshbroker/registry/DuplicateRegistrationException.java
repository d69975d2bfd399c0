package io.meshbroker.registry;

import io.meshbroker.runtime.BrokerException;

public final class DuplicateRegistrationException extends BrokerException {
    private final String connectionId;

    public DuplicateRegistrationException(String connectionId) {
        super("Connection already registered: " + connectionId);
        this.connectionId = connectionId;
    }

    public String connectionId() {
        return connectionId;
    }
}
