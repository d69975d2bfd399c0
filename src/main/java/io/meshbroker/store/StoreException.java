package io.meshbroker.store;

import io.meshbroker.runtime.BrokerException;

public final class StoreException extends BrokerException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
