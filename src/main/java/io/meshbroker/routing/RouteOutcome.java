package io.meshbroker.routing;

import io.meshbroker.model.Message;

public record RouteOutcome(
        Message message,
        Destination destination,
        int delivered,
        boolean queued
) {
}
