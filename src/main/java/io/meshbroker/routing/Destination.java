package io.meshbroker.routing;

import io.meshbroker.config.BrokerConfig;

public record Destination(Kind kind, String target) {

    public enum Kind {
        BROADCAST,
        CAPABILITY,
        DIRECT
    }

    /**
     * Resolves a {@code to} selector: absent or the broadcast token, then the
     * {@code type:<capability>} prefix, then a concrete node id.
     */
    public static Destination parse(String to) {
        if (to == null || to.isBlank() || BrokerConfig.BROADCAST_TOKEN.equals(to)) {
            return new Destination(Kind.BROADCAST, null);
        }
        if (to.startsWith(BrokerConfig.CAPABILITY_SELECTOR_PREFIX)) {
            return new Destination(Kind.CAPABILITY, to.substring(BrokerConfig.CAPABILITY_SELECTOR_PREFIX.length()));
        }
        return new Destination(Kind.DIRECT, to);
    }
}
