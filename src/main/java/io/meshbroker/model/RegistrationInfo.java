package io.meshbroker.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record RegistrationInfo(
        String type,
        String name,
        List<String> capabilities
) {
    public RegistrationInfo {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public Set<String> capabilitySet() {
        return new LinkedHashSet<>(capabilities);
    }
}
