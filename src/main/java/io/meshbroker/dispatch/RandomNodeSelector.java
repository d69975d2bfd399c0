package io.meshbroker.dispatch;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniform random pick. Stateless and not load-aware.
 */
public final class RandomNodeSelector implements NodeSelector {
    @Override
    public String select(List<String> candidates) {
        return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
    }
}
