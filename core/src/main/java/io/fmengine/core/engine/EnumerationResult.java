package io.fmengine.core.engine;

import io.fmengine.core.model.Configuration;
import java.util.List;

/**
 * Outcome of a cancellable enumeration or count.
 *
 * @param configurations the configurations found, empty for counts
 * @param count          number of valid configurations found
 * @param cancelled      whether the search stopped early; counts and configurations are then partial
 */
public record EnumerationResult(List<Configuration> configurations, long count, boolean cancelled) {

    public EnumerationResult {
        configurations = List.copyOf(configurations);
    }

    static EnumerationResult collected(List<Configuration> configurations, boolean cancelled) {
        return new EnumerationResult(configurations, configurations.size(), cancelled);
    }

    static EnumerationResult counted(long count, boolean cancelled) {
        return new EnumerationResult(List.of(), count, cancelled);
    }
}
