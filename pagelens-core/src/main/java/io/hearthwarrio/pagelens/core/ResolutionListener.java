package io.hearthwarrio.pagelens.core;

import java.util.List;

/**
 * Receives the outcome of every resolution.
 * <p>
 * Implementations may log, attach report steps, collect metrics, etc. They are called on the resolving thread and
 * must not throw.
 */
@FunctionalInterface
public interface ResolutionListener {

    void onResolved(String site, Resolution resolution);

    default void onFailure(String site, LogicalTarget target, List<StrategyTag> attempted) {
    }

    /**
     * Declares how much detail this listener reports.
     */
    default ResolutionLogDetail detail() {
        return ResolutionLogDetail.LOCATOR;
    }

    static ResolutionListener none() {
        return (site, resolution) -> {
        };
    }
}
