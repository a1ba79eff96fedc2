package io.hearthwarrio.pagelens.core;

import java.util.Optional;

/**
 * One tier of the self-healing chain.
 * <p>
 * Contract:
 * <ul>
 *   <li>Return a match only after the locator was checked against the live page.</li>
 *   <li>Return {@link Optional#empty()} to fall through; exceptions are treated the same way by the resolver.</li>
 *   <li>Never write to the selector cache, the resolver owns write-back.</li>
 * </ul>
 */
public interface ResolutionStrategy {

    StrategyTag tag();

    /**
     * Stable identifier used in diagnostics.
     */
    default String id() {
        return getClass().getSimpleName();
    }

    /**
     * @return verified resolution, or empty when this tier found nothing
     */
    Optional<Resolution> attempt(ResolutionContext context);
}
