package io.hearthwarrio.pagelens.core;

import java.util.List;

/**
 * Thrown when every enabled strategy failed to produce a verified locator.
 */
public class SelectorResolutionException extends PagelensException {

    private final String logicalName;
    private final List<StrategyTag> attemptedStrategies;

    public SelectorResolutionException(String logicalName, List<StrategyTag> attemptedStrategies) {
        super(ErrorKind.RESOLUTION_FAILURE,
                "No strategy resolved '" + logicalName + "' (attempted: " + attemptedStrategies + ")");
        this.logicalName = logicalName;
        this.attemptedStrategies = List.copyOf(attemptedStrategies);
    }

    public String getLogicalName() {
        return logicalName;
    }

    public List<StrategyTag> getAttemptedStrategies() {
        return attemptedStrategies;
    }
}
