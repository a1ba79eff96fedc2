package io.hearthwarrio.pagelens.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Default listener: healed resolutions at info, direct hits at debug, failures at warn.
 */
public final class Slf4jResolutionListener implements ResolutionListener {

    private static final Logger logger = LoggerFactory.getLogger(Slf4jResolutionListener.class);

    private final ResolutionLogDetail detail;

    public Slf4jResolutionListener() {
        this(ResolutionLogDetail.LOCATOR);
    }

    public Slf4jResolutionListener(ResolutionLogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public ResolutionLogDetail detail() {
        return detail;
    }

    @Override
    public void onResolved(String site, Resolution resolution) {
        if (resolution.isHealed()) {
            if (logger.isInfoEnabled()) {
                logger.info(describe(site, resolution));
            }
        } else if (logger.isDebugEnabled()) {
            logger.debug(describe(site, resolution));
        }
    }

    @Override
    public void onFailure(String site, LogicalTarget target, List<StrategyTag> attempted) {
        logger.warn("[pagelens] site='{}', target='{}' unresolved, attempted={}", site, target.getLogicalName(), attempted);
    }

    private String describe(String site, Resolution resolution) {
        LocatorCandidate c = resolution.getCandidate();
        StringBuilder sb = new StringBuilder(256);
        sb.append("[pagelens] site='").append(site).append('\'')
                .append(", target='").append(resolution.getTarget().getLogicalName()).append('\'')
                .append(", strategy=").append(c.getStrategy().wireName());

        if (detail == ResolutionLogDetail.LOCATOR || detail == ResolutionLogDetail.FULL) {
            sb.append(", locator=").append(c.getLocator())
                    .append(", confidence=").append(c.getConfidence());
        }
        if (detail == ResolutionLogDetail.FULL) {
            sb.append(", node=").append(resolution.getNode());
        }
        return sb.toString();
    }
}
