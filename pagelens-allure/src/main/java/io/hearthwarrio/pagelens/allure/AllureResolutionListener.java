package io.hearthwarrio.pagelens.allure;

import io.hearthwarrio.pagelens.core.LocatorCandidate;
import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.ResolutionListener;
import io.hearthwarrio.pagelens.core.ResolutionLogDetail;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.qameta.allure.Allure;
import io.qameta.allure.model.Status;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Reports every resolution as an Allure step with a plain-text attachment.
 * <p>
 * Lives in pagelens-allure to avoid leaking the Allure dependency into core.
 */
public final class AllureResolutionListener implements ResolutionListener {

    static final String ATTACHMENT_NAME = "Resolved element";

    private final ResolutionLogDetail detail;
    private final boolean healedOnly;

    public AllureResolutionListener(ResolutionLogDetail detail, boolean healedOnly) {
        this.detail = detail == null ? ResolutionLogDetail.SUMMARY : detail;
        this.healedOnly = healedOnly;
    }

    @Override
    public ResolutionLogDetail detail() {
        return detail;
    }

    @Override
    public void onResolved(String site, Resolution resolution) {
        if (healedOnly && !resolution.isHealed()) {
            return;
        }
        String title = "Pagelens: " + resolution.getTarget().getLogicalName()
                + " via " + resolution.getCandidate().getStrategy().wireName()
                + (resolution.isHealed() ? " (healed)" : "");

        Allure.step(title, () -> {
            byte[] txt = describe(site, resolution, detail).getBytes(StandardCharsets.UTF_8);
            Allure.addAttachment(ATTACHMENT_NAME, "text/plain", new ByteArrayInputStream(txt), ".txt");
        });
    }

    @Override
    public void onFailure(String site, LogicalTarget target, List<StrategyTag> attempted) {
        String tried = attempted.stream().map(StrategyTag::wireName).collect(Collectors.joining(", "));
        Allure.step("Pagelens: " + target.getLogicalName() + " unresolved on " + site + " [" + tried + "]", Status.FAILED);
    }

    static String describe(String site, Resolution resolution, ResolutionLogDetail detail) {
        LocatorCandidate c = resolution.getCandidate();
        StringBuilder sb = new StringBuilder(512);
        sb.append("site: ").append(safe(site)).append('\n')
                .append("target: ").append(resolution.getTarget().getLogicalName()).append('\n')
                .append("strategy: ").append(c.getStrategy().wireName()).append('\n')
                .append("healed: ").append(resolution.isHealed()).append('\n');

        if (detail == ResolutionLogDetail.LOCATOR || detail == ResolutionLogDetail.FULL) {
            sb.append(c.getLocator().getKind().name().toLowerCase(Locale.ROOT)).append(": ")
                    .append(c.getLocator().getExpression()).append('\n')
                    .append("confidence: ").append(c.getConfidence()).append('\n');
        }
        PageNode node = resolution.getNode();
        if (detail == ResolutionLogDetail.FULL) {
            sb.append("dom.tag: ").append(node.getTagName()).append('\n')
                    .append("dom.id: ").append(nullSafe(node.getId())).append('\n')
                    .append("dom.name: ").append(nullSafe(node.getName())).append('\n')
                    .append("dom.text: ").append(node.getText()).append('\n');
        }
        return sb.toString();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    private static String nullSafe(String s) {
        return s == null || s.isEmpty() ? "null" : s;
    }
}
