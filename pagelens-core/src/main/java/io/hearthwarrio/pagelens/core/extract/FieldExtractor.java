package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.FieldType;
import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.ResolverSettings;
import io.hearthwarrio.pagelens.core.SelectorResolutionException;
import io.hearthwarrio.pagelens.core.SelectorResolver;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.Tokens;
import io.hearthwarrio.pagelens.core.nlq.FieldQueryParser;
import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extracts typed values for a set of logical targets on one page.
 * <p>
 * Scalar fields go through the {@link SelectorResolver}; {@link FieldType#TABLE} and {@link FieldType#LIST} fields
 * are collected directly from the selector hint or the first default selector that matches. A non-mandatory field
 * that cannot be resolved is reported as {@link FieldValue#NOT_FOUND}; a mandatory one propagates
 * {@link SelectorResolutionException}.
 */
public class FieldExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FieldExtractor.class);

    public static final int MAX_LIST_ITEMS = 80;

    private final PageProvider provider;
    private final SelectorResolver resolver;
    private final ValueCaster caster;
    private final TableExtractor tables;
    private final int maxSnapshotNodes;

    public FieldExtractor(
            PageProvider provider,
            SelectorResolver resolver,
            ValueCaster caster,
            TableExtractor tables,
            int maxSnapshotNodes
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.caster = Objects.requireNonNull(caster, "caster must not be null");
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.maxSnapshotNodes = maxSnapshotNodes;
    }

    public ExtractionResult extract(PageHandle page, String site, Map<String, LogicalTarget> targets, ResolverSettings settings) {
        Map<String, FieldValue> out = new LinkedHashMap<>();
        DomTree tree = null;
        for (Map.Entry<String, LogicalTarget> e : targets.entrySet()) {
            LogicalTarget target = e.getValue();
            if (target.getFieldType() == FieldType.TABLE) {
                if (tree == null) {
                    tree = new DomTree(provider.snapshot(page, maxSnapshotNodes));
                }
                out.put(e.getKey(), extractTable(page, tree, target));
            } else if (target.getFieldType() == FieldType.LIST) {
                out.put(e.getKey(), extractList(page, target));
            } else {
                out.put(e.getKey(), extractScalar(page, site, target, settings));
            }
        }
        return new ExtractionResult(provider.currentUrl(page), out);
    }

    FieldValue extractScalar(PageHandle page, String site, LogicalTarget target, ResolverSettings settings) {
        Resolution resolution;
        try {
            resolution = resolver.resolve(page, site, target, settings);
        } catch (SelectorResolutionException e) {
            if (target.isMandatory()) {
                throw e;
            }
            List<String> attempted = new ArrayList<>();
            for (StrategyTag t : e.getAttemptedStrategies()) {
                attempted.add(t.wireName());
            }
            logger.debug("Optional field '{}' not found (attempted {})", target.getLogicalName(), attempted);
            return FieldValue.notFound(target.getLogicalName(), target.getFieldType(), attempted);
        }

        PageNode node = resolution.getNode();
        String raw;
        if (target.getAttribute().isEmpty()) {
            raw = node.getText();
        } else {
            raw = node.hasAttribute(target.getAttribute()) ? node.attribute(target.getAttribute()) : null;
        }
        return FieldValue.resolved(
                target.getLogicalName(),
                target.getFieldType(),
                caster.cast(raw, target.getFieldType()),
                resolution.getCandidate().getStrategy().wireName(),
                resolution.getCandidate().getLocator().asString(),
                resolution.getCandidate().getConfidence(),
                resolution.isHealed()
        );
    }

    FieldValue extractTable(PageHandle page, DomTree tree, LogicalTarget target) {
        String selector = target.hasSelectorHint() ? target.getSelectorHint() : "table";
        List<TableData> data = tables.extract(tree, provider.evaluate(page, Locator.parse(selector)));
        return FieldValue.collection(target.getLogicalName(), FieldType.TABLE, data, "table", selector, data.size());
    }

    FieldValue extractList(PageHandle page, LogicalTarget target) {
        List<String> selectors = target.hasSelectorHint()
                ? List.of(target.getSelectorHint())
                : FieldQueryParser.defaultSelectors(target.getLogicalName(), FieldType.LIST);

        for (String selector : selectors) {
            List<PageNode> nodes = provider.evaluate(page, Locator.parse(selector));
            if (nodes.isEmpty()) {
                continue;
            }
            List<String> items = new ArrayList<>();
            for (PageNode n : nodes) {
                if (items.size() == MAX_LIST_ITEMS) {
                    break;
                }
                String text = Tokens.truncate(Tokens.normalizeWhitespace(n.getText()), caster.getMaxTextLength());
                if (!text.isEmpty()) {
                    items.add(text);
                }
            }
            return FieldValue.collection(target.getLogicalName(), FieldType.LIST, items, "list", selector, items.size());
        }
        return FieldValue.collection(target.getLogicalName(), FieldType.LIST, List.of(), "list", selectors.get(0), 0);
    }
}
