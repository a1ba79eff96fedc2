package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.InteractionDriver;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import io.hearthwarrio.pagelens.core.page.StealthProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Detects forms and fills them by field name, id or placeholder.
 * <p>
 * For each key the first selector that matches wins: {@code [name='k']}, {@code #k}, {@code input[placeholder*='k']},
 * {@code textarea[placeholder*='k']}, {@code select[name='k']}. All selectors are scoped by the optional form
 * selector.
 */
public class FormFiller {

    private static final Logger logger = LoggerFactory.getLogger(FormFiller.class);

    private static final Set<String> CONTROL_TAGS = Set.of("input", "textarea", "select");
    private static final Set<String> TRUTHY = Set.of("1", "true", "yes", "on");
    private static final List<String> SUBMIT_SELECTORS = List.of("button[type='submit']", "input[type='submit']", "button");

    private final PageProvider provider;
    private final InteractionDriver interactions;
    private final StealthProvider stealth;
    private final int maxSnapshotNodes;

    public FormFiller(PageProvider provider, InteractionDriver interactions, StealthProvider stealth, int maxSnapshotNodes) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.interactions = Objects.requireNonNull(interactions, "interactions must not be null");
        this.stealth = stealth == null ? StealthProvider.none() : stealth;
        this.maxSnapshotNodes = maxSnapshotNodes;
    }

    public List<FormInfo> detect(PageHandle page) {
        DomTree tree = new DomTree(provider.snapshot(page, maxSnapshotNodes));
        List<FormInfo> forms = new ArrayList<>();
        for (PageNode node : tree.nodes()) {
            if (!"form".equals(node.getTagName())) {
                continue;
            }
            List<FormInfo.Field> fields = new ArrayList<>();
            for (PageNode d : tree.descendants(node)) {
                if (CONTROL_TAGS.contains(d.getTagName())) {
                    String type = d.attribute("type");
                    fields.add(new FormInfo.Field(
                            emptyToNull(d.getName()),
                            type.isEmpty() ? d.getTagName() : type.toLowerCase(Locale.ROOT),
                            emptyToNull(d.getId()),
                            emptyToNull(d.attribute("placeholder"))
                    ));
                }
            }
            String method = node.attribute("method");
            forms.add(new FormInfo(
                    forms.size(),
                    emptyToNull(node.getId()),
                    emptyToNull(node.attribute("action")),
                    method.isEmpty() ? "get" : method.toLowerCase(Locale.ROOT),
                    tree.cssPath(node),
                    fields
            ));
        }
        return forms;
    }

    /**
     * @param values       control key to value, in fill order
     * @param formSelector CSS selector of the form, {@code null} or blank for the whole page
     * @param submit       whether to click the first submit control afterwards
     * @throws InterruptedException when interrupted during a human-like pause
     */
    public FillResult fill(PageHandle page, Map<String, ?> values, String formSelector, boolean submit)
            throws InterruptedException {
        String prefix = formSelector == null || formSelector.isBlank() ? "" : formSelector.trim() + " ";
        List<String> filled = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Map.Entry<String, ?> e : values.entrySet()) {
            String key = e.getKey();
            Optional<Match> match = firstMatch(page, candidateSelectors(prefix, key));
            if (match.isEmpty()) {
                logger.debug("No form control matches '{}'", key);
                skipped.add(key);
                continue;
            }
            String value = e.getValue() == null ? "" : String.valueOf(e.getValue());
            apply(page, match.get(), value);
            filled.add(key);
            stealth.humanDelay();
        }

        boolean submitted = false;
        if (submit) {
            List<String> submitSelectors = new ArrayList<>();
            for (String s : SUBMIT_SELECTORS) {
                submitSelectors.add(prefix + s);
            }
            Optional<Match> button = firstMatch(page, submitSelectors);
            if (button.isPresent()) {
                interactions.click(page, button.get().locator);
                submitted = true;
            }
        }
        return new FillResult(filled, skipped, submitted);
    }

    private void apply(PageHandle page, Match match, String value) {
        String tag = match.node.getTagName();
        String type = match.node.attribute("type").toLowerCase(Locale.ROOT);
        if ("select".equals(tag)) {
            interactions.select(page, match.locator, value);
        } else if ("checkbox".equals(type) || "radio".equals(type)) {
            interactions.setChecked(page, match.locator, TRUTHY.contains(value.toLowerCase(Locale.ROOT)));
        } else {
            interactions.type(page, match.locator, value, true);
        }
    }

    static List<String> candidateSelectors(String prefix, String key) {
        String quoted = key.replace("\\", "\\\\").replace("'", "\\'");
        List<String> out = new ArrayList<>();
        out.add(prefix + "[name='" + quoted + "']");
        if (key.matches("[A-Za-z_][A-Za-z0-9_-]*")) {
            out.add(prefix + "#" + key);
        }
        out.add(prefix + "input[placeholder*='" + quoted + "']");
        out.add(prefix + "textarea[placeholder*='" + quoted + "']");
        out.add(prefix + "select[name='" + quoted + "']");
        return out;
    }

    private Optional<Match> firstMatch(PageHandle page, List<String> selectors) {
        for (String selector : selectors) {
            Locator locator = Locator.css(selector);
            List<PageNode> nodes = provider.evaluate(page, locator);
            if (!nodes.isEmpty()) {
                return Optional.of(new Match(locator, nodes.get(0)));
            }
        }
        return Optional.empty();
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private static final class Match {
        final Locator locator;
        final PageNode node;

        Match(Locator locator, PageNode node) {
            this.locator = locator;
            this.node = node;
        }
    }
}
