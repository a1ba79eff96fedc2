package io.hearthwarrio.pagelens.core.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.pagelens.core.InvalidTaskException;
import io.hearthwarrio.pagelens.core.extract.FormFiller;
import io.hearthwarrio.pagelens.core.extract.FormInfo;
import io.hearthwarrio.pagelens.core.extract.ScrollHandler;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.pool.PageLease;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Actions that change page state through the {@code InteractionDriver}.
 */
final class InteractionActions {

    private InteractionActions() {
    }

    static void register(Map<String, TaskAction> registry) {
        registry.put("detect_forms", InteractionActions::detectForms);
        registry.put("fill_form", InteractionActions::fillForm);
        registry.put("click", InteractionActions::click);
        registry.put("type_text", InteractionActions::typeText);
        registry.put("auto_scroll", InteractionActions::autoScroll);
    }

    static JsonNode detectForms(ActionContext ctx) {
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            List<FormInfo> forms = formFiller(ctx).detect(lease.handle());
            ObjectNode result = ctx.object();
            result.set("forms", ctx.json(forms));
            result.put("count", forms.size());
            return result;
        }
    }

    static JsonNode fillForm(ActionContext ctx) throws InterruptedException {
        JsonNode values = ctx.node("field_values");
        if (values == null || !values.isObject() || values.isEmpty()) {
            throw new InvalidTaskException("'field_values' must be a non-empty object");
        }
        Map<String, String> fieldValues = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = values.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            fieldValues.put(e.getKey(), e.getValue().isNull() ? "" : e.getValue().asText());
        }
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            return ctx.json(formFiller(ctx).fill(
                    lease.handle(),
                    fieldValues,
                    ctx.text("form_selector", null),
                    ctx.flag("submit", false)
            ));
        }
    }

    static JsonNode click(ActionContext ctx) throws InterruptedException {
        String selector = ctx.requireText("selector");
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            ctx.agent().interactions().click(lease.handle(), Locator.parse(selector));
            ctx.agent().stealth().humanDelay();
            ObjectNode result = ctx.object();
            result.put("clicked", selector);
            return result;
        }
    }

    static JsonNode typeText(ActionContext ctx) throws InterruptedException {
        String selector = ctx.requireText("selector");
        String text = ctx.text("text", "");
        boolean clearFirst = ctx.flag("clear_first", true);
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            ctx.agent().interactions().type(lease.handle(), Locator.parse(selector), text, clearFirst);
            ctx.agent().stealth().humanDelay();
            ObjectNode result = ctx.object();
            result.put("typed", selector);
            result.put("length", text.length());
            return result;
        }
    }

    static JsonNode autoScroll(ActionContext ctx) throws InterruptedException {
        int maxScrolls = ctx.integer("max_scrolls", ScrollHandler.DEFAULT_MAX_SCROLLS);
        long delayMs = ctx.integer("scroll_delay_ms", (int) ScrollHandler.DEFAULT_DELAY_MS);
        boolean stop = ctx.flag("stop_if_no_new_content", true);
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            return ctx.json(new ScrollHandler(ctx.agent().interactions()).autoScroll(lease.handle(), maxScrolls, delayMs, stop));
        }
    }

    private static FormFiller formFiller(ActionContext ctx) {
        return new FormFiller(
                ctx.agent().provider(),
                ctx.agent().interactions(),
                ctx.agent().stealth(),
                ctx.config().getExtraction().getMaxSnapshotNodes()
        );
    }
}
