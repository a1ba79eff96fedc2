package io.hearthwarrio.pagelens.core.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import io.hearthwarrio.pagelens.core.pool.PageLease;

import java.util.Map;

/**
 * {@code navigate} and {@code close_tab}.
 */
final class NavigationActions {

    private NavigationActions() {
    }

    static void register(Map<String, TaskAction> registry) {
        registry.put("navigate", NavigationActions::navigate);
        registry.put("close_tab", NavigationActions::closeTab);
    }

    static JsonNode navigate(ActionContext ctx) {
        String url = ctx.requireText("url");
        String tabId = ctx.tabId();
        PageProvider provider = ctx.agent().provider();
        try (PageLease lease = ctx.lease(tabId)) {
            provider.navigate(lease.handle(), url);
            ObjectNode result = ctx.object();
            result.put("tab_id", tabId);
            result.put("url", provider.currentUrl(lease.handle()));
            result.put("title", provider.title(lease.handle()));
            return result;
        }
    }

    static JsonNode closeTab(ActionContext ctx) {
        String tabId = ctx.tabId();
        ObjectNode result = ctx.object();
        result.put("tab_id", tabId);
        result.put("closed", ctx.agent().pool().closeTab(tabId));
        return result;
    }
}
