package io.hearthwarrio.pagelens.core.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.pagelens.core.InvalidTaskException;
import io.hearthwarrio.pagelens.core.UnsupportedCapabilityException;
import io.hearthwarrio.pagelens.core.config.SessionSettings;
import io.hearthwarrio.pagelens.core.download.FileDownloader;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.NetworkEvent;
import io.hearthwarrio.pagelens.core.page.NetworkLog;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import io.hearthwarrio.pagelens.core.pool.PageLease;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sessions, downloads, network log queries and selector cache maintenance.
 */
final class StateActions {

    static final int DEFAULT_NETWORK_LIMIT = 50;

    private StateActions() {
    }

    static void register(Map<String, TaskAction> registry) {
        registry.put("save_session", StateActions::saveSession);
        registry.put("load_session", StateActions::loadSession);
        registry.put("download", StateActions::download);
        registry.put("network_calls", StateActions::networkCalls);
        registry.put("invalidate_selector", StateActions::invalidateSelector);
    }

    static JsonNode saveSession(ActionContext ctx) {
        String name = sessionName(ctx);
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            byte[] state = ctx.agent().provider().exportState(lease.handle());
            String location = ctx.agent().sessions().save(name, state);
            ObjectNode result = ctx.object();
            result.put("session_name", name);
            result.put("session_path", location);
            return result;
        }
    }

    static JsonNode loadSession(ActionContext ctx) {
        String name = sessionName(ctx);
        Optional<byte[]> state = ctx.agent().sessions().load(name);
        if (state.isEmpty()) {
            throw new InvalidTaskException("no saved session '" + name + "'");
        }
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            ctx.agent().provider().importState(lease.handle(), state.get());
            ObjectNode result = ctx.object();
            result.put("session_name", name);
            result.put("loaded", true);
            return result;
        }
    }

    /**
     * Downloads {@code url}, or the {@code href}/{@code src} of the first element matching {@code selector} on the
     * tab. Selector downloads carry the page's cookies and its URL as referer.
     */
    static JsonNode download(ActionContext ctx) {
        String url = ctx.text("url", null);
        String selector = ctx.text("selector", null);
        String filename = ctx.text("filename", null);
        String subdirectory = ctx.text("subdirectory", null);
        FileDownloader downloader = ctx.downloader();
        if (url != null && !url.isBlank()) {
            return ctx.json(downloader.download(url.trim(), filename, subdirectory, Collections.emptyMap(), null));
        }
        if (selector == null || selector.isBlank()) {
            throw new InvalidTaskException("download needs 'url' or 'selector'");
        }
        PageProvider provider = ctx.agent().provider();
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            List<PageNode> matches = provider.evaluate(lease.handle(), Locator.parse(selector));
            if (matches.isEmpty()) {
                throw new InvalidTaskException("no element matches selector '" + selector + "'");
            }
            PageNode link = matches.get(0);
            String ref = link.attribute("href");
            if (ref == null || ref.isBlank()) {
                ref = link.attribute("src");
            }
            if (ref == null || ref.isBlank()) {
                throw new InvalidTaskException("no href/src attribute on the element matched by '" + selector + "'");
            }
            String pageUrl = provider.currentUrl(lease.handle());
            String absolute;
            try {
                absolute = URI.create(pageUrl).resolve(ref.trim()).toString();
            } catch (IllegalArgumentException e) {
                throw new InvalidTaskException("cannot resolve '" + ref + "' against " + pageUrl, e);
            }
            return ctx.json(downloader.download(absolute, filename, subdirectory, provider.cookies(lease.handle()), pageUrl));
        }
    }

    static JsonNode networkCalls(ActionContext ctx) {
        int limit = Math.max(0, ctx.integer("limit", DEFAULT_NETWORK_LIMIT));
        boolean includeTiming = ctx.flag("include_timing", false);
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            NetworkLog log = ctx.agent().networkLog(lease.handle());
            List<NetworkEvent> events = log.recent(limit);

            ObjectNode result = ctx.object();
            ArrayNode calls = result.putArray("calls");
            for (NetworkEvent e : events) {
                ObjectNode call = calls.addObject();
                call.put("url", e.getUrl());
                call.put("method", e.getMethod());
                call.put("resource_type", e.getResourceType());
                call.put("status", e.getStatus());
                if (includeTiming) {
                    call.put("duration_ms", e.getDurationMillis());
                }
            }
            result.put("count", events.size());
            result.put("total_recorded", log.totalRecorded());
            return result;
        }
    }

    static JsonNode invalidateSelector(ActionContext ctx) {
        String site = ctx.text("site", null);
        if (site == null || site.isBlank()) {
            String url = ctx.requireText("url");
            site = SiteKeys.of(url, ctx.config().getSelfHealing().getCacheScope());
        }
        String logicalName = ctx.requireText("logical_name");
        ObjectNode result = ctx.object();
        result.put("site", site);
        result.put("logical_name", logicalName);
        result.put("invalidated", ctx.agent().cache().invalidate(site, logicalName));
        return result;
    }

    private static String sessionName(ActionContext ctx) {
        SessionSettings sessions = ctx.config().getSessions();
        if (!sessions.isEnabled()) {
            throw new UnsupportedCapabilityException("sessions are disabled (sessions.enabled=false)");
        }
        return ctx.text("session_name", sessions.getDefaultName());
    }
}
