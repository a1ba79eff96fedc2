package io.hearthwarrio.pagelens.core.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.pagelens.core.FieldType;
import io.hearthwarrio.pagelens.core.InvalidTaskException;
import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.Tokens;
import io.hearthwarrio.pagelens.core.config.ExtractionSettings;
import io.hearthwarrio.pagelens.core.extract.ContentPreviewer;
import io.hearthwarrio.pagelens.core.extract.ExtractionResult;
import io.hearthwarrio.pagelens.core.extract.FieldValue;
import io.hearthwarrio.pagelens.core.extract.StructureCapture;
import io.hearthwarrio.pagelens.core.extract.TableData;
import io.hearthwarrio.pagelens.core.extract.TableExtractor;
import io.hearthwarrio.pagelens.core.page.DomTree;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import io.hearthwarrio.pagelens.core.page.TextCursor;
import io.hearthwarrio.pagelens.core.pool.PageLease;
import io.hearthwarrio.pagelens.core.pool.UrlOutcome;
import io.hearthwarrio.pagelens.core.relevance.BlockCollector;
import io.hearthwarrio.pagelens.core.relevance.RelevanceFilter;
import io.hearthwarrio.pagelens.core.relevance.ScoredBlock;
import io.hearthwarrio.pagelens.core.stream.ChunkStream;
import io.hearthwarrio.pagelens.core.stream.StreamChunk;
import io.hearthwarrio.pagelens.core.stream.StreamSummary;
import io.hearthwarrio.pagelens.core.stream.StreamingExtractionController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only page actions: resolution, field extraction, tables, structure, previews, relevance and streaming.
 */
final class ExtractionActions {

    static final String DEFAULT_STREAM_SCOPE = "main, article, body";
    static final int DEFAULT_MAX_TOKENS = 4000;
    static final double DEFAULT_MIN_SCORE = 0.6;
    static final int DEFAULT_MAX_ITEMS = 25;
    static final int DEFAULT_MAX_CONCURRENT = 2;

    private ExtractionActions() {
    }

    static void register(Map<String, TaskAction> registry) {
        registry.put("resolve", ExtractionActions::resolve);
        registry.put("extract", ExtractionActions::extract);
        registry.put("capture_structure", ExtractionActions::captureStructure);
        registry.put("extract_tables", ExtractionActions::extractTables);
        registry.put("preview", ExtractionActions::preview);
        registry.put("relevance_filter", ExtractionActions::relevanceFilter);
        registry.put("stream_extract", ExtractionActions::streamExtract);
        registry.put("parallel_extract", ExtractionActions::parallelExtract);
    }

    static JsonNode resolve(ActionContext ctx) {
        LogicalTarget target = singleTarget(ctx, null);
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            String site = ctx.site(lease.handle());
            Resolution resolution = ctx.agent().resolver().resolve(lease.handle(), site, target, ctx.resolverSettings());

            ObjectNode result = ctx.object();
            result.put("logical_name", target.getLogicalName());
            result.put("site", site);
            result.put("strategy", resolution.getCandidate().getStrategy().wireName());
            result.put("selector", resolution.getCandidate().getLocator().getExpression());
            result.put("locator_kind", resolution.getCandidate().getLocator().getKind().name().toLowerCase(Locale.ROOT));
            result.put("confidence", resolution.getCandidate().getConfidence());
            result.put("healed", resolution.isHealed());
            ObjectNode node = result.putObject("node");
            node.put("index", resolution.getNode().getIndex());
            node.put("tag", resolution.getNode().getTagName());
            node.put("text_preview", Tokens.truncate(resolution.getNode().getText(), 200));
            return result;
        }
    }

    static JsonNode extract(ActionContext ctx) {
        Map<String, LogicalTarget> targets = ctx.fieldTargets("fields");
        PageProvider provider = ctx.agent().provider();
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            String url = ctx.text("url", null);
            if (url != null && !url.isBlank()) {
                provider.navigate(lease.handle(), url);
            }
            return extractionJson(ctx, extractFields(ctx, lease.handle(), targets));
        }
    }

    static JsonNode captureStructure(ActionContext ctx) {
        String logicalName = ctx.text("logical_name", "target");
        LogicalTarget target = singleTarget(ctx, logicalName);
        if (!target.hasSelectorHint() && target.getTextHint().isEmpty() && !ctx.has("semantic_hint")) {
            throw new InvalidTaskException("capture_structure needs 'selector', 'text_hint' or 'semantic_hint'");
        }
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            Resolution resolution = ctx.agent().resolver()
                    .resolve(lease.handle(), ctx.site(lease.handle()), target, ctx.resolverSettings());
            DomTree tree = snapshot(ctx, lease.handle());
            return ctx.json(new StructureCapture().capture(tree, resolution));
        }
    }

    static JsonNode extractTables(ActionContext ctx) {
        String selector = ctx.text("selector", "table");
        PageProvider provider = ctx.agent().provider();
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            DomTree tree = snapshot(ctx, lease.handle());
            List<TableData> tables = new TableExtractor(ctx.config().getExtraction().getMaxTableRows())
                    .extract(tree, provider.evaluate(lease.handle(), Locator.parse(selector)));
            ObjectNode result = ctx.object();
            result.put("selector", selector);
            result.put("count", tables.size());
            result.set("tables", ctx.json(tables));
            return result;
        }
    }

    static JsonNode preview(ActionContext ctx) {
        int maxSections = ctx.integer("max_sections", ContentPreviewer.DEFAULT_MAX_SECTIONS);
        PageProvider provider = ctx.agent().provider();
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            DomTree tree = snapshot(ctx, lease.handle());
            return ctx.json(new ContentPreviewer().preview(provider.title(lease.handle()), tree, maxSections));
        }
    }

    static JsonNode relevanceFilter(ActionContext ctx) {
        List<String> keywords = ctx.strings("keywords");
        double minScore = ctx.number("min_score", DEFAULT_MIN_SCORE);
        int maxItems = ctx.integer("max_items", DEFAULT_MAX_ITEMS);
        if (maxItems < 0) {
            throw new InvalidTaskException("'max_items' must not be negative");
        }
        try (PageLease lease = ctx.lease(ctx.tabId())) {
            DomTree tree = snapshot(ctx, lease.handle());
            List<ScoredBlock> kept = new RelevanceFilter().filter(new BlockCollector().collect(tree), keywords, minScore, maxItems);

            ObjectNode result = ctx.object();
            ArrayNode items = result.putArray("items");
            for (ScoredBlock s : kept) {
                ObjectNode item = items.addObject();
                item.put("index", s.getBlock().getIndex());
                item.put("tag", s.getBlock().getTagName());
                item.put("kind", s.getBlock().getKind().name().toLowerCase(Locale.ROOT));
                item.put("score", s.getScore());
                item.put("selector", s.getBlock().getSelector());
                item.put("text", s.getBlock().getText());
            }
            result.put("count", kept.size());
            return result;
        }
    }

    static JsonNode streamExtract(ActionContext ctx) {
        ExtractionSettings extraction = ctx.config().getExtraction();
        int maxTokens = ctx.integer("max_tokens", DEFAULT_MAX_TOKENS);
        double charsPerToken = ctx.number("chars_per_token", extraction.getCharsPerToken());
        String scope = ctx.text("selector", DEFAULT_STREAM_SCOPE);
        if (maxTokens <= 0 || !(charsPerToken > 0.0)) {
            throw new InvalidTaskException("'max_tokens' and 'chars_per_token' must be positive");
        }
        StreamingExtractionController controller =
                new StreamingExtractionController(extraction.getStreamChunkChars(), extraction.getMaxStreamChunks());
        PageProvider provider = ctx.agent().provider();

        try (PageLease lease = ctx.lease(ctx.tabId())) {
            Locator scopeLocator = firstMatchingScope(provider, lease.handle(), scope);
            ObjectNode result = ctx.object();
            ArrayNode chunks = result.putArray("chunks");
            StreamSummary summary;
            TextCursor cursor = provider.openText(lease.handle(), scopeLocator);
            try (ChunkStream stream = controller.stream(cursor, maxTokens, charsPerToken)) {
                while (stream.hasNext()) {
                    if (Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    StreamChunk chunk = stream.next();
                    ObjectNode c = chunks.addObject();
                    c.put("sequence", chunk.getSequence());
                    c.put("text", chunk.getText());
                    c.put("is_final", chunk.isFinal());
                }
                summary = stream.summary();
            }
            ObjectNode s = result.putObject("summary");
            s.put("chunks", summary.getChunks());
            s.put("emitted_chars", summary.getEmittedChars());
            s.put("char_budget", summary.getCharBudget());
            s.put("estimated_tokens", summary.getEstimatedTokens());
            s.put("truncated", summary.isTruncated());
            s.put("stop_reason", summary.getStopReason() == null ? null : summary.getStopReason().wireName());
            return result;
        }
    }

    static JsonNode parallelExtract(ActionContext ctx) {
        List<String> urls = ctx.strings("urls");
        if (urls.isEmpty()) {
            throw new InvalidTaskException("'urls' must list at least one URL");
        }
        Map<String, LogicalTarget> targets = ctx.fieldTargets("fields");
        int maxConcurrent = Math.max(1, ctx.integer("max_concurrent", DEFAULT_MAX_CONCURRENT));

        List<UrlOutcome<ExtractionResult>> outcomes = ctx.agent().orchestrator()
                .runParallel(urls, maxConcurrent, (handle, url) -> extractFields(ctx, handle, targets));

        ObjectNode result = ctx.object();
        ArrayNode results = result.putArray("results");
        int succeeded = 0;
        for (UrlOutcome<ExtractionResult> o : outcomes) {
            ObjectNode r = results.addObject();
            r.put("url", o.getUrl());
            r.put("tab_id", o.getTabId());
            if (o.isSuccess()) {
                succeeded++;
                r.put("status", TaskExecutor.STATUS_OK);
                r.set("result", extractionJson(ctx, o.getValue()));
            } else {
                r.put("status", TaskExecutor.STATUS_ERROR);
                r.set("error", TaskExecutor.errorJson(ctx.mapper(), o.getError()));
            }
        }
        result.put("count", outcomes.size());
        result.put("succeeded", succeeded);
        return result;
    }

    private static ExtractionResult extractFields(ActionContext ctx, PageHandle page, Map<String, LogicalTarget> targets) {
        return ctx.fieldExtractor().extract(page, ctx.site(page), targets, ctx.resolverSettings());
    }

    private static JsonNode extractionJson(ActionContext ctx, ExtractionResult extraction) {
        ObjectNode result = ctx.object();
        result.put("url", extraction.getUrl());
        result.set("data", ctx.json(extraction.data()));
        ObjectNode fields = result.putObject("meta").putObject("fields");
        for (Map.Entry<String, FieldValue> e : extraction.getFields().entrySet()) {
            fields.set(e.getKey(), ctx.json(e.getValue()));
        }
        return result;
    }

    /**
     * Builds the target of {@code resolve}/{@code capture_structure}: a free-form {@code field} query goes through
     * the field parser, explicit keys win over inferred values.
     */
    private static LogicalTarget singleTarget(ActionContext ctx, String defaultName) {
        String field = ctx.text("field", null);
        LogicalTarget.Builder builder;
        if (field != null && !field.isBlank()) {
            try {
                builder = ctx.agent().parser().parse(field).toBuilder();
            } catch (IllegalArgumentException e) {
                throw new InvalidTaskException(e.getMessage(), e);
            }
            String name = ctx.text("logical_name", null);
            if (name != null && !name.isBlank()) {
                builder = rename(builder.build(), name);
            }
        } else {
            String name = defaultName != null ? defaultName : ctx.requireText("logical_name");
            builder = LogicalTarget.named(name).semanticHint(name.replace('_', ' '));
        }
        if (ctx.has("selector")) {
            builder.selectorHint(ctx.text("selector", null));
        }
        if (ctx.has("text_hint")) {
            builder.textHint(ctx.text("text_hint", null));
        }
        if (ctx.has("semantic_hint")) {
            builder.semanticHint(ctx.text("semantic_hint", null));
        }
        if (ctx.has("type")) {
            FieldType type = FieldType.fromWireName(ctx.text("type", null));
            if (type == null) {
                throw new InvalidTaskException("unknown field type '" + ctx.text("type", null) + "'");
            }
            builder.fieldType(type);
        }
        return builder.mandatory(true).build();
    }

    private static LogicalTarget.Builder rename(LogicalTarget parsed, String name) {
        return LogicalTarget.named(name)
                .selectorHint(parsed.getSelectorHint())
                .textHint(parsed.getTextHint())
                .semanticHint(parsed.getSemanticHint())
                .fieldType(parsed.getFieldType())
                .attribute(parsed.getAttribute());
    }

    /**
     * For a comma-separated scope list, picks the first alternative that matches anything, so that
     * {@code main, article, body} prefers {@code main} over the enclosing {@code body}.
     */
    static Locator firstMatchingScope(PageProvider provider, PageHandle page, String scope) {
        if (scope == null || scope.isBlank()) {
            return null;
        }
        Locator whole = Locator.parse(scope);
        if (whole.getKind() != Locator.Kind.CSS || !scope.contains(",")) {
            return whole;
        }
        for (String part : scope.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            Locator candidate = Locator.css(part.trim());
            if (!provider.evaluate(page, candidate).isEmpty()) {
                return candidate;
            }
        }
        return whole;
    }

    static DomTree snapshot(ActionContext ctx, PageHandle page) {
        return new DomTree(ctx.agent().provider().snapshot(page, ctx.config().getExtraction().getMaxSnapshotNodes()));
    }
}
