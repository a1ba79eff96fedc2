package io.hearthwarrio.pagelens.core.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.pagelens.core.FieldType;
import io.hearthwarrio.pagelens.core.InvalidTaskException;
import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.ResolverSettings;
import io.hearthwarrio.pagelens.core.config.ExtractionSettings;
import io.hearthwarrio.pagelens.core.config.PagelensConfig;
import io.hearthwarrio.pagelens.core.download.FileDownloader;
import io.hearthwarrio.pagelens.core.extract.FieldExtractor;
import io.hearthwarrio.pagelens.core.extract.TableExtractor;
import io.hearthwarrio.pagelens.core.extract.ValueCaster;
import io.hearthwarrio.pagelens.core.nlq.FieldSpec;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.pool.PageLease;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-task view handed to {@link TaskAction}s: the agent, the effective configuration (after
 * {@code config_overrides}) and typed accessors for the task's {@code target} object.
 * <p>
 * Accessors throw {@link InvalidTaskException} for missing required keys and values of the wrong JSON type.
 */
public final class ActionContext {

    public static final String DEFAULT_TAB = "default";

    private final PagelensAgent agent;
    private final PagelensConfig config;
    private final ObjectNode target;
    private final ObjectMapper mapper;

    ActionContext(PagelensAgent agent, PagelensConfig config, JsonNode target, ObjectMapper mapper) {
        this.agent = Objects.requireNonNull(agent, "agent must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        if (target == null || target.isNull() || target.isMissingNode()) {
            this.target = mapper.createObjectNode();
        } else if (target.isObject()) {
            this.target = (ObjectNode) target;
        } else {
            throw new InvalidTaskException("target must be an object");
        }
    }

    public PagelensAgent agent() {
        return agent;
    }

    public PagelensConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode target() {
        return target;
    }

    public PageLease lease(String tabId) {
        return agent.pool().lease(tabId);
    }

    public String tabId() {
        return text("tab_id", DEFAULT_TAB);
    }

    /**
     * @return selector cache scope of the page's current URL
     */
    public String site(PageHandle page) {
        return SiteKeys.of(agent.provider().currentUrl(page), config.getSelfHealing().getCacheScope());
    }

    public ResolverSettings resolverSettings() {
        return config.getSelfHealing().toResolverSettings();
    }

    public FieldExtractor fieldExtractor() {
        ExtractionSettings extraction = config.getExtraction();
        return new FieldExtractor(
                agent.provider(),
                agent.resolver(),
                new ValueCaster(extraction.getMaxTextLength()),
                new TableExtractor(extraction.getMaxTableRows()),
                extraction.getMaxSnapshotNodes()
        );
    }

    public FileDownloader downloader() {
        return FileDownloader.from(config.getDownloads(), config.getBrowser().getUserAgent());
    }

    public ObjectNode object() {
        return mapper.createObjectNode();
    }

    public JsonNode json(Object value) {
        return mapper.valueToTree(value);
    }

    public boolean has(String key) {
        JsonNode n = target.get(key);
        return n != null && !n.isNull();
    }

    public JsonNode node(String key) {
        JsonNode n = target.get(key);
        return n == null || n.isNull() ? null : n;
    }

    public String text(String key, String defaultValue) {
        JsonNode n = node(key);
        if (n == null) {
            return defaultValue;
        }
        if (!n.isValueNode()) {
            throw new InvalidTaskException("'" + key + "' must be a string");
        }
        return n.asText();
    }

    public String requireText(String key) {
        String v = text(key, null);
        if (v == null || v.isBlank()) {
            throw new InvalidTaskException("'" + key + "' is required");
        }
        return v;
    }

    public int integer(String key, int defaultValue) {
        JsonNode n = node(key);
        if (n == null) {
            return defaultValue;
        }
        if (n.isNumber()) {
            return n.asInt();
        }
        if (n.isTextual()) {
            try {
                return Integer.parseInt(n.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidTaskException("'" + key + "' must be an integer", e);
            }
        }
        throw new InvalidTaskException("'" + key + "' must be an integer");
    }

    public double number(String key, double defaultValue) {
        JsonNode n = node(key);
        if (n == null) {
            return defaultValue;
        }
        if (n.isNumber()) {
            return n.asDouble();
        }
        if (n.isTextual()) {
            try {
                return Double.parseDouble(n.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidTaskException("'" + key + "' must be a number", e);
            }
        }
        throw new InvalidTaskException("'" + key + "' must be a number");
    }

    public boolean flag(String key, boolean defaultValue) {
        JsonNode n = node(key);
        if (n == null) {
            return defaultValue;
        }
        if (n.isBoolean()) {
            return n.asBoolean();
        }
        if (n.isTextual() || n.isNumber()) {
            return n.asBoolean();
        }
        throw new InvalidTaskException("'" + key + "' must be a boolean");
    }

    /**
     * Reads an array of strings; a single string is split on commas.
     */
    public List<String> strings(String key) {
        JsonNode n = node(key);
        List<String> out = new ArrayList<>();
        if (n == null) {
            return out;
        }
        if (n.isTextual()) {
            for (String part : n.asText().split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
            return out;
        }
        if (!n.isArray()) {
            throw new InvalidTaskException("'" + key + "' must be an array of strings");
        }
        for (JsonNode item : n) {
            if (!item.isValueNode()) {
                throw new InvalidTaskException("'" + key + "' must be an array of strings");
            }
            if (!item.asText().isBlank()) {
                out.add(item.asText().trim());
            }
        }
        return out;
    }

    /**
     * Parses the {@code fields} key: an array of free-form queries, or an object of name to spec
     * ({@code selector}, {@code type}, {@code attribute}, {@code text_hint}, {@code semantic_hint},
     * {@code mandatory}). A string spec is a selector.
     */
    public Map<String, LogicalTarget> fieldTargets(String key) {
        JsonNode fields = node(key);
        if (fields == null || fields.isEmpty()) {
            throw new InvalidTaskException("'" + key + "' must list at least one field");
        }
        Map<String, FieldSpec> specs = new LinkedHashMap<>();
        if (fields.isArray()) {
            for (JsonNode f : fields) {
                if (!f.isTextual() || f.asText().isBlank()) {
                    throw new InvalidTaskException("'" + key + "' entries must be non-empty strings");
                }
                specs.put(f.asText().trim(), FieldSpec.empty());
            }
        } else if (fields.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                specs.put(e.getKey(), fieldSpec(e.getKey(), e.getValue()));
            }
        } else {
            throw new InvalidTaskException("'" + key + "' must be an array or an object");
        }
        try {
            return agent.parser().parseAll(specs);
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskException(e.getMessage(), e);
        }
    }

    private static FieldSpec fieldSpec(String name, JsonNode spec) {
        if (spec == null || spec.isNull()) {
            return FieldSpec.empty();
        }
        if (spec.isTextual()) {
            return FieldSpec.selector(spec.asText());
        }
        if (!spec.isObject()) {
            throw new InvalidTaskException("spec of field '" + name + "' must be an object or a selector string");
        }
        String selector = spec.path("selector").asText(null);
        JsonNode selectors = spec.get("selectors");
        if (selector == null && selectors != null && selectors.isArray() && selectors.size() > 0) {
            selector = selectors.get(0).asText(null);
        }
        FieldType type = null;
        if (spec.hasNonNull("type")) {
            type = FieldType.fromWireName(spec.get("type").asText());
            if (type == null) {
                throw new InvalidTaskException("unknown type '" + spec.get("type").asText() + "' for field '" + name + "'");
            }
        }
        return new FieldSpec(
                selector,
                type,
                spec.path("attribute").asText(null),
                spec.path("text_hint").asText(null),
                spec.path("semantic_hint").asText(null),
                spec.path("mandatory").asBoolean(false)
        );
    }
}
