package io.hearthwarrio.pagelens.core.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.hearthwarrio.pagelens.core.LocatorCandidate;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.page.Locator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link InMemorySelectorCache} persisted to a single JSON file.
 * <p>
 * The file is read once on construction and rewritten after every mutation (write to a temporary sibling, then
 * move over the original). A missing file starts an empty cache; an unreadable one is logged and ignored.
 */
public class FileSelectorCache extends InMemorySelectorCache {

    private static final Logger logger = LoggerFactory.getLogger(FileSelectorCache.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public FileSelectorCache(Path file, Duration ttl, Clock clock) {
        super(ttl, clock);
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        load();
    }

    public Path getFile() {
        return file;
    }

    @Override
    protected void onChange() {
        flush();
    }

    /**
     * Writes the current entries to disk. IO errors are logged; the in-memory state stays authoritative.
     */
    public void flush() {
        writeLock.lock();
        try {
            CacheFile payload = new CacheFile();
            for (SelectorCacheEntry e : entries()) {
                payload.entries.add(StoredEntry.from(e));
            }
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), payload);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            logger.warn("Could not write selector cache {}: {}", file, e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }

    private void load() {
        if (!Files.isRegularFile(file)) {
            logger.debug("Selector cache {} does not exist yet, starting empty", file);
            return;
        }
        try {
            CacheFile payload = objectMapper.readValue(file.toFile(), CacheFile.class);
            List<SelectorCacheEntry> restored = new ArrayList<>();
            for (StoredEntry stored : payload.entries) {
                SelectorCacheEntry entry = stored.toEntry();
                if (entry != null) {
                    restored.add(entry);
                }
            }
            restore(restored);
            logger.debug("Loaded {} selector cache entries from {}", restored.size(), file);
        } catch (IOException | RuntimeException e) {
            logger.warn("Ignoring unreadable selector cache {}: {}", file, e.getMessage());
        }
    }

    static final class CacheFile {
        @JsonProperty("entries")
        public List<StoredEntry> entries = new ArrayList<>();
    }

    static final class StoredEntry {
        @JsonProperty("site")
        public String site;
        @JsonProperty("logical_name")
        public String logicalName;
        @JsonProperty("locator")
        public String locator;
        @JsonProperty("locator_kind")
        public String locatorKind;
        @JsonProperty("strategy")
        public String strategy;
        @JsonProperty("confidence")
        public double confidence;
        @JsonProperty("node_depth")
        public int nodeDepth = -1;
        @JsonProperty("hit_count")
        public long hitCount;
        @JsonProperty("last_verified_at")
        public String lastVerifiedAt;

        static StoredEntry from(SelectorCacheEntry e) {
            StoredEntry s = new StoredEntry();
            LocatorCandidate c = e.getCandidate();
            s.site = e.getSite();
            s.logicalName = e.getLogicalName();
            s.locator = c.getLocator().getExpression();
            s.locatorKind = c.getLocator().getKind().name();
            s.strategy = c.getStrategy().wireName();
            s.confidence = c.getConfidence();
            s.nodeDepth = c.getNodeDepth();
            s.hitCount = e.getHitCount();
            s.lastVerifiedAt = e.getLastVerifiedAt().toString();
            return s;
        }

        SelectorCacheEntry toEntry() {
            if (site == null || logicalName == null || locator == null || locator.isBlank() || lastVerifiedAt == null) {
                return null;
            }
            Locator parsed = "XPATH".equalsIgnoreCase(locatorKind) ? Locator.xpath(locator) : Locator.css(locator);
            StrategyTag tag = strategy == null ? StrategyTag.CACHED : StrategyTag.fromWireName(strategy);
            double conf = Math.max(0.0, Math.min(1.0, confidence));
            return new SelectorCacheEntry(
                    site,
                    logicalName,
                    new LocatorCandidate(parsed, tag, conf, nodeDepth),
                    hitCount,
                    Instant.parse(lastVerifiedAt)
            );
        }
    }
}
