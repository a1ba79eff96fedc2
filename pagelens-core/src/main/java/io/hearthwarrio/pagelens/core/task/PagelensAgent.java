package io.hearthwarrio.pagelens.core.task;

import io.hearthwarrio.pagelens.core.ResolutionListener;
import io.hearthwarrio.pagelens.core.ResolutionStrategies;
import io.hearthwarrio.pagelens.core.SelectorResolver;
import io.hearthwarrio.pagelens.core.Slf4jResolutionListener;
import io.hearthwarrio.pagelens.core.cache.FileSelectorCache;
import io.hearthwarrio.pagelens.core.cache.InMemorySelectorCache;
import io.hearthwarrio.pagelens.core.cache.SelectorCache;
import io.hearthwarrio.pagelens.core.config.ConfigLoader;
import io.hearthwarrio.pagelens.core.config.PagelensConfig;
import io.hearthwarrio.pagelens.core.config.SelfHealingSettings;
import io.hearthwarrio.pagelens.core.nlq.FieldQueryParser;
import io.hearthwarrio.pagelens.core.page.InteractionDriver;
import io.hearthwarrio.pagelens.core.page.NetworkLog;
import io.hearthwarrio.pagelens.core.page.NetworkObserver;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import io.hearthwarrio.pagelens.core.page.StealthProvider;
import io.hearthwarrio.pagelens.core.pool.PagePool;
import io.hearthwarrio.pagelens.core.pool.PooledPage;
import io.hearthwarrio.pagelens.core.pool.TabOrchestrator;
import io.hearthwarrio.pagelens.core.session.FileSessionStore;
import io.hearthwarrio.pagelens.core.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-level wiring of the agent: page provider and its collaborators, page pool, selector cache and resolver.
 * <p>
 * Pool size, acquire timeout and cache TTL are taken from the configuration passed to the builder and do not change
 * per task. Build with {@link #builder(PageProvider)}.
 */
public final class PagelensAgent implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PagelensAgent.class);

    private final PagelensConfig config;
    private final PageProvider provider;
    private final InteractionDriver interactions;
    private final NetworkObserver networkObserver;
    private final StealthProvider stealth;
    private final SessionStore sessions;
    private final SelectorCache cache;
    private final SelectorResolver resolver;
    private final PagePool pool;
    private final TabOrchestrator orchestrator;
    private final FieldQueryParser parser = new FieldQueryParser();
    private final Map<String, NetworkLog> networkLogs = new ConcurrentHashMap<>();

    private PagelensAgent(Builder b) {
        this.config = b.config;
        this.provider = b.provider;
        this.interactions = b.interactions == null ? InteractionDriver.unsupported() : b.interactions;
        this.networkObserver = b.networkObserver == null ? NetworkObserver.none() : b.networkObserver;
        this.stealth = b.stealth == null ? StealthProvider.none() : b.stealth;
        this.sessions = b.sessions == null ? new FileSessionStore(Path.of(config.getSessions().getDirectory())) : b.sessions;
        this.cache = b.cache == null ? defaultCache(config.getSelfHealing(), b.clock) : b.cache;
        this.resolver = new SelectorResolver(
                provider,
                cache,
                ResolutionStrategies.defaults(),
                b.listener == null ? new Slf4jResolutionListener() : b.listener
        );
        this.pool = new PagePool(
                provider,
                config.getBrowser().getMaxTabs(),
                Duration.ofMillis(config.getBrowser().getAcquireTimeoutMs()),
                b.clock,
                this::onPageOpened
        );
        this.orchestrator = new TabOrchestrator(pool);
    }

    public static Builder builder(PageProvider provider) {
        return new Builder(provider);
    }

    private static SelectorCache defaultCache(SelfHealingSettings settings, Clock clock) {
        Duration ttl = Duration.ofHours(settings.getCacheTtlHours());
        String file = settings.getCacheFile();
        if (file == null || file.isBlank()) {
            return new InMemorySelectorCache(ttl, clock);
        }
        return new FileSelectorCache(Path.of(file), ttl, clock);
    }

    private void onPageOpened(PageHandle handle) {
        stealth.apply(handle);
        Set<String> live = new HashSet<>();
        for (PooledPage p : pool.pages()) {
            if (p.getHandle() != null) {
                live.add(p.getHandle().id());
            }
        }
        live.add(handle.id());
        networkLogs.keySet().retainAll(live);
        networkLogs.put(handle.id(), networkObserver.record(handle));
    }

    /**
     * @return the up-to-date network log of a pool page
     */
    public NetworkLog networkLog(PageHandle handle) {
        NetworkLog log = networkObserver.record(handle);
        networkLogs.put(handle.id(), log);
        return log;
    }

    public PagelensConfig config() {
        return config;
    }

    public PageProvider provider() {
        return provider;
    }

    public InteractionDriver interactions() {
        return interactions;
    }

    public StealthProvider stealth() {
        return stealth;
    }

    public SessionStore sessions() {
        return sessions;
    }

    public SelectorCache cache() {
        return cache;
    }

    public SelectorResolver resolver() {
        return resolver;
    }

    public PagePool pool() {
        return pool;
    }

    public TabOrchestrator orchestrator() {
        return orchestrator;
    }

    public FieldQueryParser parser() {
        return parser;
    }

    /**
     * Closes all pages. The selector cache is persisted on every change, so nothing else is flushed here.
     */
    @Override
    public void close() {
        for (PooledPage p : pool.pages()) {
            if (p.getHandle() != null) {
                networkObserver.detach(p.getHandle());
            }
        }
        pool.close();
        networkLogs.clear();
        logger.debug("Agent closed");
    }

    public static final class Builder {
        private final PageProvider provider;
        private PagelensConfig config;
        private InteractionDriver interactions;
        private NetworkObserver networkObserver;
        private StealthProvider stealth;
        private SessionStore sessions;
        private SelectorCache cache;
        private ResolutionListener listener;
        private Clock clock = Clock.systemUTC();

        private Builder(PageProvider provider) {
            this.provider = Objects.requireNonNull(provider, "provider must not be null");
        }

        public Builder config(PagelensConfig config) {
            this.config = config;
            return this;
        }

        public Builder interactions(InteractionDriver interactions) {
            this.interactions = interactions;
            return this;
        }

        public Builder networkObserver(NetworkObserver networkObserver) {
            this.networkObserver = networkObserver;
            return this;
        }

        public Builder stealth(StealthProvider stealth) {
            this.stealth = stealth;
            return this;
        }

        public Builder sessions(SessionStore sessions) {
            this.sessions = sessions;
            return this;
        }

        /**
         * Overrides the cache derived from {@code self_healing.cache_file}.
         */
        public Builder cache(SelectorCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder listener(ResolutionListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public PagelensAgent build() {
            if (config == null) {
                config = new ConfigLoader().defaults();
            }
            return new PagelensAgent(this);
        }
    }
}
