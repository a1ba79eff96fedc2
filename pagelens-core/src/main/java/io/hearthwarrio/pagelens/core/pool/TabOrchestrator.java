package io.hearthwarrio.pagelens.core.pool;

import io.hearthwarrio.pagelens.core.TaskTimeoutException;
import io.hearthwarrio.pagelens.core.page.PageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the same work against several URLs on separate pool tabs.
 * <p>
 * Each URL gets tab {@code parallel_<i>}. At most {@code min(maxConcurrent, maxTabs)} units are in flight. One failed
 * unit never cancels its siblings; the result always holds one outcome per input URL, in input order.
 */
public class TabOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(TabOrchestrator.class);

    public static final String TAB_PREFIX = "parallel_";

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final PagePool pool;

    public TabOrchestrator(PagePool pool) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
    }

    /**
     * @param urls          pages to visit
     * @param maxConcurrent requested parallelism, at least 1
     * @param work          work applied after navigation
     * @return exactly {@code urls.size()} outcomes in input order
     * @throws TaskTimeoutException when the calling thread is interrupted; unfinished units are cancelled
     */
    public <T> List<UrlOutcome<T>> runParallel(List<String> urls, int maxConcurrent, ParallelWork<T> work) {
        Objects.requireNonNull(urls, "urls must not be null");
        Objects.requireNonNull(work, "work must not be null");
        if (urls.isEmpty()) {
            return List.of();
        }

        int workers = Math.max(1, Math.min(Math.min(maxConcurrent, pool.maxTabs()), urls.size()));
        ExecutorService executor = Executors.newFixedThreadPool(workers, threadFactory());
        List<Future<UrlOutcome<T>>> futures = new ArrayList<>(urls.size());
        try {
            for (int i = 0; i < urls.size(); i++) {
                String url = urls.get(i);
                String tabId = TAB_PREFIX + i;
                futures.add(executor.submit(() -> runUnit(url, tabId, work)));
            }

            List<UrlOutcome<T>> outcomes = new ArrayList<>(urls.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), urls.get(i), TAB_PREFIX + i));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private <T> UrlOutcome<T> runUnit(String url, String tabId, ParallelWork<T> work) {
        PageProvider provider = pool.provider();
        try (PageLease lease = pool.lease(tabId)) {
            provider.navigate(lease.handle(), url);
            T value = work.apply(lease.handle(), url);
            return UrlOutcome.success(url, tabId, value);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UrlOutcome.failure(url, tabId, e);
        } catch (Exception e) {
            logger.debug("Parallel unit {} for {} failed: {}", tabId, url, e.toString());
            return UrlOutcome.failure(url, tabId, e);
        }
    }

    private <T> UrlOutcome<T> await(Future<UrlOutcome<T>> future, String url, String tabId) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskTimeoutException("Interrupted while waiting for " + url);
        } catch (CancellationException e) {
            return UrlOutcome.failure(url, tabId, e);
        } catch (ExecutionException e) {
            return UrlOutcome.failure(url, tabId, e.getCause() == null ? e : e.getCause());
        }
    }

    private static ThreadFactory threadFactory() {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadId = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "pagelens-parallel-" + poolId + "-" + threadId.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
