package dev.scriptorium.crawl;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives the {@link PageFetcher} for a set of seed URLs according to a {@link FetchStrategy}.
 *
 * <p>Fetches run on the shared fetch executor, gated by a semaphore holding {@code maxConcurrent}
 * permits per batch. A permit is handed back only when the fetch task itself ends, so no more than
 * {@code maxConcurrent} fetches of a batch ever run at once, even when the orchestrator has already
 * given up on a slow one. Each fetch has its own deadline; exceeding it, throwing, or being
 * interrupted turns into a {@link FetchResult.Failure} for that URL and never aborts the run.
 *
 * <p>For recursive crawls the levels are strictly sequential: level n+1 is built from the links of
 * level n only after every fetch of level n has resolved. All {@link CrawlState} mutation happens on
 * the calling thread.
 */
@Service
public class FetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(60);

    private static final long SLOT_POLL_MS = 200;

    private final PageFetcher pageFetcher;
    private final ExecutorService fetchExecutor;

    public FetchOrchestrator(PageFetcher pageFetcher,
                             @Qualifier("fetchExecutor") ExecutorService fetchExecutor) {
        this.pageFetcher = pageFetcher;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * Fetch with the default per-fetch timeout.
     *
     * @see #fetch(List, FetchStrategy, int, Duration)
     */
    public List<FetchResult> fetch(List<String> seeds, FetchStrategy strategy, int maxConcurrent) {
        return fetch(seeds, strategy, maxConcurrent, DEFAULT_FETCH_TIMEOUT);
    }

    /**
     * Fetch the seeds with the given strategy.
     *
     * <ul>
     *   <li>{@code Single}: the first seed, as-is; the one result is returned even on failure.</li>
     *   <li>{@code Batch}: every distinct normalized seed, once; successes and failures are returned
     *       in input order.</li>
     *   <li>{@code Recursive}: breadth-first through internal links for at most {@code maxDepth}
     *       levels; only successes with content are returned, in visit order.</li>
     * </ul>
     *
     * @param seeds         seed URLs
     * @param strategy      expansion strategy
     * @param maxConcurrent maximum fetches in flight within one batch
     * @param fetchTimeout  deadline for each individual fetch
     * @return the fetch results
     */
    public List<FetchResult> fetch(List<String> seeds, FetchStrategy strategy,
                                   int maxConcurrent, Duration fetchTimeout) {
        Objects.requireNonNull(seeds, "seeds must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(fetchTimeout, "fetchTimeout must not be null");
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive, got " + maxConcurrent);
        }
        if (fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            throw new IllegalArgumentException("fetchTimeout must be positive, got " + fetchTimeout);
        }
        if (seeds.isEmpty()) {
            return List.of();
        }

        if (strategy instanceof FetchStrategy.Recursive recursive) {
            return fetchRecursive(seeds, recursive.maxDepth(), maxConcurrent, fetchTimeout);
        }
        if (strategy instanceof FetchStrategy.Batch) {
            List<String> distinct = seeds.stream()
                    .map(UrlNormalizer::normalize)
                    .filter(url -> url != null && !url.isBlank())
                    .distinct()
                    .toList();
            log.info("Fetching batch of {} URLs (max {} concurrent)", distinct.size(), maxConcurrent);
            return fetchBatch(distinct, maxConcurrent, fetchTimeout);
        }
        return fetchBatch(List.of(seeds.get(0)), 1, fetchTimeout);
    }

    private List<FetchResult> fetchRecursive(List<String> seeds, int maxDepth,
                                             int maxConcurrent, Duration fetchTimeout) {
        CrawlState state = CrawlState.seeded(seeds);
        List<FetchResult> pages = new ArrayList<>();

        while (state.depth() < maxDepth && state.hasFrontier()) {
            List<String> frontier = state.frontier();
            log.info("Crawling level {}/{}: {} URLs", state.depth() + 1, maxDepth, frontier.size());

            List<FetchResult> results = fetchBatch(frontier, maxConcurrent, fetchTimeout);
            for (FetchResult result : results) {
                if (result instanceof FetchResult.Success success && success.hasContent()) {
                    pages.add(success);
                }
            }
            state.completeLevel(results);
        }

        log.info("Crawl finished after {} levels: {} pages with content, {} URLs visited",
                state.depth(), pages.size(), state.visited().size());
        return pages;
    }

    /**
     * Fetch every URL once with at most {@code maxConcurrent} fetches running. Results come back
     * in the order of {@code urls}.
     */
    List<FetchResult> fetchBatch(List<String> urls, int maxConcurrent, Duration fetchTimeout) {
        Semaphore slots = new Semaphore(maxConcurrent);
        List<PendingFetch> pending = new ArrayList<>(urls.size());
        boolean interrupted = false;

        for (String url : urls) {
            if (interrupted) {
                pending.add(PendingFetch.resolved(FetchResult.failure(url, "Fetch interrupted")));
                continue;
            }
            try {
                acquireSlot(slots, pending);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                pending.add(PendingFetch.resolved(FetchResult.failure(url, "Fetch interrupted")));
                continue;
            }
            long deadline = System.nanoTime() + fetchTimeout.toNanos();
            try {
                Future<FetchResult> future =
                        fetchExecutor.submit(() -> fetchWithinDeadline(url, fetchTimeout, slots));
                pending.add(new PendingFetch(url, future, deadline, null));
            } catch (RejectedExecutionException e) {
                slots.release();
                log.warn("Fetch executor rejected {}: {}", url, e.getMessage());
                pending.add(PendingFetch.resolved(FetchResult.failure(url, "Fetch rejected: " + e.getMessage())));
            }
        }

        List<FetchResult> results = new ArrayList<>(pending.size());
        for (PendingFetch fetch : pending) {
            FetchResult result = await(fetch, fetchTimeout);
            if (result instanceof FetchResult.Failure failure) {
                log.warn("Failed to fetch {}: {}", failure.url(), failure.errorMessage());
            }
            results.add(result);
        }
        return results;
    }

    /**
     * Wait for a free slot, cancelling fetches that overran their deadline while waiting.
     */
    private void acquireSlot(Semaphore slots, List<PendingFetch> pending) throws InterruptedException {
        while (!slots.tryAcquire(SLOT_POLL_MS, TimeUnit.MILLISECONDS)) {
            long now = System.nanoTime();
            for (PendingFetch fetch : pending) {
                if (fetch.future() != null && !fetch.future().isDone() && now - fetch.deadlineNanos() > 0) {
                    fetch.future().cancel(true);
                }
            }
        }
    }

    private FetchResult fetchWithinDeadline(String url, Duration fetchTimeout, Semaphore slots) {
        long started = System.nanoTime();
        try {
            FetchResult result = pageFetcher.fetchPage(url, fetchTimeout);
            if (result == null) {
                return FetchResult.failure(url, "Page fetcher returned no result");
            }
            if (System.nanoTime() - started > fetchTimeout.toNanos()) {
                return FetchResult.failure(url, timedOut(fetchTimeout));
            }
            return result;
        } catch (RuntimeException e) {
            log.debug("Page fetcher threw for {}", url, e);
            return FetchResult.failure(url, describe(e));
        } finally {
            slots.release();
        }
    }

    private FetchResult await(PendingFetch fetch, Duration fetchTimeout) {
        if (fetch.resolved() != null) {
            return fetch.resolved();
        }
        long remaining = fetch.deadlineNanos() - System.nanoTime();
        try {
            return fetch.future().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException | CancellationException e) {
            fetch.future().cancel(true);
            return FetchResult.failure(fetch.url(), timedOut(fetchTimeout));
        } catch (ExecutionException e) {
            return FetchResult.failure(fetch.url(), describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fetch.future().cancel(true);
            return FetchResult.failure(fetch.url(), "Fetch interrupted");
        }
    }

    private static String timedOut(Duration fetchTimeout) {
        return "Timed out after " + fetchTimeout.toMillis() + " ms";
    }

    private static String describe(Throwable e) {
        if (e == null) {
            return "Unknown error";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** A submitted fetch, or one that was resolved without being submitted. */
    private record PendingFetch(String url, @Nullable Future<FetchResult> future, long deadlineNanos,
                                @Nullable FetchResult resolved) {
        static PendingFetch resolved(FetchResult result) {
            return new PendingFetch(result.url(), null, 0L, result);
        }
    }
}
