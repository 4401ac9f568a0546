package dev.scriptorium.crawl;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Breadth-first crawl bookkeeping for one {@link FetchOrchestrator} run: the normalized URLs already
 * visited, the frontier due at the current level and the number of completed levels.
 *
 * <p>Not thread-safe. Only the orchestrator's control thread touches it, between batches.
 */
public final class CrawlState {

    private final Set<String> visited = new HashSet<>();
    private Set<String> frontier = new LinkedHashSet<>();
    private int depth;

    private CrawlState() {
    }

    /**
     * Start a crawl from the given seeds. Seeds are normalized and deduplicated in order.
     *
     * @param seeds seed URLs
     * @return a state at depth zero whose frontier holds the normalized seeds
     */
    public static CrawlState seeded(Collection<String> seeds) {
        CrawlState state = new CrawlState();
        state.frontier = normalizeAll(seeds, state.visited);
        return state;
    }

    /** URLs to fetch at the current level, in discovery order. */
    public List<String> frontier() {
        return List.copyOf(frontier);
    }

    public boolean hasFrontier() {
        return !frontier.isEmpty();
    }

    /** Number of levels fetched so far. */
    public int depth() {
        return depth;
    }

    public Set<String> visited() {
        return Set.copyOf(visited);
    }

    /**
     * Close the current level: every frontier URL becomes visited, whatever its fetch outcome, and the
     * internal links of successful fetches that have not been visited form the next frontier.
     *
     * @param results the fetch results for the current frontier
     */
    void completeLevel(Collection<FetchResult> results) {
        visited.addAll(frontier);
        Set<String> links = new LinkedHashSet<>();
        for (FetchResult result : results) {
            if (result instanceof FetchResult.Success success) {
                links.addAll(success.internalLinks());
            }
        }
        frontier = normalizeAll(links, visited);
        depth++;
    }

    private static Set<String> normalizeAll(Collection<String> urls, Set<String> exclude) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String url : urls) {
            String key = UrlNormalizer.normalize(url);
            if (key != null && !key.isBlank() && !exclude.contains(key)) {
                normalized.add(key);
            }
        }
        return normalized;
    }

    @Override
    public String toString() {
        return "CrawlState[depth=" + depth + ", visited=" + visited.size()
                + ", frontier=" + frontier.size() + "]";
    }
}
