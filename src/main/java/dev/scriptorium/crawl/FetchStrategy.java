package dev.scriptorium.crawl;

/**
 * How the {@link FetchOrchestrator} expands its seed URLs.
 */
public sealed interface FetchStrategy permits FetchStrategy.Single, FetchStrategy.Batch, FetchStrategy.Recursive {

    static FetchStrategy single() {
        return Single.INSTANCE;
    }

    static FetchStrategy batch() {
        return Batch.INSTANCE;
    }

    static FetchStrategy recursive(int maxDepth) {
        return new Recursive(maxDepth);
    }

    /** Fetch exactly one URL. */
    enum Single implements FetchStrategy {
        INSTANCE
    }

    /** Fetch every seed URL once, without following links. */
    enum Batch implements FetchStrategy {
        INSTANCE
    }

    /**
     * Breadth-first crawl through internal links.
     *
     * @param maxDepth number of BFS levels to fetch; the seeds are level one
     */
    record Recursive(int maxDepth) implements FetchStrategy {
        public Recursive {
            if (maxDepth <= 0) {
                throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
            }
        }
    }
}
