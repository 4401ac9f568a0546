package dev.scriptorium.crawl;

import java.time.Duration;

/**
 * Fetches one page and converts it to Markdown.
 *
 * <p>Implementations must not throw for per-URL problems: network errors, timeouts and non-success
 * responses are reported as {@link FetchResult.Failure}. Internal links must be absolute and
 * same-origin with the fetched page.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * Fetch a page.
     *
     * @param url the page URL
     * @param timeout upper bound for the whole fetch
     * @return the fetch outcome for this URL
     */
    FetchResult fetchPage(String url, Duration timeout);
}
