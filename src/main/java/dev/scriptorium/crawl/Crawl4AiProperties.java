package dev.scriptorium.crawl;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the Crawl4AI sidecar and for sitemap downloads.
 *
 * @param baseUrl             sidecar base URL (e.g. {@code http://localhost:11235})
 * @param connectTimeoutMs    TCP connect timeout
 * @param readTimeoutMs       response read timeout
 * @param maxSitemapSizeBytes sitemaps larger than this are skipped
 * @param retry               retry policy for transient sidecar errors
 */
@ConfigurationProperties(prefix = "scriptorium.crawl4ai")
public record Crawl4AiProperties(
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        long maxSitemapSizeBytes,
        Retry retry
) {
    public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
