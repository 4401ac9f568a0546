package dev.scriptorium.crawl;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link PageFetcher} backed by the Crawl4AI sidecar's {@code /crawl} endpoint.
 * The sidecar renders the page in headless Chromium and returns Markdown plus the links it found.
 */
@Service
public class Crawl4AiClient implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(Crawl4AiClient.class);

    private final RestClient restClient;

    public Crawl4AiClient(@Qualifier("crawl4AiRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Fetch a single URL via the sidecar.
     * Uses PruningContentFilter for boilerplate removal; the timeout is forwarded as the page timeout.
     * Retries on transient RestClientException with exponential backoff.
     */
    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${scriptorium.crawl4ai.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${scriptorium.crawl4ai.retry.delay-ms}",
                    multiplierExpression = "${scriptorium.crawl4ai.retry.multiplier}"
            )
    )
    public FetchResult fetchPage(String url, Duration timeout) {
        Crawl4AiResponse response = restClient.post()
                .uri("/crawl")
                .body(buildRequest(url, timeout))
                .retrieve()
                .body(Crawl4AiResponse.class);

        if (response == null || !response.success() || response.results().isEmpty()) {
            return FetchResult.failure(url, "Crawl4AI returned no results for " + url);
        }

        Crawl4AiPageResult page = response.results().get(0);
        if (!page.success()) {
            String reason = page.error_message() != null
                    ? page.error_message()
                    : "Crawl4AI reported failure (status " + page.status_code() + ")";
            return FetchResult.failure(url, reason);
        }

        return FetchResult.success(url, extractMarkdown(page.markdown()),
                sameSiteLinks(url, page.internalLinkHrefs()));
    }

    @Recover
    FetchResult recoverFetch(RestClientException e, String url, Duration timeout) {
        log.warn("Crawl4AI request failed after retries for {}: {}", url, e.getMessage());
        return FetchResult.failure(url, e.getMessage());
    }

    /**
     * Prefer fitMarkdown (boilerplate-removed) over rawMarkdown.
     */
    private String extractMarkdown(@Nullable Crawl4AiMarkdown markdown) {
        if (markdown == null) {
            return "";
        }
        if (markdown.fitMarkdown() != null && !markdown.fitMarkdown().isBlank()) {
            return markdown.fitMarkdown();
        }
        return markdown.rawMarkdown() != null ? markdown.rawMarkdown() : "";
    }

    /**
     * Resolve hrefs against the page URL and keep those on the page's origin.
     */
    private Set<String> sameSiteLinks(String pageUrl, List<String> hrefs) {
        Set<String> links = new LinkedHashSet<>();
        for (String href : hrefs) {
            String absolute = resolve(pageUrl, href);
            if (absolute != null && UrlNormalizer.isSameSite(pageUrl, absolute)) {
                links.add(absolute);
            }
        }
        return links;
    }

    private @Nullable String resolve(String pageUrl, @Nullable String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        try {
            return URI.create(pageUrl).resolve(href.trim()).toString();
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unparseable link {} on {}", href, pageUrl);
            return null;
        }
    }

    private Crawl4AiRequest buildRequest(String url, Duration timeout) {
        return new Crawl4AiRequest(
                List.of(url),
                Map.of("type", "BrowserConfig", "params", Map.of("headless", true, "verbose", false)),
                Map.of("type", "CrawlerRunConfig", "params", Map.of(
                        "cache_mode", "bypass",
                        "stream", false,
                        "page_timeout", timeout.toMillis(),
                        "markdown_generator", Map.of(
                                "type", "DefaultMarkdownGenerator",
                                "params", Map.of(
                                        "content_filter", Map.of(
                                                "type", "PruningContentFilter",
                                                "params", Map.of("threshold", 0.48, "min_word_threshold", 20)
                                        )
                                )
                        )
                ))
        );
    }
}
