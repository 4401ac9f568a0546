package dev.scriptorium.crawl;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Top-level reply of the Crawl4AI {@code /crawl} endpoint: one page result per requested URL.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiResponse(boolean success, List<Crawl4AiPageResult> results) {
    public Crawl4AiResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
