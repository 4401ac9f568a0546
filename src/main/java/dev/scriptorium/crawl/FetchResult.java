package dev.scriptorium.crawl;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one fetch attempt for one URL: either {@link Success} with the page's Markdown and its
 * internal links, or {@link Failure} with an error message. Built once per attempt and never
 * re-wrapped.
 */
public sealed interface FetchResult permits FetchResult.Success, FetchResult.Failure {

    /** The URL that was fetched. */
    String url();

    /** Whether the fetch produced page content. */
    boolean succeeded();

    static FetchResult success(String url, String markdown, Set<String> internalLinks) {
        return new Success(url, markdown, internalLinks);
    }

    static FetchResult failure(String url, String errorMessage) {
        return new Failure(url, errorMessage);
    }

    /**
     * A page that was fetched and converted to Markdown.
     *
     * @param url the fetched URL
     * @param markdown normalized page text; empty when the page had no extractable content
     * @param internalLinks same-origin links found on the page, in discovery order
     */
    record Success(String url, String markdown, Set<String> internalLinks) implements FetchResult {
        public Success {
            Objects.requireNonNull(url, "url must not be null");
            markdown = markdown == null ? "" : markdown;
            internalLinks = internalLinks == null
                    ? Set.of()
                    : Collections.unmodifiableSet(new LinkedHashSet<>(internalLinks));
        }

        @Override
        public boolean succeeded() {
            return true;
        }

        /** True when the page produced non-blank text. */
        public boolean hasContent() {
            return !markdown.isBlank();
        }
    }

    /**
     * A fetch that failed: network error, timeout, non-success status or sidecar error.
     *
     * @param url the URL that failed
     * @param errorMessage human-readable reason
     */
    record Failure(String url, String errorMessage) implements FetchResult {
        public Failure {
            Objects.requireNonNull(url, "url must not be null");
            errorMessage = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        }

        @Override
        public boolean succeeded() {
            return false;
        }
    }
}
