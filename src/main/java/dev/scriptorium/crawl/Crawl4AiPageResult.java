package dev.scriptorium.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/** Result for one page in a {@link Crawl4AiResponse}: Markdown plus links grouped by kind. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiPageResult(
        String url,
        boolean success,
        @Nullable String status_code,
        @Nullable Crawl4AiMarkdown markdown,
        @Nullable Map<String, List<Crawl4AiLink>> links,
        @Nullable String error_message) {
    public Crawl4AiPageResult {
        links =
                links == null
                        ? Map.of()
                        : links.entrySet().stream()
                                .filter(e -> e.getValue() != null)
                                .collect(
                                        Collectors.toUnmodifiableMap(
                                                Map.Entry::getKey, e -> List.copyOf(e.getValue())));
    }

    /** Hrefs of the links the sidecar classified as internal, in page order. */
    public List<String> internalLinkHrefs() {
        if (links == null) {
            return List.of();
        }
        return links.getOrDefault("internal", List.of()).stream()
                .map(Crawl4AiLink::href)
                .filter(Objects::nonNull)
                .toList();
    }
}
