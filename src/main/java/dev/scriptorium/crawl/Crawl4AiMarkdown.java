package dev.scriptorium.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

/**
 * Markdown renderings of a page. {@code fitMarkdown} has boilerplate pruned and is preferred.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Crawl4AiMarkdown(@Nullable String rawMarkdown, @Nullable String fitMarkdown) {}
