package dev.scriptorium.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** A link found on a crawled page. Only {@code href} is used for crawling. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiLink(@Nullable String href, @Nullable String text) {}
