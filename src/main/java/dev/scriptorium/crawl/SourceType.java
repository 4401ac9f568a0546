package dev.scriptorium.crawl;

/** Kind of source behind an input URL; decides which fetch strategy the pipeline uses. */
public enum SourceType {
    /** XML sitemap (or sitemap index) listing the pages to fetch */
    SITEMAP,
    /** Plain text or Markdown resource fetched as a single document */
    TEXT_RESOURCE,
    /** Any other page; its site is crawled recursively through internal links */
    GENERIC_PAGE
}
