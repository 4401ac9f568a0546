package dev.scriptorium.crawl;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Classifies an input URL into a {@link SourceType}.
 *
 * <p>Rules are applied in priority order and are case-sensitive:
 * <ol>
 *   <li>{@link SourceType#SITEMAP} if the URL ends in {@code sitemap.xml} or its path contains
 *       {@code sitemap}</li>
 *   <li>{@link SourceType#TEXT_RESOURCE} if the URL ends in {@code .txt}</li>
 *   <li>{@link SourceType#GENERIC_PAGE} otherwise</li>
 * </ol>
 * Because the sitemap rule wins, {@code https://host/sitemap.txt} is a sitemap.
 */
public final class SourceClassifier {

    private static final String SITEMAP_SUFFIX = "sitemap.xml";
    private static final String SITEMAP_MARKER = "sitemap";
    private static final String TEXT_SUFFIX = ".txt";

    private SourceClassifier() {
        // utility class
    }

    /**
     * Classify a URL.
     *
     * @param url the input URL
     * @return the source type; never null
     */
    public static SourceType classify(String url) {
        if (url == null) {
            return SourceType.GENERIC_PAGE;
        }
        if (url.endsWith(SITEMAP_SUFFIX) || pathOf(url).contains(SITEMAP_MARKER)) {
            return SourceType.SITEMAP;
        }
        if (url.endsWith(TEXT_SUFFIX)) {
            return SourceType.TEXT_RESOURCE;
        }
        return SourceType.GENERIC_PAGE;
    }

    /** Path component of the URL, or the raw string when it does not parse. */
    private static String pathOf(String url) {
        try {
            String path = new URI(url).getPath();
            return path == null ? "" : path;
        } catch (URISyntaxException e) {
            return url;
        }
    }
}
