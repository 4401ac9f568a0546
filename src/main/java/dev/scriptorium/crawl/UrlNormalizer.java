package dev.scriptorium.crawl;

import java.net.URI;
import java.net.URISyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for the URL comparisons done while crawling.
 * The dedup key of a URL is the URL with its fragment removed; nothing else is rewritten,
 * so two URLs differing only in {@code #section} are the same page.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Strip the fragment ({@code #...}) from a URL.
     *
     * @param url the URL to normalize
     * @return the URL without its fragment; null or blank input is returned unchanged
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    /**
     * Extract the origin (scheme://host[:port]) from a full URL.
     * Default ports (80 for HTTP, 443 for HTTPS) are omitted; scheme and host are lowercased.
     *
     * @param url the URL to extract the origin from
     * @return the origin, or the input unchanged if malformed
     */
    public static String normalizeToBase(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                log.debug("URL missing scheme or host, returning unchanged: {}", url);
                return url;
            }
            String scheme = uri.getScheme().toLowerCase();
            String host = uri.getHost().toLowerCase();
            int port = uri.getPort();
            if (port == -1 || isDefaultPort(scheme, port)) {
                return scheme + "://" + host;
            }
            return scheme + "://" + host + ":" + port;
        } catch (URISyntaxException e) {
            log.debug("Malformed URL, returning unchanged: {}", url);
            return url;
        }
    }

    /**
     * Check if a candidate URL has the same origin as the page it was found on.
     *
     * @param pageUrl the URL of the page defining the origin
     * @param candidateUrl the URL to check
     * @return true if both parse as absolute URLs with equal origins
     */
    public static boolean isSameSite(String pageUrl, String candidateUrl) {
        if (pageUrl == null || candidateUrl == null) {
            return false;
        }
        try {
            URI page = new URI(pageUrl);
            URI candidate = new URI(candidateUrl);
            if (page.getScheme() == null || candidate.getScheme() == null
                    || page.getHost() == null || candidate.getHost() == null) {
                return false;
            }
        } catch (URISyntaxException e) {
            return false;
        }
        return normalizeToBase(pageUrl).equals(normalizeToBase(candidateUrl));
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
