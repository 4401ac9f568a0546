package dev.scriptorium.crawl;

import java.net.URI;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapParser;
import crawlercommons.sitemaps.SiteMapURL;

/**
 * Resolves a sitemap URL into the page URLs it lists, using crawler-commons.
 *
 * <p>The parser runs in lenient mode: {@code <loc>} entries are accepted with or without the
 * sitemap namespace and regardless of whether they sit under the sitemap's own path. A sitemap
 * index is expanded one level into its child sitemaps. Every failure (non-200 status, network
 * error, oversized or malformed document) yields an empty list; the caller treats that as no work.
 * Downloads use the same connect and read timeouts as the Crawl4AI client.
 */
@Component
public class SitemapResolver {

    private static final Logger log = LoggerFactory.getLogger(SitemapResolver.class);

    private final RestClient httpClient;
    private final long maxSitemapSizeBytes;

    public SitemapResolver(RestClient.Builder restClientBuilder, Crawl4AiProperties props) {
        this.httpClient = restClientBuilder
                .requestFactory(Crawl4AiConfig.requestFactory(props))
                .defaultHeader(HttpHeaders.ACCEPT, "*/*")
                .build();
        this.maxSitemapSizeBytes = props.maxSitemapSizeBytes();
    }

    /**
     * Fetch a sitemap and return the URLs it lists, in document order.
     * Duplicates are left for the fetch stage to collapse.
     *
     * @param sitemapUrl URL of the sitemap or sitemap index
     * @return listed page URLs, or an empty list if the sitemap is unavailable or unparseable
     */
    public List<String> resolve(String sitemapUrl) {
        AbstractSiteMap parsed = fetchAndParse(sitemapUrl);
        if (parsed == null) {
            return List.of();
        }
        if (parsed instanceof SiteMapIndex index) {
            List<String> urls = new ArrayList<>();
            for (AbstractSiteMap child : index.getSitemaps()) {
                String childUrl = child.getUrl().toString();
                AbstractSiteMap childMap = fetchAndParse(childUrl);
                if (childMap instanceof SiteMap siteMap) {
                    urls.addAll(extractUrls(siteMap));
                } else if (childMap != null) {
                    log.debug("Skipping nested sitemap index {}", childUrl);
                }
            }
            log.info("Sitemap index {} resolved to {} URLs from {} sitemaps",
                    sitemapUrl, urls.size(), index.getSitemaps().size());
            return List.copyOf(urls);
        }
        if (parsed instanceof SiteMap siteMap) {
            List<String> urls = extractUrls(siteMap);
            log.info("Sitemap {} lists {} URLs", sitemapUrl, urls.size());
            return urls;
        }
        return List.of();
    }

    private @Nullable AbstractSiteMap fetchAndParse(String sitemapUrl) {
        try {
            byte[] content = fetchSitemap(sitemapUrl);
            if (content == null) {
                return null;
            }
            SiteMapParser parser = new SiteMapParser(false);
            return parser.parseSiteMap(content, URI.create(sitemapUrl).toURL());
        } catch (Exception e) {
            log.warn("Could not read sitemap {}: {}", sitemapUrl, e.getMessage());
            return null;
        }
    }

    /**
     * Fetch sitemap content; anything but a non-empty 200 response within the size limit is null.
     */
    private byte @Nullable [] fetchSitemap(String sitemapUrl) {
        ResponseEntity<byte[]> response = httpClient.get()
                .uri(URI.create(sitemapUrl))
                .retrieve()
                .toEntity(byte[].class);
        if (response.getStatusCode().value() != 200) {
            log.warn("Sitemap {} returned HTTP {}", sitemapUrl, response.getStatusCode().value());
            return null;
        }
        byte[] content = response.getBody();
        if (content == null || content.length == 0) {
            log.warn("Sitemap {} is empty", sitemapUrl);
            return null;
        }
        if (content.length > maxSitemapSizeBytes) {
            log.warn("Sitemap at {} exceeds size limit ({} bytes > {} bytes), skipping",
                    sitemapUrl, content.length, maxSitemapSizeBytes);
            return null;
        }
        return content;
    }

    private List<String> extractUrls(SiteMap siteMap) {
        return siteMap.getSiteMapUrls().stream()
                .map(SiteMapURL::getUrl)
                .map(URL::toString)
                .toList();
    }
}
