package dev.scriptorium.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@ExtendWith(MockitoExtension.class)
class SitemapResolverTest {

    private static final String SITEMAP_URL = "https://docs.example.com/sitemap.xml";

    @Mock private RestClient.Builder restClientBuilder;

    @Mock private RestClient restClient;

    @Mock private RestClient.RequestHeadersUriSpec<?> requestHeadersUriSpec;

    private SitemapResolver resolver;

    /** Per-URL response stubs: a ResponseEntity, or a RestClientException to throw. */
    private final Map<String, Object> urlResponses = new HashMap<>();

    @BeforeEach
    @SuppressWarnings({"unchecked", "rawtypes"})
    void setUp() {
        lenient()
                .when(restClientBuilder.defaultHeader(anyString(), any(String[].class)))
                .thenReturn(restClientBuilder);
        lenient()
                .when(restClientBuilder.requestFactory(any(ClientHttpRequestFactory.class)))
                .thenReturn(restClientBuilder);
        lenient().when(restClientBuilder.build()).thenReturn(restClient);
        lenient()
                .when(restClient.get())
                .thenReturn((RestClient.RequestHeadersUriSpec) requestHeadersUriSpec);
        lenient()
                .when(requestHeadersUriSpec.uri(any(URI.class)))
                .thenAnswer(
                        invocation -> {
                            String url = invocation.getArgument(0, URI.class).toString();
                            Object registered = urlResponses.get(url);

                            RestClient.RequestHeadersSpec headersSpec = mock(RestClient.RequestHeadersSpec.class);
                            if (registered instanceof RestClientException ex) {
                                when(headersSpec.retrieve()).thenThrow(ex);
                            } else if (registered == null) {
                                when(headersSpec.retrieve())
                                        .thenThrow(new RestClientException("404 Not Found: " + url));
                            } else {
                                RestClient.ResponseSpec respSpec = mock(RestClient.ResponseSpec.class);
                                when(headersSpec.retrieve()).thenReturn(respSpec);
                                when(respSpec.toEntity(byte[].class)).thenReturn((ResponseEntity<byte[]>) registered);
                            }
                            return headersSpec;
                        });

        urlResponses.clear();
        resolver = new SitemapResolver(restClientBuilder, properties(1024 * 1024));
    }

    private static Crawl4AiProperties properties(long maxSitemapSizeBytes) {
        return new Crawl4AiProperties(
                "http://localhost:11235",
                1000,
                1000,
                maxSitemapSizeBytes,
                new Crawl4AiProperties.Retry(1, 10, 1.0));
    }

    private void stub(String url, String body) {
        urlResponses.put(url, ResponseEntity.ok(body.getBytes(StandardCharsets.UTF_8)));
    }

    private static String urlset(String... locs) {
        StringBuilder xml =
                new StringBuilder(
                        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                                + "<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">\n");
        for (String loc : locs) {
            xml.append("  <url><loc>").append(loc).append("</loc></url>\n");
        }
        return xml.append("</urlset>").toString();
    }

    @Test
    void resolvesNamespacedSitemap() {
        stub(
                SITEMAP_URL,
                urlset("https://docs.example.com/guide", "https://docs.example.com/api"));

        List<String> urls = resolver.resolve(SITEMAP_URL);

        assertThat(urls)
                .containsExactlyInAnyOrder("https://docs.example.com/guide", "https://docs.example.com/api");
    }

    @Test
    void resolvesSitemapWithoutNamespace() {
        stub(
                SITEMAP_URL,
                "<?xml version=\"1.0\"?><urlset>"
                        + "<url><loc>https://docs.example.com/one</loc></url>"
                        + "<url><loc>https://docs.example.com/two</loc></url>"
                        + "</urlset>");

        List<String> urls = resolver.resolve(SITEMAP_URL);

        assertThat(urls)
                .containsExactlyInAnyOrder("https://docs.example.com/one", "https://docs.example.com/two");
    }

    @Test
    void expandsSitemapIndex() {
        stub(
                SITEMAP_URL,
                "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                        + "<sitemapindex xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">\n"
                        + "  <sitemap><loc>https://docs.example.com/sitemap-docs.xml</loc></sitemap>\n"
                        + "  <sitemap><loc>https://docs.example.com/sitemap-missing.xml</loc></sitemap>\n"
                        + "</sitemapindex>");
        stub("https://docs.example.com/sitemap-docs.xml", urlset("https://docs.example.com/guide"));

        List<String> urls = resolver.resolve(SITEMAP_URL);

        assertThat(urls).containsExactly("https://docs.example.com/guide");
    }

    @Test
    void emptyUrlsetResolvesToNothing() {
        stub(SITEMAP_URL, urlset());

        assertThat(resolver.resolve(SITEMAP_URL)).isEmpty();
    }

    @Test
    void httpErrorResolvesToNothing() {
        urlResponses.put(SITEMAP_URL, new RestClientException("503 Service Unavailable"));

        assertThat(resolver.resolve(SITEMAP_URL)).isEmpty();
    }

    @Test
    void non200StatusResolvesToNothing() {
        urlResponses.put(SITEMAP_URL, ResponseEntity.status(HttpStatus.NO_CONTENT).body(new byte[0]));

        assertThat(resolver.resolve(SITEMAP_URL)).isEmpty();
    }

    @Test
    void emptyBodyResolvesToNothing() {
        urlResponses.put(SITEMAP_URL, ResponseEntity.ok(new byte[0]));

        assertThat(resolver.resolve(SITEMAP_URL)).isEmpty();
    }

    @Test
    void malformedXmlResolvesToNothing() {
        stub(SITEMAP_URL, "<urlset><url><loc>https://docs.example.com/broken");

        assertThat(resolver.resolve(SITEMAP_URL)).isEmpty();
    }

    @Test
    void oversizedSitemapIsSkipped() {
        resolver = new SitemapResolver(restClientBuilder, properties(64));
        stub(SITEMAP_URL, urlset("https://docs.example.com/guide", "https://docs.example.com/api"));

        assertThat(resolver.resolve(SITEMAP_URL)).isEmpty();
    }

    @Test
    void sitemapDownloadsUseTheConfiguredTimeouts() {
        ArgumentCaptor<ClientHttpRequestFactory> factory = ArgumentCaptor.forClass(ClientHttpRequestFactory.class);
        verify(restClientBuilder).requestFactory(factory.capture());

        assertThat(factory.getValue()).isInstanceOf(SimpleClientHttpRequestFactory.class);
        assertThat(ReflectionTestUtils.getField(factory.getValue(), "connectTimeout")).isEqualTo(1000);
        assertThat(ReflectionTestUtils.getField(factory.getValue(), "readTimeout")).isEqualTo(1000);
    }
}
