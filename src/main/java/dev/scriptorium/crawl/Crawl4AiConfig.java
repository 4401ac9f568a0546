package dev.scriptorium.crawl;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to talk to the Crawl4AI sidecar.
 *
 * <p>Base URL and timeouts come from {@code scriptorium.crawl4ai.*}. The read timeout is the hard
 * ceiling for one sidecar call; per-page deadlines are shorter and are forwarded in the request.
 */
@Configuration
public class Crawl4AiConfig {

    /**
     * Creates a pre-configured {@link RestClient} targeting the sidecar.
     *
     * @param builder Spring-provided builder with common defaults
     * @param props   sidecar connection settings
     * @return a named REST client bean for injection into {@link Crawl4AiClient}
     */
    @Bean
    public RestClient crawl4AiRestClient(RestClient.Builder builder, Crawl4AiProperties props) {
        return builder.clone()
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory(props))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /** Request factory with the configured connect and read timeouts; also used for sitemap downloads. */
    static SimpleClientHttpRequestFactory requestFactory(Crawl4AiProperties props) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(props.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(props.readTimeoutMs()));
        return requestFactory;
    }
}
