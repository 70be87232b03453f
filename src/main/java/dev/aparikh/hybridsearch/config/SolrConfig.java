package dev.aparikh.hybridsearch.config;

import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.HttpJdkSolrClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Creates the SolrJ client shared by the lexical source, the vector source and the document text
 * lookup.
 *
 * <p>The configured URL is normalized so that it always ends in {@code /solr/}:</p>
 *
 * <ul>
 *   <li>{@code http://localhost:8983} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/solr} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/solr/} → unchanged
 * </ul>
 *
 * <p>The client is the JDK {@code HttpClient} based {@link HttpJdkSolrClient}, so SolrJ brings no
 * Jetty client onto the classpath next to the embedded web server.</p>
 *
 * <p>A retrieval that misses its deadline is abandoned, not interrupted: the JDK client does not
 * react to thread interruption. The request timeout is therefore the longer of the two retrieval
 * timeouts, so an abandoned Solr call gives its worker thread back no later than that.</p>
 *
 * @see SolrConfigurationProperties
 */
@Configuration
@EnableConfigurationProperties(SolrConfigurationProperties.class)
public class SolrConfig {

    private static final Duration MAX_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    private static final String SOLR_PATH = "solr/";

    @Bean(destroyMethod = "close")
    SolrClient solrClient(SolrConfigurationProperties properties, HybridSearchProperties hybridProperties) {
        long requestTimeoutMs = requestTimeout(hybridProperties.retrieval()).toMillis();
        long connectionTimeoutMs = Math.min(MAX_CONNECTION_TIMEOUT.toMillis(), requestTimeoutMs);
        return new HttpJdkSolrClient.Builder(normalizeUrl(properties.url()))
                .withConnectionTimeout(connectionTimeoutMs, TimeUnit.MILLISECONDS)
                .withIdleTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .withRequestTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    static Duration requestTimeout(HybridSearchProperties.Retrieval retrieval) {
        Duration lexical = retrieval.lexicalTimeout();
        Duration vector = retrieval.vectorTimeout();
        return lexical.compareTo(vector) >= 0 ? lexical : vector;
    }

    static String normalizeUrl(String url) {
        String normalized = url.endsWith("/") ? url : url + "/";
        if (!normalized.contains("/" + SOLR_PATH)) {
            normalized = normalized + SOLR_PATH;
        }
        return normalized;
    }
}
