package dev.aparikh.hybridsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings of the Solr server, bound from {@code solr.*}.
 *
 * @param url base URL of the Solr server; {@code /solr/} is appended when missing
 */
@ConfigurationProperties(prefix = "solr")
public record SolrConfigurationProperties(@DefaultValue("http://localhost:8983") String url) {
}
