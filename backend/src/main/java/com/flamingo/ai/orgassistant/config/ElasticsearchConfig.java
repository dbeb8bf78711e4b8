package com.flamingo.ai.orgassistant.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.net.URI;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch client for the elasticsearch chunk store backend. Connects to every node listed in
 * {@code elasticsearch.uris} and authenticates with {@code elasticsearch.api-key} when one is set.
 */
@Configuration
@ConditionalOnProperty(name = "rag.store.backend", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchConfig {

  @Value("${elasticsearch.uris:http://localhost:9200}")
  private String[] uris;

  @Value("${elasticsearch.api-key:}")
  private String apiKey;

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client() {
    HttpHost[] hosts = hosts(uris);
    log.info("Connecting to Elasticsearch at {}", Arrays.toString(hosts));
    return Rest5Client.builder(hosts).setDefaultHeaders(defaultHeaders(apiKey)).build();
  }

  /** Uses the application's ObjectMapper so hits decode the same way the rest of the app does. */
  @Bean
  public ElasticsearchClient elasticsearchClient(
      Rest5Client rest5Client, ObjectMapper objectMapper) {
    return new ElasticsearchClient(
        new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper(objectMapper.copy())));
  }

  @VisibleForTesting
  static HttpHost[] hosts(String[] uris) {
    HttpHost[] hosts =
        Arrays.stream(uris)
            .map(String::trim)
            .filter(uri -> !uri.isEmpty())
            .map(uri -> HttpHost.create(URI.create(uri)))
            .toArray(HttpHost[]::new);
    if (hosts.length == 0) {
      throw new IllegalStateException("elasticsearch.uris must name at least one node");
    }
    return hosts;
  }

  @VisibleForTesting
  static Header[] defaultHeaders(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      return new Header[0];
    }
    return new Header[] {new BasicHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + apiKey.trim())};
  }
}
