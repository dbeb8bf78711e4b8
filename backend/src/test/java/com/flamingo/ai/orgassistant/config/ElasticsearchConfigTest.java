package com.flamingo.ai.orgassistant.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ElasticsearchConfig Tests")
class ElasticsearchConfigTest {

  @Test
  @DisplayName("Should connect to every configured node")
  void shouldParseNodeUris() {
    HttpHost[] hosts =
        ElasticsearchConfig.hosts(
            new String[] {"http://es-1:9200", " https://es-2.internal:9243 "});

    assertThat(hosts).hasSize(2);
    assertThat(hosts[0].getSchemeName()).isEqualTo("http");
    assertThat(hosts[0].getHostName()).isEqualTo("es-1");
    assertThat(hosts[0].getPort()).isEqualTo(9200);
    assertThat(hosts[1].getSchemeName()).isEqualTo("https");
    assertThat(hosts[1].getHostName()).isEqualTo("es-2.internal");
    assertThat(hosts[1].getPort()).isEqualTo(9243);
  }

  @Test
  @DisplayName("Should reject an empty node list")
  void shouldRejectEmptyNodeList() {
    assertThatThrownBy(() -> ElasticsearchConfig.hosts(new String[] {" "}))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("elasticsearch.uris");
  }

  @Test
  @DisplayName("Should send an ApiKey authorization header only when a key is set")
  void shouldAddApiKeyHeader() {
    assertThat(ElasticsearchConfig.defaultHeaders("")).isEmpty();
    assertThat(ElasticsearchConfig.defaultHeaders(null)).isEmpty();

    Header[] headers = ElasticsearchConfig.defaultHeaders("c2VjcmV0");

    assertThat(headers).hasSize(1);
    assertThat(headers[0].getName()).isEqualTo("Authorization");
    assertThat(headers[0].getValue()).isEqualTo("ApiKey c2VjcmV0");
  }
}
