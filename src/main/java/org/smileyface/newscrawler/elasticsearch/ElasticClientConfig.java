package org.smileyface.newscrawler.elasticsearch;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link ElasticContext} used by the Elasticsearch sink.
 *
 * Properties (with defaults, falling back to the ELASTIC_HOST / ELASTIC_PORT environment variables):
 * - elasticsearch.host: "localhost"
 * - elasticsearch.port: 9200
 * - elasticsearch.tenant: "default"
 * - elasticsearch.username / elasticsearch.password: empty (no authentication)
 */
@Configuration
public class ElasticClientConfig {

    @Value("${elasticsearch.host:${ELASTIC_HOST:localhost}}")
    private String host;

    @Value("${elasticsearch.port:${ELASTIC_PORT:9200}}")
    private String port;

    @Value("${elasticsearch.tenant:default}")
    private String tenant;

    @Value("${elasticsearch.username:}")
    private String username;

    @Value("${elasticsearch.password:}")
    private String password;

    @Bean
    public ElasticContext elasticContext() {
        int p;
        try {
            p = Integer.parseInt(port.trim());
        } catch (NumberFormatException e) {
            p = 9200;
        }
        return new ElasticContext(tenant, host, p, username, password);
    }
}
