package alerthub.config;

import alerthub.ack.AckStateStore;
import alerthub.ack.EsAckStateStore;
import alerthub.log.AlertLogStore;
import alerthub.log.EsAlertLogStore;
import alerthub.utils.AlertHubException;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.ssl.SSLContextBuilder;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.net.ssl.SSLContext;
import java.security.GeneralSecurityException;

/**
 * alerthub.store.type=elasticsearch 时，确认状态和告警历史存入ES
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "alerthub.store.type", havingValue = "elasticsearch")
public class ElasticsearchStoreConfiguration {

    @Bean(destroyMethod = "close")
    public RestClient alertHubRestClient(AlertHubProperties properties) {
        AlertHubProperties.Elasticsearch es = properties.getElasticsearch();
        int timeoutMillis = es.getTimeoutSeconds() * 1000;

        RestClientBuilder builder = RestClient.builder(new HttpHost(es.getHost(), es.getPort(), es.getScheme()));

        builder.setRequestConfigCallback(requestConfigBuilder ->
                requestConfigBuilder
                        .setConnectTimeout(timeoutMillis)
                        .setSocketTimeout(timeoutMillis)
                        .setConnectionRequestTimeout(timeoutMillis)
        );

        builder.setHttpClientConfigCallback(httpClientBuilder -> {
            if (es.isSsl()) {
                try {
                    SSLContext sslContext = SSLContextBuilder.create()
                            .loadTrustMaterial((chain, authType) -> true)
                            .build();
                    httpClientBuilder.setSSLContext(sslContext);
                    httpClientBuilder.setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE);
                } catch (GeneralSecurityException e) {
                    throw new AlertHubException("创建ES SSLContext失败", e);
                }
            }
            if (StringUtils.isNotBlank(es.getUsername())) {
                CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
                credentialsProvider.setCredentials(
                        AuthScope.ANY,
                        new UsernamePasswordCredentials(es.getUsername(), es.getPassword())
                );
                httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider);
            }
            return httpClientBuilder
                    .setMaxConnTotal(es.getMaxConnections())
                    .setMaxConnPerRoute(es.getMaxConnections());
        });

        log.info("连接Elasticsearch: {}://{}:{}", es.getScheme(), es.getHost(), es.getPort());
        return builder.build();
    }

    @Bean
    public ElasticsearchClient alertHubEsClient(RestClient alertHubRestClient) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        ElasticsearchTransport transport = new RestClientTransport(alertHubRestClient, new JacksonJsonpMapper(mapper));
        return new ElasticsearchClient(transport);
    }

    @Bean
    public AckStateStore esAckStateStore(ElasticsearchClient alertHubEsClient, AlertHubProperties properties) {
        return new EsAckStateStore(alertHubEsClient, properties.getElasticsearch().getAckIndex());
    }

    @Bean
    public AlertLogStore esAlertLogStore(ElasticsearchClient alertHubEsClient, AlertHubProperties properties) {
        return new EsAlertLogStore(alertHubEsClient, properties.getElasticsearch().getLogIndex());
    }
}
