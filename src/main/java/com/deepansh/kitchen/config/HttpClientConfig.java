package com.deepansh.kitchen.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient behind the RestClient used for LLM calls.
 *
 * Uses the system default SSL context; certificate verification stays on.
 * Socket timeout bounds one provider call; the orchestration loop puts its
 * own per-agent timeout on top.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${llm.http.connect-timeout-seconds:10}")
    private long connectTimeoutSeconds;

    @Value("${llm.http.read-timeout-seconds:60}")
    private long readTimeoutSeconds;

    @Value("${llm.http.max-connections:20}")
    private int maxConnections;

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setSSLSocketFactory(
                                        SSLConnectionSocketFactoryBuilder.create()
                                                .setSslContext(SSLContexts.createSystemDefault())
                                                .build())
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofSeconds(connectTimeoutSeconds))
                                        .setSocketTimeout(Timeout.ofSeconds(readTimeoutSeconds))
                                        .build())
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .build())
                .build();

        log.info("LLM HttpClient configured [connectTimeout={}s, readTimeout={}s, maxConnections={}]",
                connectTimeoutSeconds, readTimeoutSeconds, maxConnections);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
