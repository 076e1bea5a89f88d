package com.deepansh.pawsagent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Shared HTTP stack for every outbound adapter (model provider, records service,
 * web search). One pooled Apache HttpClient; adapters call {@code builder.clone()}
 * and add their own base URL and headers.
 *
 * The response timeout must stay above the slowest model completion; tool-level
 * timeouts are enforced separately by the ToolRunner.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${http.client.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${http.client.response-timeout-ms:60000}")
    private long responseTimeoutMs;

    @Value("${http.client.max-connections:50}")
    private int maxConnections;

    @Bean
    public RestClient.Builder restClientBuilder() {
        PoolingHttpClientConnectionManager connectionManager =
                PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(maxConnections)
                        .setMaxConnPerRoute(maxConnections)
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                .build())
                        .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                        .build())
                .evictExpiredConnections()
                .build();

        log.info("HttpClient configured [maxConnections={}, connectTimeout={}ms, responseTimeout={}ms]",
                maxConnections, connectTimeoutMs, responseTimeoutMs);

        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
