package com.flagship.tenant_ledger.config;

import com.flagship.tenant_ledger.gateway.GatewayProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client used for every call to the settlement gateway.
 *
 * Connect and response timeouts live on the pooled Apache client; a request that
 * exceeds them surfaces as a gateway timeout with unknown outcome.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class GatewayClientConfig {

    private final GatewayProperties gatewayProperties;
    private final MeterRegistry meterRegistry;

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder) {
        Timeout connectTimeout = Timeout.of(gatewayProperties.getConnectTimeout());
        Timeout readTimeout = Timeout.of(gatewayProperties.getReadTimeout());

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(gatewayProperties.getMaxConnections())
                .setMaxConnPerRoute(gatewayProperties.getMaxConnections())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(connectTimeout)
                        .setSocketTimeout(readTimeout)
                        .build())
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(connectTimeout)
                        .setResponseTimeout(readTimeout)
                        .build())
                .disableAutomaticRetries()
                .build();

        RestTemplate restTemplate = builder
                .requestFactory(() -> new HttpComponentsClientHttpRequestFactory(httpClient))
                .additionalInterceptors(loggingInterceptor(), metricsInterceptor())
                .build();

        log.info("Gateway client configured: baseUrl={}, connectTimeout={}, readTimeout={}, maxConnections={}",
                gatewayProperties.getBaseUrl(), gatewayProperties.getConnectTimeout(),
                gatewayProperties.getReadTimeout(), gatewayProperties.getMaxConnections());

        return restTemplate;
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long start = System.currentTimeMillis();
            log.debug("Gateway request: {} {}", request.getMethod(), request.getURI().getPath());
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("Gateway response: {} {} status={} durationMs={}",
                    request.getMethod(), request.getURI().getPath(),
                    response.getStatusCode().value(), System.currentTimeMillis() - start);
            return response;
        };
    }

    private ClientHttpRequestInterceptor metricsInterceptor() {
        return (request, body, execution) -> {
            long start = System.nanoTime();
            String method = request.getMethod().name();
            try {
                ClientHttpResponse response = execution.execute(request, body);
                meterRegistry.counter("gateway.http.requests",
                        "method", method,
                        "status", String.valueOf(response.getStatusCode().value())
                ).increment();
                return response;
            } catch (Exception e) {
                meterRegistry.counter("gateway.http.errors",
                        "method", method,
                        "exception", e.getClass().getSimpleName()
                ).increment();
                throw e;
            } finally {
                meterRegistry.timer("gateway.http.duration", "method", method)
                        .record(Duration.ofNanos(System.nanoTime() - start));
            }
        };
    }
}
