package com.gomflow.smartagent.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Pooled HTTP clients for the recognition services. Each port gets its own pool and a read
 * timeout matching its stage deadline.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class RestTemplateConfig {

    private final MeterRegistry meterRegistry;

    @Value("${http.client.connection-timeout:5000}")
    private int connectionTimeout;

    @Value("${http.client.max-connections:50}")
    private int maxConnections;

    @Value("${http.client.max-connections-per-route:20}")
    private int maxConnectionsPerRoute;

    @Bean(name = "ocrRestTemplate")
    public RestTemplate ocrRestTemplate(RestTemplateBuilder builder, SmartAgentProperties properties) {
        return build(builder, "recognition", properties.getPorts().getRecognition().getTimeout());
    }

    @Bean(name = "visionRestTemplate")
    public RestTemplate visionRestTemplate(RestTemplateBuilder builder, SmartAgentProperties properties) {
        return build(builder, "extraction", properties.getPorts().getVision().getTimeout());
    }

    private RestTemplate build(RestTemplateBuilder builder, String portName, Duration readTimeout) {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnectionsPerRoute);

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectionTimeout))
                .setResponseTimeout(Timeout.ofMilliseconds(readTimeout.toMillis()))
                .build();

        HttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();

        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);

        RestTemplate restTemplate = builder
                .requestFactory(() -> requestFactory)
                .setConnectTimeout(Duration.ofMillis(connectionTimeout))
                .setReadTimeout(readTimeout)
                .additionalInterceptors(metricsInterceptor(portName))
                .build();

        log.info("{} RestTemplate configured with connection timeout: {}ms, read timeout: {}ms",
                portName, connectionTimeout, readTimeout.toMillis());
        return restTemplate;
    }

    private ClientHttpRequestInterceptor metricsInterceptor(String portName) {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            try {
                ClientHttpResponse response = execution.execute(request, body);
                meterRegistry.counter("http.client.requests.total",
                        "port", portName,
                        "status", String.valueOf(response.getStatusCode().value())).increment();
                return response;
            } catch (Exception e) {
                meterRegistry.counter("http.client.requests.errors",
                        "port", portName,
                        "exception", e.getClass().getSimpleName()).increment();
                throw e;
            } finally {
                meterRegistry.timer("http.client.request.duration", "port", portName)
                        .record(Duration.ofMillis(System.currentTimeMillis() - startTime));
            }
        };
    }
}
