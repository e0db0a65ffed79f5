package com.financemanager.transactions.config;

import com.financemanager.common.config.MdcKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client of the catalog API: fixed base URL, connect and read timeouts, and
 * propagation of the current request id so that both services log the same id.
 */
@Configuration
public class CatalogClientConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogClientConfig.class);

    @Bean
    public RestTemplate catalogRestTemplate(RestTemplateBuilder builder,
                                            @Value("${catalog.api.base-url}") String baseUrl,
                                            @Value("${catalog.api.timeout:30s}") Duration timeout) {
        log.info("Catalog client configured - baseUrl={}, timeout={}", baseUrl, timeout);
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .additionalInterceptors(requestIdInterceptor(), loggingInterceptor())
                .build();
    }

    private ClientHttpRequestInterceptor requestIdInterceptor() {
        return (request, body, execution) -> {
            String requestId = MDC.get(MdcKeys.REQUEST_ID);
            if (requestId != null && !request.getHeaders().containsKey(MdcKeys.REQUEST_ID_HEADER)) {
                request.getHeaders().add(MdcKeys.REQUEST_ID_HEADER, requestId);
            }
            return execution.execute(request, body);
        };
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("Catalog {} {} - Status: {} - Duration: {}ms",
                    request.getMethod(), request.getURI(), response.getStatusCode(),
                    System.currentTimeMillis() - startTime);
            return response;
        };
    }
}
