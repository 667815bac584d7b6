package com.securityops.devicesync.config;

import com.securityops.devicesync.client.auth.AccessTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class ApiClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApiClientConfig.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration READ_TIMEOUT = Duration.ofSeconds(60);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Qualifier("graphTokenProvider")
    public AccessTokenProvider graphTokenProvider(RestTemplateBuilder builder, SyncProperties properties, Clock clock) {
        return new AccessTokenProvider("Graph", properties.getGraph(), tokenRestTemplate(builder), clock);
    }

    @Bean
    @Qualifier("defenderTokenProvider")
    public AccessTokenProvider defenderTokenProvider(RestTemplateBuilder builder, SyncProperties properties, Clock clock) {
        return new AccessTokenProvider("Defender", properties.getDefender(), tokenRestTemplate(builder), clock);
    }

    @Bean
    @Qualifier("graphRestTemplate")
    public RestTemplate graphRestTemplate(RestTemplateBuilder builder,
                                          @Qualifier("graphTokenProvider") AccessTokenProvider tokenProvider) {
        logger.info("Initializing graphRestTemplate with bearer token interceptor");
        return apiRestTemplate(builder, "Graph", tokenProvider);
    }

    @Bean
    @Qualifier("defenderRestTemplate")
    public RestTemplate defenderRestTemplate(RestTemplateBuilder builder,
                                             @Qualifier("defenderTokenProvider") AccessTokenProvider tokenProvider) {
        logger.info("Initializing defenderRestTemplate with bearer token interceptor");
        return apiRestTemplate(builder, "Defender", tokenProvider);
    }

    private RestTemplate tokenRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(READ_TIMEOUT)
                .build();
    }

    private RestTemplate apiRestTemplate(RestTemplateBuilder builder, String apiName, AccessTokenProvider tokenProvider) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(READ_TIMEOUT)
                .additionalInterceptors(bearerTokenInterceptor(apiName, tokenProvider))
                .build();
    }

    static ClientHttpRequestInterceptor bearerTokenInterceptor(String apiName, AccessTokenProvider tokenProvider) {
        return (request, body, execution) -> {
            request.getHeaders().setBearerAuth(tokenProvider.getAccessToken());
            request.getHeaders().setAccept(List.of(MediaType.APPLICATION_JSON));
            logger.debug("Making {} API request: {} {}", apiName, request.getMethod(), request.getURI());
            var response = execution.execute(request, body);
            if (response.getStatusCode().value() == 401) {
                // the cached token was revoked or rotated early
                logger.warn("{} API rejected the access token, clearing token cache", apiName);
                tokenProvider.clearCache();
            }
            logger.debug("{} API response status: {}", apiName, response.getStatusCode());
            return response;
        };
    }
}
