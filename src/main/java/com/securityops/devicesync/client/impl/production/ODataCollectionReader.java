package com.securityops.devicesync.client.impl.production;

import com.securityops.devicesync.exception.SourceUnavailableException;
import com.securityops.devicesync.model.dto.ODataPage;
import com.securityops.devicesync.model.dto.SourceFetchResult;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks an OData collection page by page, following {@code @odata.nextLink}.
 *
 * A page answered with 429 or 503, or cut off by an I/O error, is retried with exponential
 * backoff. Any other failure aborts the read with a {@link SourceUnavailableException}.
 * Every page request costs one unit.
 */
@Slf4j
class ODataCollectionReader {

    private static final int MAX_ATTEMPTS = 4;

    private final String sourceName;
    private final RestTemplate restTemplate;
    private final Retry pageRetry;

    ODataCollectionReader(String sourceName, RestTemplate restTemplate,
                          RetryRegistry retryRegistry, Duration initialBackoff) {
        this.sourceName = sourceName;
        this.restTemplate = restTemplate;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(MAX_ATTEMPTS)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, 2.0))
                .retryOnException(ODataCollectionReader::isTransient)
                .build();
        this.pageRetry = retryRegistry.retry(sourceName + "PageRead", config);
        this.pageRetry.getEventPublisher().onRetry(event ->
                log.warn("[{}] Page request failed ({}), retry {} in {}ms", sourceName,
                        event.getLastThrowable().getMessage(), event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis()));
    }

    <T> SourceFetchResult<T> readAll(URI firstPage, ParameterizedTypeReference<ODataPage<T>> pageType) {
        long start = System.currentTimeMillis();
        List<T> devices = new ArrayList<>();
        int pageRequests = 0;
        URI next = firstPage;

        log.info("[{}] Fetching all devices", sourceName);
        try {
            while (next != null) {
                URI pageUri = next;
                ResponseEntity<ODataPage<T>> response = pageRetry.executeSupplier(
                        () -> restTemplate.exchange(pageUri, HttpMethod.GET, null, pageType));
                pageRequests++;

                ODataPage<T> page = response.getBody();
                if (page == null) {
                    break;
                }
                if (page.value() != null) {
                    devices.addAll(page.value());
                }
                next = page.nextLink() != null ? URI.create(page.nextLink()) : null;
                log.debug("[{}] Page {} fetched, {} devices so far, more={}", sourceName, pageRequests,
                        devices.size(), next != null);
            }
        } catch (RestClientException e) {
            log.error("[{}] Fetch aborted after {} pages and {} devices: {}", sourceName, pageRequests,
                    devices.size(), e.getMessage());
            throw new SourceUnavailableException("Failed to fetch devices from " + sourceName + ": " + e.getMessage(), e);
        }

        log.info("[{}] Fetched {} devices in {} pages, {}ms", sourceName, devices.size(), pageRequests,
                System.currentTimeMillis() - start);
        return new SourceFetchResult<>(devices, pageRequests);
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof ResourceAccessException) {
            return true;
        }
        if (error instanceof HttpStatusCodeException statusError) {
            int status = statusError.getStatusCode().value();
            return status == 429 || status == 503;
        }
        return false;
    }
}
