package com.securityops.devicesync.client.impl.production;

import com.securityops.devicesync.client.ManagedDeviceClient;
import com.securityops.devicesync.config.SyncProperties;
import com.securityops.devicesync.model.dto.ManagedDevice;
import com.securityops.devicesync.model.dto.ODataPage;
import com.securityops.devicesync.model.dto.SourceFetchResult;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Reads Intune managed devices from Microsoft Graph
 * ({@code GET /deviceManagement/managedDevices}).
 */
@Service
@Profile("!test & !mock")
public class GraphManagedDeviceClient implements ManagedDeviceClient {

    private final ODataCollectionReader reader;
    private final URI firstPage;

    public GraphManagedDeviceClient(@Qualifier("graphRestTemplate") RestTemplate restTemplate,
                                    SyncProperties properties,
                                    RetryRegistry retryRegistry) {
        SyncProperties.ApiSource graph = properties.getGraph();
        this.reader = new ODataCollectionReader("Intune", restTemplate, retryRegistry,
                properties.getCrossSync().getInitialBackoff());
        this.firstPage = UriComponentsBuilder.fromHttpUrl(graph.getBaseUrl())
                .path("/deviceManagement/managedDevices")
                .queryParam("$top", graph.getPageSize())
                .build()
                .toUri();
    }

    @Override
    public SourceFetchResult<ManagedDevice> fetchAllDevices() {
        return reader.readAll(firstPage, new ParameterizedTypeReference<ODataPage<ManagedDevice>>() {});
    }
}
