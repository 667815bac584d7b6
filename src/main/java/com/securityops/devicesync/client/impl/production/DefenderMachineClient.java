package com.securityops.devicesync.client.impl.production;

import com.securityops.devicesync.client.DefenderDeviceClient;
import com.securityops.devicesync.config.SyncProperties;
import com.securityops.devicesync.model.dto.DefenderDevice;
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
 * Reads machines from the Defender for Endpoint API ({@code GET /api/machines}).
 */
@Service
@Profile("!test & !mock")
public class DefenderMachineClient implements DefenderDeviceClient {

    private final ODataCollectionReader reader;
    private final URI firstPage;

    public DefenderMachineClient(@Qualifier("defenderRestTemplate") RestTemplate restTemplate,
                                 SyncProperties properties,
                                 RetryRegistry retryRegistry) {
        SyncProperties.ApiSource defender = properties.getDefender();
        this.reader = new ODataCollectionReader("Defender", restTemplate, retryRegistry,
                properties.getCrossSync().getInitialBackoff());
        this.firstPage = UriComponentsBuilder.fromHttpUrl(defender.getBaseUrl())
                .path("/machines")
                .queryParam("$top", defender.getPageSize())
                .build()
                .toUri();
    }

    @Override
    public SourceFetchResult<DefenderDevice> fetchAllDevices() {
        return reader.readAll(firstPage, new ParameterizedTypeReference<ODataPage<DefenderDevice>>() {});
    }
}
