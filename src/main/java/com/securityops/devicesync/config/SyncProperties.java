package com.securityops.devicesync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the device cross-sync service.
 */
@Data
@ConfigurationProperties(prefix = "devicesync")
public class SyncProperties {

    private CrossSync crossSync = new CrossSync();

    private Query query = new Query();

    /**
     * Microsoft Graph (Intune managed devices).
     */
    private ApiSource graph = new ApiSource(
            "https://graph.microsoft.com/.default",
            "https://graph.microsoft.com/v1.0");

    /**
     * Defender for Endpoint machine API.
     */
    private ApiSource defender = new ApiSource(
            "https://api.securitycenter.microsoft.com/.default",
            "https://api.securitycenter.microsoft.com/api");

    @Data
    public static class CrossSync {
        /**
         * Records per store batch.
         */
        private int batchSize = 100;

        /**
         * Maximum number of batches written concurrently.
         */
        private int writeParallelism = 4;

        /**
         * Retries for a throttled write after the first attempt.
         */
        private int maxThrottleRetries = 3;

        /**
         * First backoff delay; doubles on every further retry.
         */
        private Duration initialBackoff = Duration.ofSeconds(1);

        private String cron = "0 0 6,12,18 * * *";

        private boolean schedulerEnabled = true;

        /**
         * Delay before the single retry of a failed scheduled run.
         */
        private Duration runRetryDelay = Duration.ofMinutes(5);

        /**
         * Refuse a run while another one is still in progress.
         */
        private boolean exclusive = true;
    }

    @Data
    public static class Query {
        private int defaultPageSize = 50;
        private int maxPageSize = 100;
    }

    @Data
    public static class ApiSource {
        private String tenantId;
        private String clientId;
        private String clientSecret;
        private String scope;
        private String baseUrl;

        /**
         * Token endpoint template, {@code {tenant}} is replaced with the tenant id.
         */
        private String tokenUrl = "https://login.microsoftonline.com/{tenant}/oauth2/v2.0/token";

        private int pageSize = 100;

        public ApiSource() {
        }

        public ApiSource(String scope, String baseUrl) {
            this.scope = scope;
            this.baseUrl = baseUrl;
        }
    }
}
