package com.securityops.devicesync.service.sync;

import com.securityops.devicesync.exception.StoreThrottledException;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed cross-sync run is worth one more attempt.
 * A run is retryable when any exception in the cause chain is a known transient type or its
 * message names a transient condition.
 */
@Component
public class RetryableErrorClassifier {

    private static final List<String> RETRYABLE_MARKERS = List.of(
            "timeout", "throttl", "429", "network", "econnreset", "etimedout", "connection reset");

    public boolean isRetryable(Throwable error) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        for (Throwable current = error; current != null && seen.put(current, Boolean.TRUE) == null;
             current = current.getCause()) {
            if (current instanceof SocketTimeoutException
                    || current instanceof TimeoutException
                    || current instanceof StoreThrottledException) {
                return true;
            }
            if (current.getMessage() == null) {
                continue;
            }
            String message = current.getMessage().toLowerCase(Locale.ROOT);
            for (String marker : RETRYABLE_MARKERS) {
                if (message.contains(marker)) {
                    return true;
                }
            }
        }
        return false;
    }
}
