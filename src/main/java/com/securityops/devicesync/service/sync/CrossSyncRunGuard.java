package com.securityops.devicesync.service.sync;

import com.securityops.devicesync.config.SyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets at most one cross-sync run proceed at a time within this process.
 * Disabled when {@code devicesync.cross-sync.exclusive} is false.
 */
@Slf4j
@Component
public class CrossSyncRunGuard {

    private final boolean exclusive;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CrossSyncRunGuard(SyncProperties properties) {
        this.exclusive = properties.getCrossSync().isExclusive();
    }

    /**
     * @return true when the caller may start a run; it must then call {@link #release()}
     */
    public boolean tryAcquire() {
        if (!exclusive) {
            return true;
        }
        boolean acquired = running.compareAndSet(false, true);
        if (!acquired) {
            log.warn("Cross-sync run refused, another run is still in progress");
        }
        return acquired;
    }

    public void release() {
        if (exclusive) {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
