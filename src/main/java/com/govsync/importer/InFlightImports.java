package com.govsync.importer;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fingerprints of imports currently between validation and audit.
 */
@Component
public class InFlightImports {

    private final Set<String> active = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String fingerprint) {
        return active.add(fingerprint);
    }

    public void release(String fingerprint) {
        active.remove(fingerprint);
    }

    public boolean isActive(String fingerprint) {
        return active.contains(fingerprint);
    }
}
