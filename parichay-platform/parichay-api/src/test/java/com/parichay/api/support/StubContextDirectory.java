package com.parichay.api.support;

import com.parichay.api.collaborator.ContextDirectory;
import com.parichay.core.domain.ContextType;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Context directory whose answers tests can steer. Every context exists and is active
 * unless marked otherwise.
 */
public class StubContextDirectory implements ContextDirectory {

    private final Set<UUID> missing = ConcurrentHashMap.newKeySet();
    private final Set<UUID> inactive = ConcurrentHashMap.newKeySet();
    private volatile boolean unavailable;

    public void markMissing(UUID contextId) {
        missing.add(contextId);
    }

    public void markInactive(UUID contextId) {
        inactive.add(contextId);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void reset() {
        missing.clear();
        inactive.clear();
        unavailable = false;
    }

    @Override
    public boolean contextExists(ContextType type, UUID contextId) {
        failIfUnavailable();
        return contextId != null && !missing.contains(contextId);
    }

    @Override
    public boolean contextActive(ContextType type, UUID contextId) {
        failIfUnavailable();
        return contextId != null && !inactive.contains(contextId);
    }

    private void failIfUnavailable() {
        if (unavailable) {
            throw new IllegalStateException("context service down");
        }
    }
}
