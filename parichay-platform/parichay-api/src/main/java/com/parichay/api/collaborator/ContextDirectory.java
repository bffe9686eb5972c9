package com.parichay.api.collaborator;

import com.parichay.core.domain.ContextType;

import java.util.UUID;

/**
 * Lookup into the services that own chat contexts (marriage profiles, job posts,
 * business listings, help requests). Implementations may call remote services and
 * are allowed to throw; callers translate failures into a dependency error.
 */
public interface ContextDirectory {

    boolean contextExists(ContextType type, UUID contextId);

    /**
     * Whether the context still accepts new conversations (not closed, hidden or expired).
     */
    boolean contextActive(ContextType type, UUID contextId);
}
