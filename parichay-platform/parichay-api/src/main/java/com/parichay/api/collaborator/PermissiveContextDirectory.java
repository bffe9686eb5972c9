package com.parichay.api.collaborator;

import com.parichay.core.domain.ContextType;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Default directory used until a deployment wires the real context services in.
 * Treats every referenced context as present and open.
 */
@Component
public class PermissiveContextDirectory implements ContextDirectory {

    @Override
    public boolean contextExists(ContextType type, UUID contextId) {
        return contextId != null;
    }

    @Override
    public boolean contextActive(ContextType type, UUID contextId) {
        return contextId != null;
    }
}
