package com.kitchzero.backend.modules.access.domain;

import java.util.UUID;

/**
 * Ownership facts of the resource instance being acted on. Both fields are optional.
 */
public record ResourceContext(UUID ownerUserId, String branchId) {

    private static final ResourceContext NONE = new ResourceContext(null, null);

    public static ResourceContext none() {
        return NONE;
    }

    public static ResourceContext ofBranch(String branchId) {
        return new ResourceContext(null, branchId);
    }

    public static ResourceContext ofOwner(UUID ownerUserId) {
        return new ResourceContext(ownerUserId, null);
    }
}
