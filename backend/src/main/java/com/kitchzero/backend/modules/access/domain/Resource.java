package com.kitchzero.backend.modules.access.domain;

public enum Resource {
    WASTE_LOGS,
    INVENTORY,
    BRANCHES,
    USERS,
    REVIEWS,
    ANALYTICS,
    EXPORTS
}
