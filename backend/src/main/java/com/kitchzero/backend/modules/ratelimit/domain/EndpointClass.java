package com.kitchzero.backend.modules.ratelimit.domain;

/**
 * Groups of endpoints that share one rate-limit budget.
 */
public enum EndpointClass {
    LOGIN,
    REFRESH,
    API_READ,
    API_WRITE,
    API_DELETE,
    ADMIN_READ,
    ADMIN_WRITE,
    ADMIN_DELETE,
    ANALYTICS,
    EXPORT;

    /**
     * Key under {@code app.rate-limit.policies}, e.g. {@code api-read}.
     */
    public String propertyKey() {
        return name().toLowerCase().replace('_', '-');
    }

    /**
     * The elevated budget used by super administrators, or this class when it has none.
     */
    public EndpointClass adminVariant() {
        return switch (this) {
            case API_READ -> ADMIN_READ;
            case API_WRITE -> ADMIN_WRITE;
            case API_DELETE -> ADMIN_DELETE;
            default -> this;
        };
    }
}
