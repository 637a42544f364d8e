package com.kitchzero.backend.modules.ratelimit.presentation.dto;

import com.kitchzero.backend.modules.ratelimit.domain.EndpointClass;

public record RateLimitResetResponse(String identity, EndpointClass endpointClass, int removedCounters) {
}
