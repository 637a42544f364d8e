package com.kitchzero.backend.modules.ratelimit.presentation;

import com.kitchzero.backend.modules.access.application.AccessGuard;
import com.kitchzero.backend.modules.access.domain.Action;
import com.kitchzero.backend.modules.access.domain.Resource;
import com.kitchzero.backend.modules.ratelimit.application.RateLimitService;
import com.kitchzero.backend.modules.ratelimit.domain.EndpointClass;
import com.kitchzero.backend.modules.ratelimit.presentation.dto.RateLimitResetResponse;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/rate-limits")
public class RateLimitAdminController {

    private final RateLimitService rateLimitService;
    private final AccessGuard accessGuard;

    public RateLimitAdminController(RateLimitService rateLimitService, AccessGuard accessGuard) {
        this.rateLimitService = rateLimitService;
        this.accessGuard = accessGuard;
    }

    /**
     * Clears every counter of {@code identity} (e.g. {@code ip:203.0.113.7} or {@code user:<id>}) for one class.
     */
    @DeleteMapping("/{endpointClass}")
    public ResponseEntity<RateLimitResetResponse> reset(
            @PathVariable EndpointClass endpointClass,
            @RequestParam @NotBlank @Size(max = 128) String identity
    ) {
        accessGuard.require(Resource.USERS, Action.ADMIN);
        int removed = rateLimitService.resetLimit(identity.trim(), endpointClass);
        return ResponseEntity.ok(new RateLimitResetResponse(identity.trim(), endpointClass, removed));
    }
}
