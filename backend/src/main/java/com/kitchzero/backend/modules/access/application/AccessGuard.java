package com.kitchzero.backend.modules.access.application;

import com.kitchzero.backend.global.error.AuthErrorCode;
import com.kitchzero.backend.global.error.AuthException;
import com.kitchzero.backend.global.security.AuthenticatedPrincipal;
import com.kitchzero.backend.global.security.SecurityUtils;
import com.kitchzero.backend.modules.access.domain.Action;
import com.kitchzero.backend.modules.access.domain.Resource;
import com.kitchzero.backend.modules.access.domain.ResourceContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Service-layer permission check against the principal of the current request.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final PermissionEvaluator permissionEvaluator;

    public AccessGuard(PermissionEvaluator permissionEvaluator) {
        this.permissionEvaluator = permissionEvaluator;
    }

    public AuthenticatedPrincipal require(Resource resource, Action action, ResourceContext context) {
        AuthenticatedPrincipal principal = SecurityUtils.getCurrentPrincipal();
        if (!permissionEvaluator.authorize(principal, resource, action, context)) {
            log.warn("Denied {} {} for user {} (branch {}, target {})",
                    action, resource, principal.userId(), principal.branchId(), context);
            throw new AuthException(AuthErrorCode.FORBIDDEN);
        }
        return principal;
    }

    public AuthenticatedPrincipal require(Resource resource, Action action) {
        return require(resource, action, ResourceContext.none());
    }
}
