package com.kitchzero.backend.modules.access.application;

import java.util.Objects;

import com.kitchzero.backend.modules.access.domain.Action;
import com.kitchzero.backend.modules.access.domain.Permission;
import com.kitchzero.backend.modules.access.domain.PermissionSubject;
import com.kitchzero.backend.modules.access.domain.Resource;
import com.kitchzero.backend.modules.access.domain.ResourceContext;
import com.kitchzero.backend.modules.access.domain.RolePermissions;
import com.kitchzero.backend.modules.access.domain.Scope;

import org.springframework.stereotype.Component;

/**
 * Decides whether a principal may perform an action on a resource. Pure function of its inputs and the
 * static {@link RolePermissions} table.
 */
@Component
public class PermissionEvaluator {

    public boolean authorize(PermissionSubject subject, Resource resource, Action action, ResourceContext context) {
        if (subject == null || resource == null || action == null) {
            return false;
        }
        ResourceContext target = context != null ? context : ResourceContext.none();
        return RolePermissions.forRole(subject.role()).stream()
                .anyMatch(permission -> matches(permission, subject, resource, action, target));
    }

    public boolean authorize(PermissionSubject subject, Resource resource, Action action) {
        return authorize(subject, resource, action, ResourceContext.none());
    }

    private boolean matches(Permission permission, PermissionSubject subject, Resource resource, Action action,
                            ResourceContext target) {
        return permission.resource() == resource
                && permission.action().grants(action)
                && scopeMatches(permission.scope(), subject, target);
    }

    private boolean scopeMatches(Scope scope, PermissionSubject subject, ResourceContext target) {
        return switch (scope) {
            case GLOBAL -> true;
            case BRANCH -> subject.branchId() != null
                    && (target.branchId() == null || target.branchId().equals(subject.branchId()));
            case OWN -> ownMatches(subject, target);
        };
    }

    // Without any ownership facts an OWN rule matches.
    private boolean ownMatches(PermissionSubject subject, ResourceContext target) {
        if (target.ownerUserId() != null) {
            return target.ownerUserId().equals(subject.userId());
        }
        if (target.branchId() != null) {
            return Objects.equals(target.branchId(), subject.branchId());
        }
        return true;
    }
}
