package com.kitchzero.backend.modules.access.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.kitchzero.backend.modules.auth.domain.UserRole;

/**
 * Static role to permission table.
 */
public final class RolePermissions {

    private static final Map<UserRole, List<Permission>> TABLE;

    static {
        Map<UserRole, List<Permission>> table = new EnumMap<>(UserRole.class);
        table.put(UserRole.SUPER_ADMIN, List.of(
                new Permission(Resource.WASTE_LOGS, Action.ADMIN, Scope.GLOBAL),
                new Permission(Resource.INVENTORY, Action.ADMIN, Scope.GLOBAL),
                new Permission(Resource.BRANCHES, Action.ADMIN, Scope.GLOBAL),
                new Permission(Resource.USERS, Action.ADMIN, Scope.GLOBAL),
                new Permission(Resource.REVIEWS, Action.ADMIN, Scope.GLOBAL),
                new Permission(Resource.ANALYTICS, Action.READ, Scope.GLOBAL),
                new Permission(Resource.EXPORTS, Action.EXPORT, Scope.GLOBAL)
        ));
        table.put(UserRole.BRANCH_ADMIN, List.of(
                new Permission(Resource.WASTE_LOGS, Action.CREATE, Scope.BRANCH),
                new Permission(Resource.WASTE_LOGS, Action.READ, Scope.BRANCH),
                new Permission(Resource.WASTE_LOGS, Action.UPDATE, Scope.BRANCH),
                new Permission(Resource.WASTE_LOGS, Action.DELETE, Scope.BRANCH),
                new Permission(Resource.INVENTORY, Action.CREATE, Scope.BRANCH),
                new Permission(Resource.INVENTORY, Action.READ, Scope.BRANCH),
                new Permission(Resource.INVENTORY, Action.UPDATE, Scope.BRANCH),
                new Permission(Resource.INVENTORY, Action.DELETE, Scope.BRANCH),
                new Permission(Resource.ANALYTICS, Action.READ, Scope.BRANCH),
                new Permission(Resource.EXPORTS, Action.EXPORT, Scope.BRANCH),
                new Permission(Resource.BRANCHES, Action.READ, Scope.OWN)
        ));
        TABLE = Collections.unmodifiableMap(table);
    }

    private RolePermissions() {
    }

    public static List<Permission> forRole(UserRole role) {
        if (role == null) {
            return List.of();
        }
        return TABLE.getOrDefault(role, List.of());
    }
}
