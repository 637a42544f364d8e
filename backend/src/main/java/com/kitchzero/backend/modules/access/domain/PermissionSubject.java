package com.kitchzero.backend.modules.access.domain;

import java.util.UUID;

import com.kitchzero.backend.modules.auth.domain.UserRole;

/**
 * The acting principal as seen by the permission evaluator.
 */
public interface PermissionSubject {

    UUID userId();

    UserRole role();

    String branchId();
}
