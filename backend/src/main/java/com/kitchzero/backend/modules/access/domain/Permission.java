package com.kitchzero.backend.modules.access.domain;

import java.util.Objects;

public record Permission(Resource resource, Action action, Scope scope) {

    public Permission {
        Objects.requireNonNull(resource, "resource must not be null");
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
    }
}
