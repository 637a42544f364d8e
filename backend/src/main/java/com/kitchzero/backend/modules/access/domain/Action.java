package com.kitchzero.backend.modules.access.domain;

public enum Action {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    APPROVE,
    EXPORT,
    /** Grants every other action on the resource. */
    ADMIN;

    public boolean grants(Action requested) {
        return this == ADMIN || this == requested;
    }
}
