package com.kitchzero.backend.modules.access.domain;

/**
 * Breadth of resources a permission covers, relative to the acting principal.
 */
public enum Scope {
    OWN,
    BRANCH,
    GLOBAL
}
