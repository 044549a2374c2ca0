package com.stemtutor.core.model;

/**
 * Branch labels produced by the confidence router.
 */
public enum Route {
    CLARIFY,
    DISAMBIGUATE,
    TEACH
}
