package com.stemtutor.core.model;

/**
 * The form in which a problem was submitted.
 */
public enum InputKind {
    TEXT,
    IMAGE
}
