package com.codeharness.core.manifest;

/**
 * Well-known role names in a workspace.
 */
public final class Roles {

    private Roles() {}

    public static final String GENERATOR = "generator";
    /** Reference solution. */
    public static final String CORRECT = "correct";
    /** Solution under test. */
    public static final String TEST = "test";
    public static final String VALIDATOR = "validator";
}
