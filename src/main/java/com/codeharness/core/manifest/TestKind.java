package com.codeharness.core.manifest;

import java.util.List;

/**
 * The three kinds of test run and the roles each one needs.
 */
public enum TestKind {

    DIFFERENTIAL("comparator", List.of(Roles.GENERATOR, Roles.CORRECT, Roles.TEST)),
    TIME_LIMIT("benchmarker", List.of(Roles.GENERATOR, Roles.TEST)),
    VALIDATION("validator", List.of(Roles.GENERATOR, Roles.TEST, Roles.VALIDATOR));

    private final String directoryName;
    private final List<String> requiredRoles;

    TestKind(String directoryName, List<String> requiredRoles) {
        this.directoryName = directoryName;
        this.requiredRoles = requiredRoles;
    }

    /** Sub-directory of the workspace used for this kind's archived test I/O. */
    public String directoryName() {
        return directoryName;
    }

    public List<String> requiredRoles() {
        return requiredRoles;
    }
}
