package com.codeharness.core.persistence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sources that took part in a run, keyed by role.
 *
 * @param testKind        the run kind, e.g. {@code DIFFERENTIAL}
 * @param primaryLanguage language of the solution under test
 * @param files           role to entry, in role order
 */
public record FilesSnapshot(String testKind, String primaryLanguage, Map<String, FileEntry> files) {

    public FilesSnapshot {
        files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public record FileEntry(String fileName, String content, String language) {}
}
