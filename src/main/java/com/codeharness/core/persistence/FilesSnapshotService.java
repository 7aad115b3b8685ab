package com.codeharness.core.persistence;

import com.codeharness.core.compilation.CompilationUnit;
import com.codeharness.core.manifest.Roles;
import com.codeharness.core.manifest.TestKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Captures the sources of the roles a run kind uses. Roles outside the kind are left out.
 */
public class FilesSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(FilesSnapshotService.class);

    public FilesSnapshot capture(TestKind kind, Map<String, CompilationUnit> units) {
        Map<String, FilesSnapshot.FileEntry> files = new LinkedHashMap<>();
        for (String role : kind.requiredRoles()) {
            CompilationUnit unit = units.get(role);
            if (unit == null) {
                continue;
            }
            try {
                String content = Files.readString(unit.source(), StandardCharsets.UTF_8);
                files.put(role, new FilesSnapshot.FileEntry(unit.fileName(), content, unit.language().key()));
            } catch (IOException e) {
                log.warn("Could not snapshot {}: {}", unit.source(), e.getMessage());
            }
        }
        CompilationUnit primary = units.get(Roles.TEST);
        String primaryLanguage = primary != null ? primary.language().key() : "cpp";
        return new FilesSnapshot(kind.name(), primaryLanguage, files);
    }
}
