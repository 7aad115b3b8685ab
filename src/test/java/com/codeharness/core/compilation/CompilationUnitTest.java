package com.codeharness.core.compilation;

import com.codeharness.core.language.Language;
import com.codeharness.support.FakeToolchain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CompilationUnitTest {

    @TempDir
    Path dir;

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("missing artifact is stale")
    void missingArtifact() throws Exception {
        Path source = Files.writeString(dir.resolve("sol.cpp"), "int main(){}");

        CompilationUnit unit = CompilationUnit.observe("test", source, Language.CPP, dir.resolve("sol"));

        assertNull(unit.artifactModified());
        assertTrue(unit.isStale(true));
    }

    @Test
    @DisplayName("source newer than artifact is stale; equal or older is not")
    void comparesTimestamps() throws Exception {
        Path source = Files.writeString(dir.resolve("sol.cpp"), "int main(){}");
        Path artifact = Files.writeString(dir.resolve("sol"), "bin");

        FakeToolchain.setModified(artifact, T0);
        FakeToolchain.setModified(source, T0);
        assertFalse(CompilationUnit.observe("test", source, Language.CPP, artifact).isStale(true));

        FakeToolchain.setModified(source, T0.minusSeconds(60));
        assertFalse(CompilationUnit.observe("test", source, Language.CPP, artifact).isStale(true));

        FakeToolchain.setModified(source, T0.plusSeconds(1));
        assertTrue(CompilationUnit.observe("test", source, Language.CPP, artifact).isStale(true));
    }

    @Test
    @DisplayName("missing source is stale for compiled languages")
    void missingSource() throws Exception {
        Path artifact = Files.writeString(dir.resolve("sol"), "bin");

        assertTrue(CompilationUnit.observe("test", dir.resolve("sol.cpp"), Language.CPP, artifact).isStale(true));
    }

    @Test
    @DisplayName("languages without a build step are never stale")
    void interpretedNeverStale() {
        Path source = dir.resolve("gen.py");

        assertFalse(CompilationUnit.observe("generator", source, Language.PYTHON, source).isStale(false));
    }

    @Test
    @DisplayName("refresh re-reads timestamps")
    void refreshRereads() throws Exception {
        Path source = Files.writeString(dir.resolve("sol.cpp"), "int main(){}");
        CompilationUnit before = CompilationUnit.observe("test", source, Language.CPP, dir.resolve("sol"));

        Files.writeString(dir.resolve("sol"), "bin");
        FakeToolchain.setModified(dir.resolve("sol"), Instant.now().plusSeconds(60));

        assertTrue(before.isStale(true));
        assertFalse(before.refresh().isStale(true));
        assertEquals("sol.cpp", before.fileName());
    }
}
