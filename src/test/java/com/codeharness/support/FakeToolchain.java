package com.codeharness.support;

import com.codeharness.core.language.LanguageOverride;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

/**
 * A shell script posing as a C++ compiler: it "compiles" a source by copying it to the output
 * and making it executable, so test sources are shell scripts with a {@code .cpp} name.
 * <p>
 * Sources containing {@code COMPILE_ERROR} fail to build; {@code COMPILE_SLOW} makes the build sleep.
 */
public final class FakeToolchain {

    private static final String COMPILER = """
            #!/bin/sh
            src="$1"
            out="$3"
            if grep -q COMPILE_SLOW "$src"; then sleep 5; fi
            if grep -q COMPILE_ERROR "$src"; then
              echo "$src:1:1: error: expected ';' before '}' token" >&2
              exit 1
            fi
            cp "$src" "$out" && chmod +x "$out"
            """;

    private FakeToolchain() {}

    public static boolean shellAvailable() {
        return Files.isExecutable(Path.of("/bin/sh"));
    }

    /** Writes the fake compiler into {@code dir}. */
    public static Path installCompiler(Path dir) throws IOException {
        Path script = dir.resolve("fakecc.sh");
        Files.writeString(script, COMPILER);
        return script;
    }

    /** Override that turns the C++ build command into {@code sh fakecc.sh <src> -o <out>}. */
    public static LanguageOverride cppOverride(Path compilerScript) {
        LanguageOverride override = new LanguageOverride();
        override.setCompiler("sh");
        override.setOptimization("");
        override.setStdVersion("");
        override.setFlags(List.of(compilerScript.toString()));
        return override;
    }

    /** Writes a "C++" source whose built artifact runs {@code body} under {@code sh}. */
    public static Path source(Path dir, String name, String body) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, "#!/bin/sh\n" + body + "\n");
        return file;
    }

    /** Moves a file's mtime, for staleness tests that must not depend on clock granularity. */
    public static void setModified(Path file, Instant instant) throws IOException {
        Files.setLastModifiedTime(file, FileTime.from(instant));
    }
}
