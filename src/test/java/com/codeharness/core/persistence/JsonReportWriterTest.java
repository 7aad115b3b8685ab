package com.codeharness.core.persistence;

import com.codeharness.core.compilation.CompilationUnit;
import com.codeharness.core.language.Language;
import com.codeharness.core.manifest.Roles;
import com.codeharness.core.manifest.TestKind;
import com.codeharness.core.process.FailureKind;
import com.codeharness.core.testing.ComparisonMode;
import com.codeharness.core.testing.OutputComparator;
import com.codeharness.core.testing.TestRecord;
import com.codeharness.core.testing.TestRunState;
import com.codeharness.core.testing.TestRunSummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    @TempDir
    Path workspace;

    private final ObjectMapper reader = new ObjectMapper();

    private TestRunReport report() throws Exception {
        TestRecord passed = TestRecord.builder(1).input("1\n").stage(Roles.TEST, "1\n", 0.01)
                .stage(Roles.CORRECT, "1\n", 0.02).passed("Output matches").build();
        TestRecord failed = TestRecord.builder(2).input("2\n").stage(Roles.TEST, "3\n", 0.01)
                .stage(Roles.CORRECT, "2\n", 0.02).failed(FailureKind.OUTPUT_MISMATCH, "Output mismatch")
                .mismatch(new OutputComparator(ComparisonMode.TRIMMED).analyze("2\n", "3\n")).build();
        Instant now = Instant.now();
        TestRunSummary summary = new TestRunSummary("HS-json", TestKind.DIFFERENTIAL, TestRunState.COMPLETED, 2,
                List.of(failed, passed), now, now, 0.5, Map.of("matchingOutputs", 1));

        Path sol = Files.writeString(workspace.resolve("sol.cpp"), "int main(){}");
        Map<String, CompilationUnit> units = new LinkedHashMap<>();
        units.put(Roles.TEST, CompilationUnit.observe(Roles.TEST, sol, Language.CPP, workspace.resolve("sol")));
        FilesSnapshot snapshot = new FilesSnapshotService().capture(TestKind.DIFFERENTIAL, units);
        return new TestRunReport(summary, snapshot);
    }

    @Test
    @DisplayName("report document carries summary, tests, analysis and files")
    void documentShape() throws Exception {
        JsonNode doc = reader.readTree(new JsonReportWriter().toJson(report()));

        assertEquals("HS-json", doc.get("sessionId").asText());
        assertEquals("DIFFERENTIAL", doc.get("kind").asText());
        assertEquals(1, doc.get("passed").asInt());
        assertFalse(doc.get("allPassed").asBoolean());
        assertEquals(50.0, doc.get("statistics").get("passRate").asDouble(), 1e-9);
        assertEquals(1, doc.get("tests").get(0).get("testNumber").asInt());
        assertEquals("OUTPUT_MISMATCH", doc.get("tests").get(1).get("failureKind").asText());
        assertTrue(doc.get("mismatchAnalysis").has("test_2"));
        assertEquals(1, doc.get("mismatchAnalysis").get("run").get("matchingOutputs").asInt());
        assertEquals("cpp", doc.get("files").get("primaryLanguage").asText());
        assertEquals("int main(){}", doc.get("files").get("files").get(Roles.TEST).get("content").asText());
        assertEquals("sol.cpp", doc.get("files").get("files").get(Roles.TEST).get("fileName").asText());
        assertTrue(doc.get("startedAt").isTextual(), "timestamps are ISO strings");
    }

    @Test
    @DisplayName("writeTo creates parent directories")
    void writesFile() throws Exception {
        Path target = workspace.resolve("reports/run.json");

        new JsonReportWriter().writeTo(target, report());

        assertEquals("HS-json", reader.readTree(target.toFile()).get("sessionId").asText());
    }

    @Test
    @DisplayName("snapshot keeps only the kind's roles in role order")
    void snapshotRoles() throws Exception {
        Path gen = Files.writeString(workspace.resolve("gen.py"), "print(1)");
        Path check = Files.writeString(workspace.resolve("check.py"), "import sys");
        Map<String, CompilationUnit> units = new LinkedHashMap<>();
        units.put(Roles.VALIDATOR, CompilationUnit.observe(Roles.VALIDATOR, check, Language.PYTHON, check));
        units.put(Roles.GENERATOR, CompilationUnit.observe(Roles.GENERATOR, gen, Language.PYTHON, gen));

        FilesSnapshot snapshot = new FilesSnapshotService().capture(TestKind.TIME_LIMIT, units);

        assertEquals(List.of(Roles.GENERATOR), List.copyOf(snapshot.files().keySet()));
        assertEquals("py", snapshot.files().get(Roles.GENERATOR).language());
        assertEquals("gen.py", snapshot.files().get(Roles.GENERATOR).fileName());
        assertEquals("TIME_LIMIT", snapshot.testKind());
        assertTrue(new JsonReportWriter().toJson(snapshot).contains("\"gen.py\""));
    }

    @Test
    @DisplayName("roles whose sources share a file name each keep their own entry")
    void sameFileNameInDifferentDirectories() throws Exception {
        Map<String, CompilationUnit> units = new LinkedHashMap<>();
        for (String role : List.of(Roles.GENERATOR, Roles.CORRECT, Roles.TEST)) {
            Path dir = Files.createDirectories(workspace.resolve(role));
            Path main = Files.writeString(dir.resolve("main.py"), "print('" + role + "')");
            units.put(role, CompilationUnit.observe(role, main, Language.PYTHON, main));
        }

        FilesSnapshot snapshot = new FilesSnapshotService().capture(TestKind.DIFFERENTIAL, units);

        assertEquals(List.of(Roles.GENERATOR, Roles.CORRECT, Roles.TEST), List.copyOf(snapshot.files().keySet()));
        assertEquals("print('correct')", snapshot.files().get(Roles.CORRECT).content());
        assertEquals("print('generator')", snapshot.files().get(Roles.GENERATOR).content());
        assertEquals("main.py", snapshot.files().get(Roles.TEST).fileName());
    }
}
