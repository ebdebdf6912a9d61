package co.elastic.policycheck.cli;

import static co.elastic.policycheck.support.PolicyTestSupport.policiesDirectory;
import static co.elastic.policycheck.support.PolicyTestSupport.policyBytes;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {
    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void compareExitsWithZeroWhenPoliciesMatch() {
        int exitCode = run("compare", fixture("ordering-expected.yml"), fixture("ordering-found.yml"));
        assertEquals(0, exitCode, err.toString());
        assertEquals("Policies match.", out.toString().trim());
    }

    @Test
    void comparePrintsDiffWhenPoliciesDiffer() {
        int exitCode = run("compare", "--context", "2", fixture("different-expected.yml"), fixture("different-found.yml"));
        assertEquals(1, exitCode);
        assertTrue(out.toString().startsWith("--- want\n+++ got\n"), out.toString());
    }

    @Test
    void compareReportsErrorCode() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("broken.yml"), "404 Not Found\n");
        int exitCode = run("compare", fixture("clean-expected.yml"), broken.toString());
        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("[decode_error] failed to prepare found policy"), err.toString());
    }

    @Test
    void canonicalizeWritesOutputFile() throws IOException {
        Path output = tempDir.resolve("canonical.yml");
        int exitCode = run("--log-level", "debug", "canonicalize", fixture("otel-ids-found.yml"), "-o", output.toString());
        assertEquals(0, exitCode, err.toString());
        String canonical = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(canonical.contains("health_check/componentid-0: {}"), canonical);
        assertEquals("", out.toString());
    }

    @Test
    void canonicalizePrintsToStdout() {
        int exitCode = run("canonicalize", fixture("clean-found.yml"));
        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().startsWith("inputs:\n"), out.toString());
    }

    @Test
    void testCommandRunsFolder() throws IOException {
        Path tests = Files.createDirectories(tempDir.resolve("tests"));
        Path policies = Files.createDirectories(tempDir.resolve("policies"));
        Files.writeString(tests.resolve("test-sql.yml"), "vars: {}\n");
        Files.write(policies.resolve("test-sql.yml"), policyBytes("clean-found.yml"));

        assertEquals(1, run("test", tests.toString(), "--policies", policies.toString()));
        assertTrue(err.toString().contains("❌ test-sql.yml: failed to read expected policy"), err.toString());

        assertEquals(0, run("test", tests.toString(), "--policies", policies.toString(), "--generate"));
        assertTrue(out.toString().contains("✅ test-sql.yml"), out.toString());

        out.getBuffer().setLength(0);
        assertEquals(0, run("test", tests.toString(), "--policies", policies.toString(), "--json"));
        JsonNode results = new ObjectMapper().readTree(out.toString());
        assertEquals(1, results.size());
        assertEquals("test-sql.yml", results.get(0).get("name").asText());
        assertTrue(results.get(0).get("success").asBoolean());
    }

    @Test
    void testCommandFailsWithoutTests() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));
        assertEquals(1, run("test", empty.toString(), "--policies", empty.toString()));
        assertTrue(err.toString().startsWith("No policy tests found"), err.toString());
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run());
        assertEquals(2, run("compare", "only-one.yml"));
        assertEquals(2, run("--log-level", "loud", "canonicalize", fixture("clean-found.yml")));
        assertEquals(2, run("test", tempDir.resolve("missing").toString(), "--policies", tempDir.toString()));
    }

    @Test
    void printsVersion() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("policy-check "), out.toString());
    }

    private int run(String... args) {
        CommandLine commandLine = Main.newCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private static String fixture(String name) {
        return policiesDirectory().resolve(name).toString();
    }
}
