/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.actionflow.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.actionflow.config.ActionflowConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ActionflowCli}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
class ActionflowCliTest {

    private static final String VALID = """
            workflow "ci" {
              on = "push"
              resolves = ["test", "lint"]
            }
            action "test" { uses = "./ci/test" }
            action "lint" { uses = "docker://golangci/golangci-lint" }
            """;

    private static final String WARNING_ONLY = """
            action "a" {
              uses = "./a"
              colour = "blue"
            }
            """;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private Properties properties;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        properties = new Properties();
        properties.setProperty(ActionflowConfiguration.METRICS_ENABLED, "false");
    }

    private int run(String... args) {
        ActionflowCli cli = new ActionflowCli(new ActionflowConfiguration(properties),
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
        return cli.run(args);
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }

    @Test
    void testValidFile() throws IOException {
        Path file = write("main.workflow", VALID);

        assertEquals(ActionflowCli.EXIT_VALID, run(file.toString()));
        assertEquals(file + " is a valid file with 2 actions and 1 workflow", out().strip());
    }

    @Test
    void testSingularCounts() throws IOException {
        Path file = write("one.workflow", "action \"a\" { uses = \"./a\" }\n");

        run(file.toString());

        assertThat(out()).contains("is a valid file with 1 action and 0 workflows");
    }

    @Test
    void testInvalidFileListsDiagnostics() throws IOException {
        Path file = write("bad.workflow", """
                action "a" {
                  needs = ["b"]
                }
                """);

        assertEquals(ActionflowCli.EXIT_INVALID, run(file.toString()));
        assertThat(out().lines().toList()).containsExactly(
                file + ":1:12: ERROR: Action `a' must have a `uses' attribute",
                file + ":2:11: ERROR: Action `a' needs nonexistent action `b'");
    }

    @Test
    void testSyntaxErrorIsFatal() throws IOException {
        Path file = write("broken.workflow", "action \"a\" {\n");

        assertEquals(ActionflowCli.EXIT_INVALID, run(file.toString()));
        assertThat(out()).contains("FATAL: Object expected closing RBRACE got: EOF");
    }

    @Test
    void testWarningsFailUnlessSuppressed() throws IOException {
        Path file = write("warn.workflow", WARNING_ONLY);

        assertEquals(ActionflowCli.EXIT_INVALID, run(file.toString()));

        outBuffer.reset();
        assertEquals(ActionflowCli.EXIT_VALID, run("--suppress-warnings", file.toString()));
        assertThat(out()).contains("WARNING: Unknown action attribute `colour'")
                .contains("is a valid file with 1 action and 0 workflows");
    }

    @Test
    void testSuppressErrors() throws IOException {
        Path file = write("errors.workflow", "action \"a\" { }\n");

        assertEquals(ActionflowCli.EXIT_VALID, run("--suppress-errors", file.toString()));
    }

    @Test
    void testThresholdFromConfiguration() throws IOException {
        properties.setProperty(ActionflowConfiguration.FAILURE_THRESHOLD, "error");
        Path file = write("warn.workflow", WARNING_ONLY);

        assertEquals(ActionflowCli.EXIT_VALID, run(file.toString()));
    }

    @Test
    void testQuietOnlyReportsInvalidFiles() throws IOException {
        Path good = write("good.workflow", VALID);
        Path bad = write("bad.workflow", "action \"a\" { }\n");

        assertEquals(ActionflowCli.EXIT_INVALID, run("--quiet", good.toString(), bad.toString()));
        assertThat(out()).doesNotContain("is a valid file").contains("must have a `uses' attribute");
    }

    @Test
    void testValidateDirectory() throws IOException {
        write("b.workflow", VALID);
        write("a.workflow", "action \"x\" { uses = \"./x\" }\n");
        write("notes.txt", "not a workflow");

        assertEquals(ActionflowCli.EXIT_VALID, run("--validate-directory", tempDir.toString()));

        List<String> lines = out().lines().toList();
        assertEquals(2, lines.size());
        assertThat(lines.get(0)).startsWith(tempDir.resolve("a.workflow").toString());
        assertThat(lines.get(1)).startsWith(tempDir.resolve("b.workflow").toString());
    }

    @Test
    void testJsonFormat() throws IOException {
        Path file = write("bad.workflow", "action \"a\" { }\n");

        assertEquals(ActionflowCli.EXIT_INVALID, run("--format", "json", file.toString()));

        JsonNode document = new ObjectMapper().readTree(out());
        assertEquals(1, document.get("checked").asInt());
        assertEquals(1, document.get("invalid").asInt());
        JsonNode report = document.get("files").get(0);
        assertEquals(file.toString(), report.get("file").asText());
        assertFalse(report.get("valid").asBoolean());
        assertEquals(1, report.get("actions").asInt());
        JsonNode diagnostic = report.get("diagnostics").get(0);
        assertEquals("ERROR", diagnostic.get("severity").asText());
        assertEquals(1, diagnostic.get("line").asInt());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testYamlFormat() throws IOException {
        Path file = write("main.workflow", VALID);

        assertEquals(ActionflowCli.EXIT_VALID, run("--format", "yaml", file.toString()));

        Map<String, Object> document = new Yaml(new SafeConstructor(new LoaderOptions())).load(out());
        List<Map<String, Object>> files = (List<Map<String, Object>>) document.get("files");
        assertEquals(true, files.get(0).get("valid"));
        assertEquals(2, files.get(0).get("actions"));
        assertEquals(1, files.get(0).get("workflows"));
    }

    @Test
    void testFormatFromConfiguration() throws IOException {
        properties.setProperty(ActionflowConfiguration.OUTPUT_FORMAT, "json");
        Path file = write("main.workflow", VALID);

        run(file.toString());

        assertThat(out().strip()).startsWith("{");
    }

    @Test
    void testMissingFile() {
        Path file = tempDir.resolve("absent.workflow");

        assertEquals(ActionflowCli.EXIT_IO, run(file.toString()));
        assertEquals(file + ": No such file", err().strip());
    }

    @Test
    void testMissingDirectory() {
        assertEquals(ActionflowCli.EXIT_IO, run("--validate-directory", tempDir.resolve("nowhere").toString()));
        assertThat(err()).startsWith("Error: Not a directory");
    }

    @Test
    void testNoArguments() {
        assertEquals(ActionflowCli.EXIT_USAGE, run());
        assertThat(err()).contains("No files specified").contains("USAGE:");
    }

    @Test
    void testUnknownOption() {
        assertEquals(ActionflowCli.EXIT_USAGE, run("--strict", "main.workflow"));
        assertThat(err()).contains("Unknown option --strict");
    }

    @Test
    void testUnknownFormat() {
        assertEquals(ActionflowCli.EXIT_USAGE, run("--format", "xml", "main.workflow"));
        assertThat(err()).contains("Unknown output format 'xml'");
    }

    @Test
    void testFormatNeedsValue() {
        assertEquals(ActionflowCli.EXIT_USAGE, run("--format"));
        assertThat(err()).contains("--format requires a value");
    }

    @Test
    void testHelpAndVersion() {
        assertEquals(ActionflowCli.EXIT_VALID, run("--help"));
        assertThat(out()).contains("EXIT CODES:");

        outBuffer.reset();
        assertEquals(ActionflowCli.EXIT_VALID, run("--version"));
        assertThat(out()).startsWith("Actionflow Workflow Validator v");
    }
}
