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

package dev.mars.actionflow.model;

import dev.mars.actionflow.diagnostic.Diagnostic;
import dev.mars.actionflow.diagnostic.Severity;
import dev.mars.actionflow.diagnostic.SourcePosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Configuration}, {@link Action} and {@link Workflow}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
class ConfigurationTest {

    private Configuration configuration;

    @BeforeEach
    void setUp() {
        Action build = Action.builder("build")
                .uses(new Uses.InRepo("./build"))
                .build();
        Action deploy = Action.builder("deploy")
                .uses(new Uses.DockerImage("alpine"))
                .needs(List.of("build"))
                .secrets(List.of("TOKEN"))
                .build();
        Action duplicate = Action.builder("build")
                .uses(new Uses.InRepo("./other"))
                .build();

        configuration = new Configuration(0,
                List.of(build, deploy, duplicate),
                List.of(new Workflow("ci", "push", List.of("deploy")),
                        new Workflow("release", "Release", List.of("deploy"))),
                List.of(Diagnostic.warning(SourcePosition.of(3, 1), "first warning"),
                        Diagnostic.error(SourcePosition.of(7, 5), "first error")));
    }

    @Test
    void testGetActionReturnsFirstDeclaration() {
        assertEquals("./build", configuration.getAction("build").orElseThrow().getUses().raw());
        assertTrue(configuration.getAction("missing").isEmpty());
    }

    @Test
    void testGetWorkflow() {
        assertEquals("push", configuration.getWorkflow("ci").orElseThrow().getOn());
        assertTrue(configuration.getWorkflow("deploy").isEmpty());
    }

    @Test
    void testGetWorkflowsForEventIsCaseInsensitive() {
        assertThat(configuration.getWorkflows("release"))
                .extracting(Workflow::getIdentifier)
                .containsExactly("release");
        assertThat(configuration.getWorkflows("pull_request")).isEmpty();
    }

    @Test
    void testFirstDiagnostic() {
        assertEquals("first warning", configuration.firstDiagnostic(Severity.WARNING).orElseThrow().getMessage());
        assertEquals("first error", configuration.firstDiagnostic(Severity.ERROR).orElseThrow().getMessage());
        assertTrue(configuration.firstDiagnostic(Severity.FATAL).isEmpty());
    }

    @Test
    void testActionDefaults() {
        Action action = Action.builder("bare").build();

        assertEquals(Uses.missing(), action.getUses());
        assertTrue(action.getRuns().isEmpty());
        assertTrue(action.getArgs().isEmpty());
        assertTrue(action.getNeeds().isEmpty());
        assertTrue(action.getEnv().isEmpty());
        assertTrue(action.getSecrets().isEmpty());
    }

    @Test
    void testActionEnvKeepsDeclarationOrder() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("ZETA", "1");
        env.put("ALPHA", "2");
        env.put("MID", "3");

        Action action = Action.builder("a").env(env).build();

        assertThat(action.getEnv().keySet()).containsExactly("ZETA", "ALPHA", "MID");
        assertThrows(UnsupportedOperationException.class, () -> action.getEnv().put("X", "y"));
    }

    @Test
    void testModelIsImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> configuration.getActions().clear());
        assertThrows(UnsupportedOperationException.class, () -> configuration.getDiagnostics().clear());
    }

    @Test
    void testEmptyConfiguration() {
        Configuration empty = Configuration.empty(List.of());

        assertEquals(0, empty.getVersion());
        assertTrue(empty.getActions().isEmpty());
        assertTrue(empty.getWorkflows().isEmpty());
        assertEquals(empty, Configuration.empty(null));
    }

    @Test
    void testWorkflowDefaults() {
        Workflow workflow = new Workflow("w", null, null);

        assertEquals("", workflow.getOn());
        assertTrue(workflow.getResolves().isEmpty());
    }
}
