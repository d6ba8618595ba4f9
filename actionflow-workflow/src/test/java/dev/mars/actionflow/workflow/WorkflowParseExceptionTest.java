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

package dev.mars.actionflow.workflow;

import dev.mars.actionflow.diagnostic.Diagnostic;
import dev.mars.actionflow.diagnostic.SourcePosition;
import dev.mars.actionflow.core.exceptions.ActionflowException;
import dev.mars.actionflow.model.Configuration;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WorkflowParseException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-20
 */
class WorkflowParseExceptionTest {

    @Test
    void testBasicConstructor() {
        String message = "Failed to parse workflow file";

        WorkflowParseException exception = new WorkflowParseException(message);

        assertEquals(message, exception.getMessage());
        assertNull(exception.getCause());
        assertNull(exception.getFileName());
        assertEquals(-1, exception.getLineNumber());
        assertNull(exception.getConfiguration());
        assertTrue(exception.getDiagnostics().isEmpty());
    }

    @Test
    void testConstructorWithFileNameAndCause() {
        IOException cause = new IOException("No such file");

        WorkflowParseException exception = new WorkflowParseException("main.workflow", "Failed to read workflow file", cause);

        assertEquals("File 'main.workflow': Failed to read workflow file", exception.getMessage());
        assertEquals(cause, exception.getCause());
        assertEquals("main.workflow", exception.getFileName());
        assertInstanceOf(ActionflowException.class, exception);
    }

    @Test
    void testConstructorFromDiagnostics() {
        Configuration configuration = Configuration.empty(List.of(
                Diagnostic.error(SourcePosition.of(3, 5), "Action `a' must have a `uses' attribute"),
                Diagnostic.warning(SourcePosition.of(7, 1), "Unknown action attribute `x'")));

        WorkflowParseException exception = new WorkflowParseException("main.workflow", configuration);

        assertEquals(3, exception.getLineNumber());
        assertEquals("File 'main.workflow': Line 3: Action `a' must have a `uses' attribute (and 1 more)",
                exception.getMessage());
        assertSame(configuration, exception.getConfiguration());
        assertEquals(2, exception.getDiagnostics().size());
    }

    @Test
    void testEmptyFileNameOmitted() {
        Configuration configuration = Configuration.empty(List.of(
                Diagnostic.fatal(SourcePosition.of(1, 14), "Object expected closing RBRACE got: EOF")));

        WorkflowParseException exception = new WorkflowParseException("", configuration);

        assertNull(exception.getFileName());
        assertEquals("Line 1: Object expected closing RBRACE got: EOF", exception.getMessage());
    }

    @Test
    void testUnknownLineOmitted() {
        Configuration configuration = Configuration.empty(List.of(
                Diagnostic.error(SourcePosition.unknown(), "Something went wrong")));

        WorkflowParseException exception = new WorkflowParseException(null, configuration);

        assertEquals(-1, exception.getLineNumber());
        assertEquals("Something went wrong", exception.getMessage());
    }
}
