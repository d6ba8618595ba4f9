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

import dev.mars.actionflow.config.ActionflowConfiguration;
import dev.mars.actionflow.diagnostic.Severity;
import dev.mars.actionflow.model.EventTypes;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ParserOptions}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-20
 */
class ParserOptionsTest {

    @Test
    void testDefaults() {
        ParserOptions options = ParserOptions.defaults();

        assertEquals(Severity.WARNING, options.getFailureThreshold());
        assertEquals("", options.getFileName());
        assertEquals(EventTypes.defaults(), options.getEventTypes());
        assertTrue(options.isFailure(Severity.WARNING));
    }

    @Test
    void testSuppressWarnings() {
        ParserOptions options = ParserOptions.builder().suppressWarnings().build();

        assertFalse(options.isFailure(Severity.WARNING));
        assertTrue(options.isFailure(Severity.ERROR));
        assertTrue(options.isFailure(Severity.FATAL));
    }

    @Test
    void testSuppressErrors() {
        ParserOptions options = ParserOptions.builder().suppressErrors().build();

        assertFalse(options.isFailure(Severity.WARNING));
        assertFalse(options.isFailure(Severity.ERROR));
        assertTrue(options.isFailure(Severity.FATAL));
    }

    @Test
    void testToBuilderCopiesEverySetting() {
        ParserOptions original = ParserOptions.builder()
                .suppressErrors()
                .fileName("main.workflow")
                .eventTypes(EventTypes.of("push"))
                .build();

        ParserOptions copy = original.toBuilder().build();

        assertEquals(Severity.FATAL, copy.getFailureThreshold());
        assertEquals("main.workflow", copy.getFileName());
        assertEquals(EventTypes.of("push"), copy.getEventTypes());
    }

    @Test
    void testNullFileNameBecomesEmpty() {
        assertEquals("", ParserOptions.builder().fileName(null).build().getFileName());
    }

    @Test
    void testNullThresholdRejected() {
        assertThrows(NullPointerException.class, () -> ParserOptions.builder().failureThreshold(null));
    }

    @Test
    void testFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(ActionflowConfiguration.FAILURE_THRESHOLD, "error");
        properties.setProperty(ActionflowConfiguration.EXTRA_EVENT_TYPES, "schedule, merge_group");
        properties.setProperty(ActionflowConfiguration.REMOVED_EVENT_TYPES, "watch");

        ParserOptions options = ParserOptions.fromConfiguration(new ActionflowConfiguration(properties));

        assertEquals(Severity.ERROR, options.getFailureThreshold());
        assertTrue(options.getEventTypes().isAllowed("schedule"));
        assertTrue(options.getEventTypes().isAllowed("merge_group"));
        assertFalse(options.getEventTypes().isAllowed("watch"));
        assertTrue(options.getEventTypes().isAllowed("push"));
    }
}
