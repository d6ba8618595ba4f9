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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
class EventTypesTest {

    @ParameterizedTest
    @ValueSource(strings = {"push", "PUSH", "Pull_Request", "repository_dispatch", "watch"})
    void testDefaultsAreCaseInsensitive(String eventType) {
        assertTrue(EventTypes.defaults().isAllowed(eventType));
    }

    @Test
    void testUnknownEventRejected() {
        assertFalse(EventTypes.defaults().isAllowed("pushh"));
        assertFalse(EventTypes.defaults().isAllowed(null));
        assertEquals(27, EventTypes.defaults().names().size());
    }

    @ParameterizedTest
    @ValueSource(strings = {" push", "push ", " push ", "\tpush"})
    void testSurroundingWhitespaceIsNotIgnored(String eventType) {
        assertFalse(EventTypes.defaults().isAllowed(eventType));
        assertFalse(EventTypes.isMatching(eventType, "push"));
    }

    @Test
    void testAddAndRemoveReturnNewRegistry() {
        EventTypes custom = EventTypes.defaults()
                .withAdded(List.of("Schedule", " "))
                .withRemoved(List.of("GOLLUM"));

        assertTrue(custom.isAllowed("schedule"));
        assertFalse(custom.isAllowed("gollum"));
        assertEquals(27, custom.names().size());

        assertFalse(EventTypes.defaults().isAllowed("schedule"));
        assertTrue(EventTypes.defaults().isAllowed("gollum"));
    }

    @Test
    void testOf() {
        EventTypes types = EventTypes.of("deploy");

        assertTrue(types.isAllowed("Deploy"));
        assertFalse(types.isAllowed("push"));
    }

    @Test
    void testIsMatching() {
        assertTrue(EventTypes.isMatching("Push", "push"));
        assertFalse(EventTypes.isMatching("push", "release"));
        assertFalse(EventTypes.isMatching(null, "push"));
    }
}
