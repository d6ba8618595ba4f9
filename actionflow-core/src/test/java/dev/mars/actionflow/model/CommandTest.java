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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
class CommandTest {

    @Test
    void testStringCommandSplitsOnWhitespace() {
        Command command = new Command.StringCommand("  make   test\tall ");

        assertEquals(List.of("make", "test", "all"), command.arguments());
        assertEquals("  make   test\tall ", command.raw());
        assertFalse(command.isEmpty());
    }

    @Test
    void testBlankStringCommandHasNoArguments() {
        Command command = new Command.StringCommand("   ");

        assertTrue(command.arguments().isEmpty());
        assertTrue(command.isEmpty());
    }

    @Test
    void testStringCommandSplitsOnUnicodeWhitespace() {
        Command command = new Command.StringCommand(" make\u0085test all　");

        assertEquals(List.of("make", "test", "all"), command.arguments());
    }

    @Test
    void testListCommandIsUsedVerbatim() {
        Command command = new Command.ListCommand(List.of("sh", "-c", "echo hello world"));

        assertEquals(List.of("sh", "-c", "echo hello world"), command.arguments());
        assertEquals("", command.raw());
        assertEquals("sh -c echo hello world", command.join());
    }

    @Test
    void testListCommandCopiesInput() {
        List<String> values = Arrays.asList("a", "b");
        Command command = new Command.ListCommand(values);
        values.set(0, "changed");

        assertEquals(List.of("a", "b"), command.arguments());
        assertThrows(UnsupportedOperationException.class, () -> command.arguments().add("c"));
    }

    @Test
    void testNoneIsEmptyListForm() {
        assertInstanceOf(Command.ListCommand.class, Command.none());
        assertTrue(Command.none().isEmpty());
        assertEquals("", Command.none().join());
    }
}
