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

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The optional {@code runs} and {@code args} attributes of an action. Each takes one of two forms:
 * <ul>
 *   <li>{@code runs = "entrypoint arg1 arg2"} - a {@link StringCommand}, split at whitespace</li>
 *   <li>{@code runs = ["entrypoint", "arg1", "arg2"]} - a {@link ListCommand}, used verbatim</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 2.0
 * @since 2025-08-18
 */
public sealed interface Command permits Command.StringCommand, Command.ListCommand {

    /**
     * The original string value; empty for the list form.
     */
    String raw();

    /**
     * The resolved argument vector.
     */
    List<String> arguments();

    /**
     * The command as a single string, joining list entries with spaces.
     */
    String join();

    default boolean isEmpty() {
        return arguments().isEmpty();
    }

    /**
     * Value carried by an action that declared no command.
     */
    static Command none() {
        return new ListCommand(List.of());
    }

    record StringCommand(String value) implements Command {

        // Unicode White_Space, including NEL and no-break space
        private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

        public StringCommand {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String raw() {
            return value;
        }

        @Override
        public List<String> arguments() {
            return WHITESPACE.splitAsStream(value)
                    .filter(field -> !field.isEmpty())
                    .toList();
        }

        @Override
        public String join() {
            return value;
        }
    }

    record ListCommand(List<String> values) implements Command {
        public ListCommand {
            values = values != null ? List.copyOf(values) : List.of();
        }

        @Override
        public String raw() {
            return "";
        }

        @Override
        public List<String> arguments() {
            return values;
        }

        @Override
        public String join() {
            return String.join(" ", values);
        }
    }
}
