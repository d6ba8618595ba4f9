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

import dev.mars.actionflow.hcl.ListNode;
import dev.mars.actionflow.hcl.Node;
import dev.mars.actionflow.model.Command;

import java.util.Optional;

/**
 * Reads the {@code runs} and {@code args} attributes of an action.
 * A list is used verbatim; a string is kept raw and split at whitespace.
 */
class CommandParser {

    private final LiteralCoercer coercer;
    private final DiagnosticCollector diagnostics;

    CommandParser(LiteralCoercer coercer, DiagnosticCollector diagnostics) {
        this.coercer = coercer;
        this.diagnostics = diagnostics;
    }

    /**
     * @param name       the attribute name, for messages
     * @param actionId   the owning action, for messages
     * @param allowBlank whether an empty string is accepted
     * @return the command, or empty if the value was rejected
     */
    Optional<Command> parse(Node node, String name, String actionId, boolean allowBlank) {
        if (node instanceof ListNode) {
            return coercer.toStringList(node, false).map(Command.ListCommand::new);
        }

        Optional<String> raw = coercer.toStringValue(node);
        if (raw.isEmpty()) {
            diagnostics.addError(node, "The `" + name + "' attribute must be a string or a list");
            return Optional.empty();
        }
        if (raw.get().isEmpty() && !allowBlank) {
            diagnostics.addError(node, "`" + name + "' value in action `" + actionId + "' cannot be blank");
            return Optional.empty();
        }
        return Optional.of(new Command.StringCommand(raw.get()));
    }
}
