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

import dev.mars.actionflow.hcl.Node;
import dev.mars.actionflow.hcl.ObjectItem;
import dev.mars.actionflow.hcl.ObjectKey;
import dev.mars.actionflow.hcl.ObjectList;
import dev.mars.actionflow.hcl.ObjectNode;
import dev.mars.actionflow.model.Uses;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Walks the top level of a syntax tree and turns {@code version}, {@code action} and
 * {@code workflow} declarations into drafts.
 *
 * <p>Extraction never stops early: a malformed declaration or attribute is reported,
 * skipped or left at its default, and the walk carries on with the next one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
class StructuralExtractor {

    private static final Logger logger = Logger.getLogger(StructuralExtractor.class.getName());

    static final int MIN_VERSION = 0;
    static final int MAX_VERSION = 0;

    private static final String ACTION = "action";
    private static final String WORKFLOW = "workflow";

    private final ParseState state;
    private final DiagnosticCollector diagnostics;
    private final LiteralCoercer coercer;
    private final CommandParser commandParser;
    private final Set<String> identifiers = new HashSet<>();

    StructuralExtractor(ParseState state) {
        this.state = state;
        this.diagnostics = state.diagnostics;
        this.coercer = new LiteralCoercer(diagnostics);
        this.commandParser = new CommandParser(coercer, diagnostics);
    }

    void extract(ObjectList root) {
        List<ObjectItem> items = root.items();
        for (int index = 0; index < items.size(); index++) {
            ObjectItem item = items.get(index);
            if (item.hasAssign()) {
                parseVersion(index, item);
            } else {
                parseBlock(item);
            }
        }
        logger.fine(() -> "Extracted " + state.actions.size() + " action(s) and "
                + state.workflows.size() + " workflow(s)");
    }

    private void parseVersion(int index, ObjectItem item) {
        if (item.keys().size() != 1 || !"version".equals(item.firstKey().name())) {
            diagnostics.addError(item.value(), "Toplevel declarations cannot be assignments");
            return;
        }
        if (index != 0) {
            diagnostics.addError(item.value(), "`version` must be the first declaration");
            return;
        }
        Optional<BigInteger> version = coercer.toInteger(item.value());
        if (version.isEmpty()) {
            return;
        }
        BigInteger value = version.get();
        if (value.compareTo(BigInteger.valueOf(MIN_VERSION)) < 0 || value.compareTo(BigInteger.valueOf(MAX_VERSION)) > 0) {
            diagnostics.addError(item.value(), "`version = " + value + "` is not supported");
            return;
        }
        state.version = value.intValueExact();
    }

    private void parseBlock(ObjectItem item) {
        if (item.keys().size() != 2) {
            diagnostics.addError(item, "Invalid toplevel declaration");
            return;
        }

        String kind = item.firstKey().name();
        String id;
        switch (kind) {
            case ACTION -> {
                ActionDraft action = parseAction(item);
                if (action == null) {
                    return;
                }
                id = action.identifier;
                state.actions.add(action);
            }
            case WORKFLOW -> {
                WorkflowDraft workflow = parseWorkflow(item);
                if (workflow == null) {
                    return;
                }
                id = workflow.identifier;
                state.workflows.add(workflow);
            }
            default -> {
                diagnostics.addError(item, "Invalid toplevel keyword, `" + kind + "'");
                return;
            }
        }

        // actions and workflows share one namespace
        if (!identifiers.add(id)) {
            diagnostics.addError(item, "Identifier `" + id + "' redefined");
        }
    }

    /**
     * Checks the quoted name and the {@code { ... }} body shared by both block kinds.
     *
     * @return the body, or null if the declaration was rejected
     */
    private ObjectNode parsePreamble(ObjectItem item, String kind) {
        ObjectKey nameKey = item.keys().get(1);
        if (!nameKey.token().isQuoted() || nameKey.text().length() < 3) {
            diagnostics.addError(nameKey, "Invalid format for identifier `" + nameKey.text() + "'");
            return null;
        }

        if (!(item.value() instanceof ObjectNode body)) {
            diagnostics.addError(item.value(), "Each " + kind + " must have an { ...  } block");
            return null;
        }

        checkAssignmentsOnly(body.list(), kind + " `" + nameKey.name() + "'");
        return body;
    }

    private void checkAssignmentsOnly(ObjectList list, String owner) {
        for (ObjectItem item : list.items()) {
            if (!item.isAssignment()) {
                diagnostics.addError(item.firstKey(), "Each attribute of " + owner + " must be an assignment");
                continue;
            }
            if (item.value() instanceof ObjectNode child) {
                checkAssignmentsOnly(child.list(), "the object");
            }
        }
    }

    private ActionDraft parseAction(ObjectItem item) {
        ObjectNode body = parsePreamble(item, ACTION);
        if (body == null) {
            return null;
        }

        ActionDraft action = new ActionDraft(item.keys().get(1).name(), body.position());
        for (ObjectItem attribute : body.list().items()) {
            parseActionAttribute(action, attribute.firstKey().name(), attribute.value());
        }
        return action;
    }

    private void parseActionAttribute(ActionDraft action, String name, Node value) {
        switch (name) {
            case "uses" -> parseUses(action, value);
            case "needs" -> coercer.toStringList(value, true).ifPresent(needs -> {
                action.needs = needs;
                action.needsPosition = value.position();
            });
            case "runs" -> {
                warnIfRedefined(action, name, value);
                commandParser.parse(value, name, action.identifier, false).ifPresent(c -> action.runs = c);
            }
            case "args" -> {
                warnIfRedefined(action, name, value);
                commandParser.parse(value, name, action.identifier, true).ifPresent(c -> action.args = c);
            }
            case "env" -> {
                coercer.toStringMap(value).ifPresent(env -> action.env = env);
                action.envPosition = value.position();
            }
            case "secrets" -> coercer.toStringList(value, false).ifPresent(secrets -> {
                action.secrets = secrets;
                action.secretsPosition = value.position();
            });
            default -> diagnostics.addWarning(value, "Unknown action attribute `" + name + "'");
        }
    }

    private void warnIfRedefined(ActionDraft action, String name, Node value) {
        if (action.markSeen(name)) {
            diagnostics.addWarning(value, "`" + name + "' redefined in action `" + action.identifier + "'");
        }
    }

    private void parseUses(ActionDraft action, Node value) {
        warnIfRedefined(action, "uses", value);

        Optional<String> raw = coercer.toStringValue(value);
        if (raw.isEmpty()) {
            return;
        }
        if (raw.get().isEmpty()) {
            diagnostics.addError(value, "`uses' value in action `" + action.identifier + "' cannot be blank");
            return;
        }

        Uses uses = UsesParser.parse(raw.get());
        if (uses instanceof Uses.Unrecognized) {
            diagnostics.addError(value, "The `uses' attribute must be a path, a Docker image, or owner/repo@ref");
        }
        action.uses = uses;
    }

    private WorkflowDraft parseWorkflow(ObjectItem item) {
        ObjectNode body = parsePreamble(item, WORKFLOW);
        if (body == null) {
            return null;
        }

        WorkflowDraft workflow = new WorkflowDraft(item.keys().get(1).name(), body.position());
        for (ObjectItem attribute : body.list().items()) {
            String name = attribute.firstKey().name();
            Node value = attribute.value();
            switch (name) {
                case "on" -> parseOn(workflow, value);
                case "resolves" -> parseResolves(workflow, value);
                default -> diagnostics.addWarning(value, "Unknown workflow attribute `" + name + "'");
            }
        }
        return workflow;
    }

    private void parseOn(WorkflowDraft workflow, Node value) {
        if (workflow.markSeen("on")) {
            diagnostics.addWarning(value, "`on' redefined in workflow `" + workflow.identifier + "'");
        }

        Optional<String> on = coercer.toStringValue(value);
        if (on.isEmpty()) {
            diagnostics.addError(value, "Invalid format for `on' in workflow `" + workflow.identifier
                    + "', expected string");
            return;
        }
        if (on.get().isEmpty()) {
            diagnostics.addError(value, "`on' value in workflow `" + workflow.identifier + "' cannot be blank");
            return;
        }
        workflow.on = on.get();
        workflow.onPosition = value.position();
    }

    private void parseResolves(WorkflowDraft workflow, Node value) {
        if (workflow.markSeen("resolves")) {
            diagnostics.addWarning(value, "`resolves' redefined in workflow `" + workflow.identifier + "'");
        }

        Optional<List<String>> resolves = coercer.toStringList(value, true);
        if (resolves.isEmpty()) {
            diagnostics.addError(value, "Invalid format for `resolves' in workflow `" + workflow.identifier
                    + "', expected list of strings");
            return;
        }
        workflow.resolves = resolves.get();
        workflow.resolvesPosition = value.position();
    }
}
