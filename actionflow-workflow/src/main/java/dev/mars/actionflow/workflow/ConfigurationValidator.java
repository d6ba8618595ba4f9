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

import dev.mars.actionflow.diagnostic.SourcePosition;
import dev.mars.actionflow.model.EventTypes;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Second pass over the extracted drafts: cross-references, cycles, required attributes,
 * reserved names and the secret ceiling. Only ever appends diagnostics.
 *
 * <p>Checks run in a fixed order: {@code needs} references, dependency cycles,
 * per-action checks, per-workflow checks.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
class ConfigurationValidator {

    static final int MAX_SECRETS = 100;
    static final String RESERVED_PREFIX = "GITHUB_";
    static final String RESERVED_EXEMPTION = "GITHUB_TOKEN";

    private static final Pattern VARIABLE_NAME = Pattern.compile("\\A[A-Za-z_][A-Za-z_0-9]*\\z");

    private final ParseState state;
    private final DiagnosticCollector diagnostics;
    private final EventTypes eventTypes;

    ConfigurationValidator(ParseState state, EventTypes eventTypes) {
        this.state = state;
        this.diagnostics = state.diagnostics;
        this.eventTypes = eventTypes;
    }

    void validate() {
        checkNeeds();
        checkCircularDependencies();
        checkActions();
        checkWorkflows();
    }

    private Set<String> actionNames() {
        Set<String> names = new HashSet<>();
        for (ActionDraft action : state.actions) {
            names.add(action.identifier);
        }
        return names;
    }

    private void checkNeeds() {
        Set<String> names = actionNames();
        for (ActionDraft action : state.actions) {
            for (String need : action.needs) {
                if (!names.contains(need)) {
                    diagnostics.addError(action.needsPosition,
                            "Action `" + action.identifier + "' needs nonexistent action `" + need + "'");
                }
            }
        }

        // dangling entries stay; only duplicates go
        for (ActionDraft action : state.actions) {
            if (action.needs.size() >= 2) {
                action.needs = List.copyOf(new LinkedHashSet<>(action.needs));
            }
        }
    }

    private void checkCircularDependencies() {
        DependencyGraph graph = new DependencyGraph(state.buildActions());
        for (DependencyGraph.Cycle cycle : graph.findElementaryCycles()) {
            ActionDraft closing = state.actions.get(cycle.lastIndex());
            diagnostics.addFatal(closing.needsPosition, "Circular dependency on `" + cycle.start() + "'");
        }
    }

    private void checkActions() {
        Set<String> secrets = new HashSet<>();
        for (ActionDraft action : state.actions) {
            if (action.uses.raw().isEmpty()) {
                diagnostics.addError(action.block,
                        "Action `" + action.identifier + "' must have a `uses' attribute");
            }

            for (String secret : action.secrets) {
                if (secrets.add(secret) && secrets.size() == MAX_SECRETS + 1) {
                    diagnostics.addError(action.secretsPosition,
                            "All actions combined must not have more than " + MAX_SECRETS + " unique secrets");
                }
            }

            for (String key : action.env.keySet()) {
                checkVariableName(key, action.envPosition);
            }

            Set<String> seenSecrets = new HashSet<>();
            for (String secret : action.secrets) {
                checkVariableName(secret, action.secretsPosition);
                if (action.env.containsKey(secret)) {
                    diagnostics.addError(action.secretsPosition,
                            "Secret `" + secret + "' conflicts with an environment variable with the same name");
                }
                if (!seenSecrets.add(secret)) {
                    diagnostics.addWarning(action.secretsPosition, "Secret `" + secret + "' redefined");
                }
            }
        }
    }

    private void checkVariableName(String key, SourcePosition position) {
        if (!RESERVED_EXEMPTION.equals(key) && key.startsWith(RESERVED_PREFIX)) {
            diagnostics.addWarning(position,
                    "Environment variables and secrets beginning with `" + RESERVED_PREFIX + "' are reserved");
        }
        if (!VARIABLE_NAME.matcher(key).matches()) {
            diagnostics.addWarning(position,
                    "Environment variables and secrets must contain only A-Z, a-z, 0-9, and _ characters, got `"
                            + key + "'");
        }
    }

    private void checkWorkflows() {
        Set<String> names = actionNames();
        for (WorkflowDraft workflow : state.workflows) {
            if (workflow.on.isEmpty()) {
                diagnostics.addError(workflow.block,
                        "Workflow `" + workflow.identifier + "' must have an `on' attribute");
            } else if (!eventTypes.isAllowed(workflow.on)) {
                diagnostics.addError(workflow.onPosition,
                        "Workflow `" + workflow.identifier + "' has unknown `on' value `" + workflow.on + "'");
            }

            for (String goal : workflow.resolves) {
                if (!names.contains(goal)) {
                    diagnostics.addError(workflow.resolvesPosition,
                            "Workflow `" + workflow.identifier + "' resolves unknown action `" + goal + "'");
                }
            }
        }
    }
}
