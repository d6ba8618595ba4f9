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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed workflow file: its version, its actions and workflows in file order,
 * and the diagnostics reported while parsing it.
 *
 * <p>A configuration returned from a successful parse only carries diagnostics below the
 * failure threshold. One attached to a parse failure may be partial.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class Configuration {

    private final int version;
    private final List<Action> actions;
    private final List<Workflow> workflows;
    private final List<Diagnostic> diagnostics;

    public Configuration(int version, List<Action> actions, List<Workflow> workflows,
                         List<Diagnostic> diagnostics) {
        this.version = version;
        this.actions = actions != null ? List.copyOf(actions) : List.of();
        this.workflows = workflows != null ? List.copyOf(workflows) : List.of();
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public static Configuration empty(List<Diagnostic> diagnostics) {
        return new Configuration(0, List.of(), List.of(), diagnostics);
    }

    public int getVersion() {
        return version;
    }

    public List<Action> getActions() {
        return actions;
    }

    public List<Workflow> getWorkflows() {
        return workflows;
    }

    /**
     * Diagnostics sorted by line; diagnostics on the same line keep the order they were reported in.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Looks up an action by identifier. When the identifier was redefined, the first declaration wins.
     */
    public Optional<Action> getAction(String identifier) {
        return actions.stream()
                .filter(action -> action.getIdentifier().equals(identifier))
                .findFirst();
    }

    public Optional<Workflow> getWorkflow(String identifier) {
        return workflows.stream()
                .filter(workflow -> workflow.getIdentifier().equals(identifier))
                .findFirst();
    }

    /**
     * Gets all workflows triggered by the given event type, e.g. {@code getWorkflows("push")}.
     */
    public List<Workflow> getWorkflows(String eventType) {
        return workflows.stream()
                .filter(workflow -> EventTypes.isMatching(workflow.getOn(), eventType))
                .toList();
    }

    /**
     * Finds the first diagnostic at or above the given severity. A caller intending to run the file
     * might check {@code firstDiagnostic(Severity.WARNING)}, one intending only to display it
     * {@code firstDiagnostic(Severity.FATAL)}.
     */
    public Optional<Diagnostic> firstDiagnostic(Severity severity) {
        return diagnostics.stream()
                .filter(d -> d.getSeverity().isAtLeast(severity))
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Configuration that = (Configuration) o;
        return version == that.version &&
               Objects.equals(actions, that.actions) &&
               Objects.equals(workflows, that.workflows) &&
               Objects.equals(diagnostics, that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, actions, workflows, diagnostics);
    }

    @Override
    public String toString() {
        return "Configuration{" +
               "version=" + version +
               ", actions=" + actions.size() +
               ", workflows=" + workflows.size() +
               ", diagnostics=" + diagnostics.size() +
               '}';
    }
}
