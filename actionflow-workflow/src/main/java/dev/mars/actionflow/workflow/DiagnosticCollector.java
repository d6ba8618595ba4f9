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
import dev.mars.actionflow.diagnostic.Severity;
import dev.mars.actionflow.diagnostic.SourcePosition;
import dev.mars.actionflow.hcl.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Accumulates diagnostics during one parse, in emission order.
 */
public class DiagnosticCollector {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void addWarning(Node node, String message) {
        add(Severity.WARNING, node.position(), message);
    }

    public void addWarning(SourcePosition position, String message) {
        add(Severity.WARNING, position, message);
    }

    public void addError(Node node, String message) {
        add(Severity.ERROR, node.position(), message);
    }

    public void addError(SourcePosition position, String message) {
        add(Severity.ERROR, position, message);
    }

    public void addFatal(SourcePosition position, String message) {
        add(Severity.FATAL, position, message);
    }

    public void add(Severity severity, SourcePosition position, String message) {
        diagnostics.add(new Diagnostic(severity, position, message));
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * Diagnostics stably sorted by line. Diagnostics on one line keep their emission order,
     * which is left to right with extraction before validation.
     */
    public List<Diagnostic> getSortedDiagnostics() {
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(Comparator.comparingInt(Diagnostic::getLineNumber));
        return List.copyOf(sorted);
    }

    public boolean hasAtLeast(Severity severity) {
        return diagnostics.stream().anyMatch(d -> d.getSeverity().isAtLeast(severity));
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(d -> d.getSeverity() == severity).count();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }

    @Override
    public String toString() {
        return "DiagnosticCollector{" +
               "warnings=" + count(Severity.WARNING) +
               ", errors=" + count(Severity.ERROR) +
               ", fatal=" + count(Severity.FATAL) +
               '}';
    }
}
