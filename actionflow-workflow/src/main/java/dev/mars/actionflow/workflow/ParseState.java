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

import dev.mars.actionflow.model.Action;
import dev.mars.actionflow.model.Configuration;
import dev.mars.actionflow.model.Workflow;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one parse builds up: the version, the drafts in file order and the diagnostics.
 * Owned by a single parse call and discarded when it returns.
 */
final class ParseState {

    int version;
    final List<ActionDraft> actions = new ArrayList<>();
    final List<WorkflowDraft> workflows = new ArrayList<>();
    final DiagnosticCollector diagnostics = new DiagnosticCollector();

    List<Action> buildActions() {
        return actions.stream().map(ActionDraft::toAction).toList();
    }

    List<Workflow> buildWorkflows() {
        return workflows.stream().map(WorkflowDraft::toWorkflow).toList();
    }

    Configuration toConfiguration() {
        return new Configuration(version, buildActions(), buildWorkflows(), diagnostics.getSortedDiagnostics());
    }
}
