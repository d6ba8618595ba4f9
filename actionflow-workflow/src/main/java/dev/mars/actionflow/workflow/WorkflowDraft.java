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
import dev.mars.actionflow.model.Workflow;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable workflow under construction, with the source position of each positioned field.
 */
final class WorkflowDraft {

    final String identifier;
    final SourcePosition block;

    String on = "";
    List<String> resolves = new ArrayList<>();

    SourcePosition onPosition = SourcePosition.unknown();
    SourcePosition resolvesPosition = SourcePosition.unknown();

    private final Set<String> seenKeys = new HashSet<>();

    WorkflowDraft(String identifier, SourcePosition block) {
        this.identifier = identifier;
        this.block = block;
    }

    boolean markSeen(String key) {
        return !seenKeys.add(key);
    }

    Workflow toWorkflow() {
        return new Workflow(identifier, on, resolves);
    }
}
