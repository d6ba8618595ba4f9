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
import dev.mars.actionflow.model.Action;
import dev.mars.actionflow.model.Command;
import dev.mars.actionflow.model.Uses;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable action under construction, with the source position of each positioned field.
 */
final class ActionDraft {

    final String identifier;
    final SourcePosition block;

    Uses uses = Uses.missing();
    Command runs;
    Command args;
    List<String> needs = new ArrayList<>();
    Map<String, String> env = new LinkedHashMap<>();
    List<String> secrets = new ArrayList<>();

    SourcePosition needsPosition = SourcePosition.unknown();
    SourcePosition envPosition = SourcePosition.unknown();
    SourcePosition secretsPosition = SourcePosition.unknown();

    private final Set<String> seenKeys = new HashSet<>();

    ActionDraft(String identifier, SourcePosition block) {
        this.identifier = identifier;
        this.block = block;
    }

    /**
     * Records that an attribute key was seen.
     *
     * @return true if the key already appeared in this block
     */
    boolean markSeen(String key) {
        return !seenKeys.add(key);
    }

    Action toAction() {
        return Action.builder(identifier)
                .uses(uses)
                .runs(runs)
                .args(args)
                .needs(needs)
                .env(env)
                .secrets(secrets)
                .build();
    }
}
