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

/**
 * A single {@code workflow} block: binds a trigger event to the set of goal actions it resolves.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class Workflow {

    private final String identifier;
    private final String on;
    private final List<String> resolves;

    public Workflow(String identifier, String on, List<String> resolves) {
        this.identifier = Objects.requireNonNull(identifier, "Identifier cannot be null");
        this.on = on != null ? on : "";
        this.resolves = resolves != null ? List.copyOf(resolves) : List.of();
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * The event type name exactly as written; empty when missing.
     */
    public String getOn() {
        return on;
    }

    /**
     * Goal action names in declaration order. Duplicates and undeclared names are kept.
     */
    public List<String> getResolves() {
        return resolves;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Workflow workflow = (Workflow) o;
        return Objects.equals(identifier, workflow.identifier) &&
               Objects.equals(on, workflow.on) &&
               Objects.equals(resolves, workflow.resolves);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, on, resolves);
    }

    @Override
    public String toString() {
        return "Workflow{" +
               "identifier='" + identifier + '\'' +
               ", on='" + on + '\'' +
               ", resolves=" + resolves +
               '}';
    }
}
