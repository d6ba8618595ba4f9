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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single {@code action} block: a named unit of work with an invocation target,
 * an optional command, dependencies, environment and secrets.
 *
 * <p>Instances are immutable and created through {@link #builder(String)}.
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * Action action = Action.builder("deploy")
 *     .uses(new Uses.DockerImage("alpine"))
 *     .needs(List.of("build"))
 *     .secrets(List.of("API_TOKEN"))
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class Action {

    private final String identifier;
    private final Uses uses;
    private final Command runs;
    private final Command args;
    private final List<String> needs;
    private final Map<String, String> env;
    private final List<String> secrets;

    private Action(Builder builder) {
        this.identifier = Objects.requireNonNull(builder.identifier, "Identifier cannot be null");
        this.uses = builder.uses != null ? builder.uses : Uses.missing();
        this.runs = builder.runs != null ? builder.runs : Command.none();
        this.args = builder.args != null ? builder.args : Command.none();
        this.needs = List.copyOf(builder.needs);
        // Map.copyOf does not keep declaration order
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(builder.env));
        this.secrets = List.copyOf(builder.secrets);
    }

    public static Builder builder(String identifier) {
        return new Builder(identifier);
    }

    public String getIdentifier() {
        return identifier;
    }

    public Uses getUses() {
        return uses;
    }

    public Command getRuns() {
        return runs;
    }

    public Command getArgs() {
        return args;
    }

    /**
     * Names of the actions this one depends on, deduplicated, in declaration order.
     * Entries naming undeclared actions are kept.
     */
    public List<String> getNeeds() {
        return needs;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    /**
     * Secret names in declaration order. Duplicates are kept.
     */
    public List<String> getSecrets() {
        return secrets;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Action action = (Action) o;
        return Objects.equals(identifier, action.identifier) &&
               Objects.equals(uses, action.uses) &&
               Objects.equals(runs, action.runs) &&
               Objects.equals(args, action.args) &&
               Objects.equals(needs, action.needs) &&
               Objects.equals(env, action.env) &&
               Objects.equals(secrets, action.secrets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, uses, runs, args, needs, env, secrets);
    }

    @Override
    public String toString() {
        return "Action{" +
               "identifier='" + identifier + '\'' +
               ", uses=" + uses +
               ", needs=" + needs +
               ", secrets=" + secrets.size() +
               '}';
    }

    public static class Builder {
        private final String identifier;
        private Uses uses;
        private Command runs;
        private Command args;
        private final List<String> needs = new ArrayList<>();
        private final Map<String, String> env = new LinkedHashMap<>();
        private final List<String> secrets = new ArrayList<>();

        private Builder(String identifier) {
            this.identifier = identifier;
        }

        public Builder uses(Uses uses) {
            this.uses = uses;
            return this;
        }

        public Builder runs(Command runs) {
            this.runs = runs;
            return this;
        }

        public Builder args(Command args) {
            this.args = args;
            return this;
        }

        public Builder needs(List<String> needs) {
            this.needs.clear();
            if (needs != null) {
                this.needs.addAll(needs);
            }
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env.clear();
            if (env != null) {
                this.env.putAll(env);
            }
            return this;
        }

        public Builder secrets(List<String> secrets) {
            this.secrets.clear();
            if (secrets != null) {
                this.secrets.addAll(secrets);
            }
            return this;
        }

        public Action build() {
            return new Action(this);
        }
    }
}
