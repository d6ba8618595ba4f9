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

package dev.mars.actionflow.hcl;

import dev.mars.actionflow.diagnostic.SourcePosition;

import java.util.Objects;

/**
 * {@code { ... }}, positioned at the opening brace.
 */
public record ObjectNode(SourcePosition lbrace, ObjectList list, SourcePosition rbrace) implements Node {

    public ObjectNode {
        Objects.requireNonNull(lbrace, "lbrace");
        Objects.requireNonNull(list, "list");
    }

    @Override
    public SourcePosition position() {
        return lbrace;
    }

    @Override
    public String typeName() {
        return "object";
    }
}
