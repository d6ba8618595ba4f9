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

import java.util.List;
import java.util.Objects;

/**
 * One entry of an {@link ObjectList}: one or more keys followed by either
 * {@code = value} (an assignment) or a {@code { ... }} block.
 *
 * @param keys   at least one key
 * @param assign position of the {@code =} token, or {@code null} for the block form
 * @param value  the value node
 */
public record ObjectItem(List<ObjectKey> keys, SourcePosition assign, Node value) implements Node {

    public ObjectItem {
        keys = List.copyOf(keys);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("An object item needs at least one key");
        }
        Objects.requireNonNull(value, "value");
    }

    public ObjectKey firstKey() {
        return keys.get(0);
    }

    public boolean hasAssign() {
        return assign != null;
    }

    /**
     * A simple {@code key = value} item.
     */
    public boolean isAssignment() {
        return keys.size() == 1 && hasAssign();
    }

    /**
     * Items are reported at their value.
     */
    @Override
    public SourcePosition position() {
        return value.position();
    }

    @Override
    public String typeName() {
        return "item";
    }
}
