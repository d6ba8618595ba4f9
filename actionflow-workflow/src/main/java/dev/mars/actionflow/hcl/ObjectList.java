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

/**
 * Ordered items of the file root or of a {@code { ... }} body.
 * Positioned at the first key of the first item.
 */
public record ObjectList(List<ObjectItem> items) implements Node {

    public ObjectList {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static ObjectList empty() {
        return new ObjectList(List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public SourcePosition position() {
        if (items.isEmpty()) {
            return SourcePosition.unknown();
        }
        return items.get(0).firstKey().position();
    }

    @Override
    public String typeName() {
        return "object list";
    }
}
