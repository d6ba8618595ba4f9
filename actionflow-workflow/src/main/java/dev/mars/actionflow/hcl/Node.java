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

/**
 * A node of the generic syntax tree produced by {@link HclReader}.
 * Every node knows where it starts in the source.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public sealed interface Node permits ObjectList, ObjectItem, ObjectKey, LiteralNode, ListNode, ObjectNode {

    /**
     * The position diagnostics about this node are reported at.
     */
    SourcePosition position();

    /**
     * Short lower-case description of the node's shape: a literal token type,
     * {@code list} or {@code object}.
     */
    String typeName();
}
