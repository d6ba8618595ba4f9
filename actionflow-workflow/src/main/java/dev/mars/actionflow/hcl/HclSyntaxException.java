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

import dev.mars.actionflow.core.exceptions.ActionflowException;
import dev.mars.actionflow.diagnostic.SourcePosition;

/**
 * Thrown by {@link HclLexer} and {@link HclReader} when the input is not well-formed.
 * Reading stops at the first syntax error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public class HclSyntaxException extends ActionflowException {

    private final SourcePosition position;

    public HclSyntaxException(SourcePosition position, String message) {
        super(message);
        this.position = position != null ? position : SourcePosition.unknown();
    }

    public SourcePosition getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return "HclSyntaxException{" + position + ": " + getMessage() + "}";
    }
}
