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

import java.util.Locale;

/**
 * Token kinds produced by {@link HclLexer}.
 */
public enum TokenType {
    EOF,

    IDENT,
    NUMBER,
    FLOAT,
    BOOL,
    STRING,
    HEREDOC,

    LBRACK,
    RBRACK,
    LBRACE,
    RBRACE,
    COMMA,
    ASSIGN;

    public boolean isLiteral() {
        return this == NUMBER || this == FLOAT || this == BOOL || this == STRING || this == HEREDOC;
    }

    /**
     * Lower-case name used in diagnostics, e.g. {@code "Expected string, got number"}.
     */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
