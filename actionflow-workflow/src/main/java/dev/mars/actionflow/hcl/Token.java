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

import java.math.BigInteger;
import java.util.Objects;

/**
 * A lexical token.
 *
 * @param type     the token kind
 * @param text     the token exactly as it appears in the source, quotes included
 * @param value    the decoded value: unescaped contents for strings, the body for heredocs,
 *                 the source text for everything else
 * @param position where the token starts
 */
public record Token(TokenType type, String text, String value, SourcePosition position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(position, "position");
    }

    /**
     * Integer value of a {@link TokenType#NUMBER} token. Decimal, {@code 0x} hex and
     * leading-zero octal forms are accepted.
     *
     * @throws IllegalStateException if this is not a number token
     */
    public long longValue() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("Not a number token: " + type);
        }
        return Long.decode(text);
    }

    /**
     * Integer value of a {@link TokenType#NUMBER} token without range limits.
     *
     * @throws IllegalStateException if this is not a number token
     */
    public BigInteger integerValue() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("Not a number token: " + type);
        }
        boolean negative = text.startsWith("-");
        String digits = negative ? text.substring(1) : text;
        BigInteger magnitude;
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            magnitude = new BigInteger(digits.substring(2), 16);
        } else if (digits.length() > 1 && digits.startsWith("0")) {
            magnitude = new BigInteger(digits.substring(1), 8);
        } else {
            magnitude = new BigInteger(digits);
        }
        return negative ? magnitude.negate() : magnitude;
    }

    public boolean isQuoted() {
        return text.length() >= 2 && text.charAt(0) == '"' && text.charAt(text.length() - 1) == '"';
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
