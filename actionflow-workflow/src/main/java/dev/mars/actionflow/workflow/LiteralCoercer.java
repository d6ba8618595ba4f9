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

import dev.mars.actionflow.hcl.ListNode;
import dev.mars.actionflow.hcl.LiteralNode;
import dev.mars.actionflow.hcl.Node;
import dev.mars.actionflow.hcl.ObjectItem;
import dev.mars.actionflow.hcl.ObjectNode;
import dev.mars.actionflow.hcl.TokenType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts syntax tree values into strings, integers, string lists and string maps.
 * A value of the wrong shape yields an empty result and an
 * {@code "Expected <type>, got <type>"} error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public class LiteralCoercer {

    private final DiagnosticCollector diagnostics;

    public LiteralCoercer(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    public Optional<String> toStringValue(Node node) {
        return literal(node, TokenType.STRING).map(literal -> literal.token().value());
    }

    /**
     * Decimal, hex ({@code 0x1F}) and octal ({@code 017}) integers. Floats are rejected.
     */
    public Optional<BigInteger> toInteger(Node node) {
        return literal(node, TokenType.NUMBER).map(literal -> literal.token().integerValue());
    }

    /**
     * Reads a list of strings. Elements that are not strings are reported and skipped.
     *
     * @param promoteScalars when true a single string is read as a one-element list
     */
    public Optional<List<String>> toStringList(Node node, boolean promoteScalars) {
        if (node instanceof LiteralNode literal) {
            if (promoteScalars && literal.type() == TokenType.STRING) {
                return Optional.of(List.of(literal.token().value()));
            }
            reportMismatch("list", node);
            return Optional.empty();
        }

        if (!(node instanceof ListNode list)) {
            reportMismatch("list", node);
            return Optional.empty();
        }

        List<String> values = new ArrayList<>(list.elements().size());
        for (Node element : list.elements()) {
            toStringValue(element).ifPresent(values::add);
        }
        return Optional.of(values);
    }

    /**
     * Reads {@code { KEY = "value" ... }} into an ordered map. Non-assignment items and
     * non-string values are skipped; a repeated key is a warning and the later value wins.
     */
    public Optional<Map<String, String>> toStringMap(Node node) {
        if (!(node instanceof ObjectNode object)) {
            reportMismatch("object", node);
            return Optional.empty();
        }

        Map<String, String> values = new LinkedHashMap<>();
        for (ObjectItem item : object.list().items()) {
            if (!item.isAssignment()) {
                continue;
            }
            Optional<String> value = toStringValue(item.value());
            if (value.isEmpty()) {
                continue;
            }
            String key = item.firstKey().name();
            if (key.isEmpty()) {
                continue;
            }
            if (values.containsKey(key)) {
                diagnostics.addWarning(node, "Environment variable `" + key + "' redefined");
            }
            values.put(key, value.get());
        }
        return Optional.of(values);
    }

    private Optional<LiteralNode> literal(Node node, TokenType expected) {
        if (node instanceof LiteralNode literal && literal.type() == expected) {
            return Optional.of(literal);
        }
        reportMismatch(expected.displayName(), node);
        return Optional.empty();
    }

    private void reportMismatch(String expected, Node node) {
        diagnostics.addError(node, "Expected " + expected + ", got " + node.typeName());
    }
}
