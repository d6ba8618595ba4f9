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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads workflow file text into a generic syntax tree of {@link ObjectList}s,
 * {@link ObjectItem}s and values.
 *
 * <p>The grammar is the block-structured configuration syntax:
 * <pre>
 * file   ::= item* | object
 * item   ::= key+ "=" value | key+ object
 * key    ::= IDENT | STRING
 * value  ::= literal | list | object
 * object ::= "{" (item ","?)* "}"
 * list   ::= "[" (value ("," value)* ","?)? "]"
 * </pre>
 * A file consisting of a single {@code { ... }} is read as its contents.
 * Reading stops with an {@link HclSyntaxException} at the first error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public class HclReader {

    private final HclLexer lexer;
    private Token tok;

    public HclReader(String content) {
        this(content, "");
    }

    public HclReader(String content, String fileName) {
        this.lexer = new HclLexer(content, fileName);
    }

    /**
     * Convenience for {@code new HclReader(content).read()}.
     */
    public static ObjectList parse(String content) throws HclSyntaxException {
        return new HclReader(content).read();
    }

    /**
     * Reads the whole input. An empty input yields an empty list.
     */
    public ObjectList read() throws HclSyntaxException {
        scan();
        if (tok.type() == TokenType.LBRACE) {
            ObjectNode root = object();
            if (tok.type() != TokenType.EOF) {
                throw new HclSyntaxException(tok.position(), "Unexpected token after root object: " + tok.type());
            }
            return root.list();
        }
        return objectList(false);
    }

    private void scan() throws HclSyntaxException {
        tok = lexer.next();
    }

    private ObjectList objectList(boolean nested) throws HclSyntaxException {
        List<ObjectItem> items = new ArrayList<>();
        while (true) {
            if (tok.type() == TokenType.EOF) {
                if (nested) {
                    throw new HclSyntaxException(tok.position(), "Object expected closing RBRACE got: EOF");
                }
                break;
            }
            if (nested && tok.type() == TokenType.RBRACE) {
                break;
            }

            items.add(objectItem());

            // commas between items are optional
            if (tok.type() == TokenType.COMMA) {
                scan();
            }
        }
        return new ObjectList(items);
    }

    private ObjectItem objectItem() throws HclSyntaxException {
        List<ObjectKey> keys = new ArrayList<>();
        while (tok.type() == TokenType.IDENT || tok.type() == TokenType.STRING) {
            keys.add(new ObjectKey(tok));
            scan();
        }
        if (keys.isEmpty()) {
            throw new HclSyntaxException(tok.position(), "Expected: IDENT | STRING got: " + tok.type());
        }

        switch (tok.type()) {
            case ASSIGN: {
                if (keys.size() > 1) {
                    throw new HclSyntaxException(tok.position(), "Nested object expected: LBRACE got: ASSIGN");
                }
                SourcePosition assign = tok.position();
                scan();
                return new ObjectItem(keys, assign, objectValue());
            }
            case LBRACE:
                return new ObjectItem(keys, null, object());
            default: {
                String names = keys.stream().map(ObjectKey::text).collect(Collectors.joining(" "));
                throw new HclSyntaxException(tok.position(),
                        "Key `" + names + "' expected start of object ('{') or assignment ('=')");
            }
        }
    }

    private Node objectValue() throws HclSyntaxException {
        switch (tok.type()) {
            case NUMBER:
            case FLOAT:
            case BOOL:
            case STRING:
            case HEREDOC: {
                LiteralNode literal = new LiteralNode(tok);
                scan();
                return literal;
            }
            case LBRACE:
                return object();
            case LBRACK:
                return list();
            case EOF:
                throw new HclSyntaxException(tok.position(), "Expected a value, got: EOF");
            default:
                throw new HclSyntaxException(tok.position(), "Unknown token: " + tok.type() + " " + tok.text());
        }
    }

    private ObjectNode object() throws HclSyntaxException {
        SourcePosition lbrace = tok.position();
        scan();
        ObjectList list = objectList(true);
        SourcePosition rbrace = tok.position();
        scan();
        return new ObjectNode(lbrace, list, rbrace);
    }

    private ListNode list() throws HclSyntaxException {
        SourcePosition lbrack = tok.position();
        scan();

        List<Node> elements = new ArrayList<>();
        boolean needComma = false;
        while (true) {
            TokenType type = tok.type();
            if (type == TokenType.RBRACK) {
                SourcePosition rbrack = tok.position();
                scan();
                return new ListNode(lbrack, elements, rbrack);
            }
            if (type == TokenType.EOF) {
                throw new HclSyntaxException(tok.position(), "List expected closing RBRACK got: EOF");
            }
            if (type == TokenType.COMMA) {
                if (!needComma) {
                    throw new HclSyntaxException(tok.position(), "Unexpected comma while parsing list");
                }
                needComma = false;
                scan();
                continue;
            }
            if (needComma) {
                throw new HclSyntaxException(tok.position(),
                        "Error parsing list, expected comma or list end, got: " + type);
            }

            if (type.isLiteral()) {
                elements.add(new LiteralNode(tok));
                scan();
            } else if (type == TokenType.LBRACE) {
                elements.add(object());
            } else if (type == TokenType.LBRACK) {
                elements.add(list());
            } else {
                throw new HclSyntaxException(tok.position(), "Unexpected token while parsing list: " + type);
            }
            needComma = true;
        }
    }
}
