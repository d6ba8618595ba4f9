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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link HclLexer}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-19
 */
class HclLexerTest {

    private static List<Token> tokenize(String src) throws HclSyntaxException {
        HclLexer lexer = new HclLexer(src);
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private static List<TokenType> types(String src) throws HclSyntaxException {
        return tokenize(src).stream().map(Token::type).toList();
    }

    @Test
    void testPunctuationAndKeys() throws HclSyntaxException {
        assertEquals(List.of(TokenType.IDENT, TokenType.STRING, TokenType.LBRACE, TokenType.IDENT,
                        TokenType.ASSIGN, TokenType.LBRACK, TokenType.STRING, TokenType.COMMA, TokenType.RBRACK,
                        TokenType.RBRACE, TokenType.EOF),
                types("action \"a\" { needs = [\"b\", ] }"));
    }

    @Test
    void testPositionsAreOneBased() throws HclSyntaxException {
        List<Token> tokens = tokenize("action \"a\" {\n  uses = \"./x\"\n}");

        assertEquals(SourcePosition.of(1, 1), tokens.get(0).position());
        assertEquals(SourcePosition.of(1, 8), tokens.get(1).position());
        assertEquals(SourcePosition.of(2, 3), tokens.get(3).position());
        assertEquals(SourcePosition.of(3, 1), tokens.get(6).position());
    }

    @Test
    void testIdentifiersAllowDotsAndDashes() throws HclSyntaxException {
        Token token = tokenize("a.b-c_d").get(0);

        assertEquals(TokenType.IDENT, token.type());
        assertEquals("a.b-c_d", token.text());
    }

    @Test
    void testBooleans() throws HclSyntaxException {
        assertEquals(List.of(TokenType.BOOL, TokenType.BOOL, TokenType.IDENT, TokenType.EOF),
                types("true false truthy"));
    }

    @Test
    void testNumbers() throws HclSyntaxException {
        List<Token> tokens = tokenize("42 -7 0x1F 017 12.34 1e3");

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.NUMBER, TokenType.NUMBER,
                TokenType.NUMBER, TokenType.NUMBER, TokenType.FLOAT, TokenType.FLOAT, TokenType.EOF);
        assertEquals(42L, tokens.get(0).longValue());
        assertEquals(-7L, tokens.get(1).longValue());
        assertEquals(31L, tokens.get(2).longValue());
        assertEquals(15L, tokens.get(3).longValue());
    }

    @Test
    void testNumberBeyondLongRange() throws HclSyntaxException {
        Token token = tokenize("99999999999999999999").get(0);

        assertEquals(TokenType.NUMBER, token.type());
        assertEquals(new BigInteger("99999999999999999999"), token.integerValue());
        assertEquals(BigInteger.valueOf(-15), tokenize("-017").get(0).integerValue());
        assertEquals(BigInteger.valueOf(31), tokenize("0x1F").get(0).integerValue());
    }

    @Test
    void testInvalidOctal() {
        HclSyntaxException exception = assertThrows(HclSyntaxException.class, () -> tokenize("09"));

        assertEquals("Invalid number 09", exception.getMessage());
    }

    @Test
    void testStringEscapes() throws HclSyntaxException {
        Token token = tokenize("\"a\\\"b\\\\c\\nd\\u00e9\"").get(0);

        assertEquals(TokenType.STRING, token.type());
        assertEquals("a\"b\\c\nd\u00e9", token.value());
        assertEquals("\"a\\\"b\\\\c\\nd\\u00e9\"", token.text());
        assertTrue(token.isQuoted());
    }

    @Test
    void testInterpolationMayContainQuotes() throws HclSyntaxException {
        Token token = tokenize("\"${lookup(\"x\")} done\"").get(0);

        assertEquals("${lookup(\"x\")} done", token.value());
    }

    @Test
    void testHeredoc() throws HclSyntaxException {
        Token token = tokenize("<<EOF\nline one\n  line two\nEOF\n").get(0);

        assertEquals(TokenType.HEREDOC, token.type());
        assertEquals("line one\n  line two\n", token.value());
    }

    @Test
    void testIndentedHeredocStripsCommonIndent() throws HclSyntaxException {
        Token token = tokenize("<<-EOF\n    one\n      two\n    EOF\n").get(0);

        assertEquals("one\n  two\n", token.value());
    }

    @Test
    void testCommentsSkipped() throws HclSyntaxException {
        assertEquals(List.of(TokenType.IDENT, TokenType.IDENT, TokenType.IDENT, TokenType.EOF),
                types("# hash\na // slashes\nb /* block\ncomment */ c"));
    }

    @Test
    void testLeadingByteOrderMarkSkipped() throws HclSyntaxException {
        assertEquals(TokenType.IDENT, tokenize("\uFEFFaction").get(0).type());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"open", "\"line\nbreak\"", "\"trailing\\"})
    void testUnterminatedString(String src) {
        HclSyntaxException exception = assertThrows(HclSyntaxException.class, () -> tokenize(src));

        assertEquals("Literal not terminated", exception.getMessage());
        assertEquals(SourcePosition.of(1, 1), exception.getPosition());
    }

    @Test
    void testIllegalChar() {
        HclSyntaxException exception = assertThrows(HclSyntaxException.class, () -> tokenize("a !"));

        assertEquals("Illegal char '!'", exception.getMessage());
        assertEquals(3, exception.getPosition().column());
    }

    @Test
    void testIllegalEscape() {
        HclSyntaxException exception = assertThrows(HclSyntaxException.class, () -> tokenize("\"\\q\""));

        assertEquals("Illegal char escape", exception.getMessage());
    }

    @Test
    void testUnterminatedComment() {
        assertThrows(HclSyntaxException.class, () -> tokenize("/* never closed"));
    }

    @Test
    void testFileNameOnPositions() throws HclSyntaxException {
        Token token = new HclLexer("x", "main.workflow").next();

        assertEquals("main.workflow:1:1", token.position().toString());
    }
}
