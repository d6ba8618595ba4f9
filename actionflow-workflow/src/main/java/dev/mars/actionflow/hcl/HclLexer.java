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
import java.util.regex.Pattern;

/**
 * Splits workflow file text into {@link Token}s on demand.
 *
 * <p>Whitespace and comments ({@code #}, {@code //} and {@code /* ... *}{@code /}) are skipped.
 * Identifiers may contain letters, digits, {@code _}, {@code .} and {@code -};
 * {@code true} and {@code false} are booleans. Strings are double-quoted, single-line and
 * support the usual backslash escapes; text inside {@code ${...}} may contain quotes.
 * Heredocs take the form {@code <<ID ... ID} or {@code <<-ID ... ID}, the latter removing
 * the common indentation of the body.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public class HclLexer {

    private static final Pattern INTEGER = Pattern.compile("-?(0[xX][0-9a-fA-F]+|0[0-7]*|[1-9][0-9]*)");
    private static final String LITERAL_NOT_TERMINATED = "Literal not terminated";

    private final String src;
    private final String fileName;
    private int offset;
    private int line = 1;
    private int column = 1;

    public HclLexer(String src) {
        this(src, "");
    }

    public HclLexer(String src, String fileName) {
        this.src = src != null ? src : "";
        this.fileName = fileName != null ? fileName : "";
    }

    /**
     * Returns the next token, or an {@link TokenType#EOF} token once the input is exhausted.
     *
     * @throws HclSyntaxException on an illegal character or an unterminated literal
     */
    public Token next() throws HclSyntaxException {
        skipWhitespaceAndComments();

        SourcePosition start = position();
        int startOffset = offset;
        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", "", start);
        }

        char ch = peek();
        switch (ch) {
            case '{':
                return single(TokenType.LBRACE, start);
            case '}':
                return single(TokenType.RBRACE, start);
            case '[':
                return single(TokenType.LBRACK, start);
            case ']':
                return single(TokenType.RBRACK, start);
            case ',':
                return single(TokenType.COMMA, start);
            case '=':
                return single(TokenType.ASSIGN, start);
            case '"':
                return scanString(startOffset, start);
            case '<':
                if (peekAt(1) == '<') {
                    return scanHeredoc(startOffset, start);
                }
                break;
            case '-':
                if (isDigit(peekAt(1))) {
                    return scanNumber(startOffset, start);
                }
                break;
            default:
                break;
        }

        if (isIdentStart(ch)) {
            return scanIdent(startOffset, start);
        }
        if (isDigit(ch)) {
            return scanNumber(startOffset, start);
        }
        throw new HclSyntaxException(start, "Illegal char '" + ch + "'");
    }

    private Token single(TokenType type, SourcePosition start) {
        char ch = advance();
        String text = String.valueOf(ch);
        return new Token(type, text, text, start);
    }

    private void skipWhitespaceAndComments() throws HclSyntaxException {
        while (!isAtEnd()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n' || ch == '\f' || ch == '\uFEFF') {
                advance();
            } else if (ch == '#' || (ch == '/' && peekAt(1) == '/')) {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (ch == '/' && peekAt(1) == '*') {
                SourcePosition start = position();
                advance();
                advance();
                while (!(peek() == '*' && peekAt(1) == '/')) {
                    if (isAtEnd()) {
                        throw new HclSyntaxException(start, "Comment not terminated");
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private Token scanIdent(int startOffset, SourcePosition start) {
        while (!isAtEnd() && isIdentPart(peek())) {
            advance();
        }
        String text = src.substring(startOffset, offset);
        TokenType type = "true".equals(text) || "false".equals(text) ? TokenType.BOOL : TokenType.IDENT;
        return new Token(type, text, text, start);
    }

    private Token scanNumber(int startOffset, SourcePosition start) throws HclSyntaxException {
        if (peek() == '-') {
            advance();
        }

        if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'X')) {
            advance();
            advance();
            if (!isHexDigit(peek())) {
                throw new HclSyntaxException(start, "Illegal hexadecimal number");
            }
            while (isHexDigit(peek())) {
                advance();
            }
            return number(startOffset, start);
        }

        boolean isFloat = false;
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peekAt(1))) {
            isFloat = true;
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            int sign = peekAt(1) == '+' || peekAt(1) == '-' ? 1 : 0;
            if (isDigit(peekAt(1 + sign))) {
                isFloat = true;
                advance();
                if (sign == 1) {
                    advance();
                }
                while (isDigit(peek())) {
                    advance();
                }
            }
        }

        if (isFloat) {
            String text = src.substring(startOffset, offset);
            return new Token(TokenType.FLOAT, text, text, start);
        }
        return number(startOffset, start);
    }

    private Token number(int startOffset, SourcePosition start) throws HclSyntaxException {
        String text = src.substring(startOffset, offset);
        // range is checked where the value is used
        if (!INTEGER.matcher(text).matches()) {
            throw new HclSyntaxException(start, "Invalid number " + text);
        }
        return new Token(TokenType.NUMBER, text, text, start);
    }

    private Token scanString(int startOffset, SourcePosition start) throws HclSyntaxException {
        advance();
        StringBuilder value = new StringBuilder();
        int braces = 0;

        while (true) {
            if (isAtEnd()) {
                throw new HclSyntaxException(start, LITERAL_NOT_TERMINATED);
            }
            char ch = peek();
            if (ch == '\n' && braces == 0) {
                throw new HclSyntaxException(start, LITERAL_NOT_TERMINATED);
            }
            if (ch == '"' && braces == 0) {
                advance();
                break;
            }
            if (ch == '\\') {
                SourcePosition escapeStart = position();
                advance();
                if (isAtEnd()) {
                    throw new HclSyntaxException(start, LITERAL_NOT_TERMINATED);
                }
                scanEscape(value, escapeStart);
                continue;
            }
            if (ch == '$' && peekAt(1) == '{') {
                braces++;
                value.append(advance()).append(advance());
                continue;
            }
            if (braces > 0 && ch == '{') {
                braces++;
            } else if (braces > 0 && ch == '}') {
                braces--;
            }
            value.append(advance());
        }

        return new Token(TokenType.STRING, src.substring(startOffset, offset), value.toString(), start);
    }

    private void scanEscape(StringBuilder value, SourcePosition escapeStart) throws HclSyntaxException {
        char ch = advance();
        switch (ch) {
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case 'b' -> value.append('\b');
            case 'f' -> value.append('\f');
            case 'a' -> value.append('\u0007');
            case 'v' -> value.append('\u000B');
            case '\\' -> value.append('\\');
            case '"' -> value.append('"');
            case 'u' -> value.appendCodePoint(scanHexEscape(4, escapeStart));
            case 'U' -> value.appendCodePoint(scanHexEscape(8, escapeStart));
            default -> throw new HclSyntaxException(escapeStart, "Illegal char escape");
        }
    }

    private int scanHexEscape(int digits, SourcePosition escapeStart) throws HclSyntaxException {
        int codePoint = 0;
        for (int i = 0; i < digits; i++) {
            if (!isHexDigit(peek())) {
                throw new HclSyntaxException(escapeStart, "Illegal char escape");
            }
            codePoint = codePoint * 16 + Character.digit(advance(), 16);
        }
        if (!Character.isValidCodePoint(codePoint)) {
            throw new HclSyntaxException(escapeStart, "Illegal char escape");
        }
        return codePoint;
    }

    private Token scanHeredoc(int startOffset, SourcePosition start) throws HclSyntaxException {
        advance();
        advance();
        boolean indented = peek() == '-';
        if (indented) {
            advance();
        }

        int anchorStart = offset;
        while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_' || peek() == '-')) {
            advance();
        }
        String anchor = src.substring(anchorStart, offset);
        if (anchor.isEmpty()) {
            throw new HclSyntaxException(start, "Heredoc expected anchor");
        }
        if (peek() == '\r') {
            advance();
        }
        if (peek() != '\n') {
            throw new HclSyntaxException(start, "Invalid characters in heredoc anchor");
        }
        advance();

        List<String> lines = new ArrayList<>();
        while (true) {
            if (isAtEnd()) {
                throw new HclSyntaxException(start, "Heredoc not terminated");
            }
            int lineStart = offset;
            while (!isAtEnd() && peek() != '\n') {
                advance();
            }
            String content = src.substring(lineStart, offset);
            if (content.endsWith("\r")) {
                content = content.substring(0, content.length() - 1);
            }
            String candidate = indented ? content.strip() : content;
            if (candidate.equals(anchor)) {
                break;
            }
            lines.add(content);
            if (isAtEnd()) {
                throw new HclSyntaxException(start, "Heredoc not terminated");
            }
            advance();
        }

        if (indented) {
            lines = removeCommonIndent(lines);
        }
        String body = lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
        return new Token(TokenType.HEREDOC, src.substring(startOffset, offset), body, start);
    }

    private static List<String> removeCommonIndent(List<String> lines) {
        int indent = Integer.MAX_VALUE;
        for (String l : lines) {
            if (l.isBlank()) {
                continue;
            }
            int i = 0;
            while (i < l.length() && (l.charAt(i) == ' ' || l.charAt(i) == '\t')) {
                i++;
            }
            indent = Math.min(indent, i);
        }
        if (indent == Integer.MAX_VALUE || indent == 0) {
            return lines;
        }
        List<String> result = new ArrayList<>(lines.size());
        for (String l : lines) {
            result.add(l.length() >= indent ? l.substring(indent) : l.strip());
        }
        return result;
    }

    private SourcePosition position() {
        return new SourcePosition(fileName, line, column);
    }

    private boolean isAtEnd() {
        return offset >= src.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int ahead) {
        int index = offset + ahead;
        return index < src.length() ? src.charAt(index) : '\0';
    }

    private char advance() {
        char ch = src.charAt(offset++);
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return ch;
    }

    private static boolean isIdentStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isIdentPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '.' || ch == '-';
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isHexDigit(char ch) {
        return isDigit(ch) || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F');
    }
}
