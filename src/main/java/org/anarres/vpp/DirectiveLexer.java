/*
 * Anarres Verilog Variant Generator
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.vpp;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

import static org.anarres.vpp.TokenType.*;

/**
 * Splits Verilog source text into the tokens a {@link FlowTree} needs.
 *
 * This is not a Verilog lexer: it recognises layout, comments, strings,
 * identifiers, numbers and backtick directives, and returns every other
 * character as an {@link TokenType#OTHER} token. Directives inside
 * comments and strings are not recognised. Concatenating the text of
 * the returned tokens reproduces the input.
 */
public class DirectiveLexer {

    private final String text;
    private int pos;
    private int line;
    private int column;

    public DirectiveLexer(@Nonnull String text) {
        this.text = text;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    @Nonnull
    public List<Token> tokens() {
        List<Token> out = new ArrayList<>();
        pos = 0;
        line = 1;
        column = 1;
        while (pos < text.length())
            out.add(token());
        return out;
    }

    private int peek(int offset) {
        int i = pos + offset;
        return i < text.length() ? text.charAt(i) : -1;
    }

    @Nonnull
    private Token token() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        char c = text.charAt(pos);
        TokenType type;

        if (c == '\n' || (c == '\r' && peek(1) == '\n')) {
            pos += (c == '\r') ? 2 : 1;
            Token tok = new Token(NL, startLine, startColumn, text.substring(start, pos));
            line++;
            column = 1;
            return tok;
        } else if (c == ' ' || c == '\t' || c == '\f' || c == '\r') {
            while (pos < text.length() && isLayout(text.charAt(pos))
                    && !(text.charAt(pos) == '\r' && peek(1) == '\n'))
                pos++;
            type = WHITESPACE;
        } else if (c == '/' && peek(1) == '/') {
            while (pos < text.length() && text.charAt(pos) != '\n'
                    && !(text.charAt(pos) == '\r' && peek(1) == '\n'))
                pos++;
            type = CPPCOMMENT;
        } else if (c == '/' && peek(1) == '*') {
            pos += 2;
            while (pos < text.length() && !(text.charAt(pos) == '*' && peek(1) == '/'))
                pos++;
            pos = Math.min(pos + 2, text.length());
            type = CCOMMENT;
        } else if (c == '"') {
            pos++;
            while (pos < text.length()) {
                char d = text.charAt(pos);
                if (d == '\\' && pos + 1 < text.length() && text.charAt(pos + 1) != '\n') {
                    pos += 2;
                } else if (d == '"') {
                    pos++;
                    break;
                } else if (d == '\n') {
                    break;
                } else {
                    pos++;
                }
            }
            type = STRING;
        } else if (c == '`' && isIdentifierStart(peek(1))) {
            pos++;
            while (pos < text.length() && isIdentifierPart(text.charAt(pos)))
                pos++;
            TokenType directive = TokenType.forDirective(text.substring(start + 1, pos));
            type = directive != null ? directive : OTHER;
        } else if (isIdentifierStart(c)) {
            while (pos < text.length() && isIdentifierPart(text.charAt(pos)))
                pos++;
            type = IDENTIFIER;
        } else if (Character.isDigit(c)) {
            while (pos < text.length() && isNumberPart(text.charAt(pos)))
                pos++;
            type = NUMBER;
        } else {
            pos++;
            type = OTHER;
        }

        String value = text.substring(start, pos);
        advance(value);
        return new Token(type, startLine, startColumn, value);
    }

    /* Comments may span lines. */
    private void advance(@Nonnull String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
    }

    private static boolean isLayout(int c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\r';
    }

    private static boolean isIdentifierStart(int c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(int c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '$';
    }

    private static boolean isNumberPart(int c) {
        return isIdentifierPart(c) || c == '\'' || c == '.';
    }
}
