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

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A Verilog lexer token.
 *
 * Tokens are immutable. The flow tree identifies a token by its
 * index in the input sequence, not by its value, so two tokens with
 * the same text are still distinct nodes of the graph.
 */
public final class Token {

    private final TokenType type;
    private final int line;
    private final int column;
    private final String text;

    public Token(@Nonnull TokenType type, int line, int column, @Nonnull String text) {
        this.type = Objects.requireNonNull(type, "type");
        this.line = line;
        this.column = column;
        this.text = Objects.requireNonNull(text, "text");
    }

    public Token(@Nonnull TokenType type, @Nonnull String text) {
        this(type, -1, -1, text);
    }

    @Nonnull
    public TokenType getType() {
        return type;
    }

    /** Returns the 1-based line number, or -1 if unknown. */
    public int getLine() {
        return line;
    }

    /** Returns the 1-based column number, or -1 if unknown. */
    public int getColumn() {
        return column;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Token) {
            Token o = (Token) obj;
            return o.type == type
                    && o.line == line
                    && o.column == column
                    && o.text.equals(text);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, line, column, text);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('[').append(type);
        if (line != -1)
            buf.append('@').append(line).append(',').append(column);
        buf.append(']').append(':').append('"').append(text).append('"');
        return buf.toString();
    }
}
