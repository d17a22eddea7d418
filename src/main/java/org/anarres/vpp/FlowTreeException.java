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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Thrown when the conditional structure of a token sequence is
 * malformed, or uses more distinct macros than the registry can hold.
 *
 * These errors are always detected before the first variant is
 * generated.
 */
public class FlowTreeException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Too many distinct macros tested by conditionals. */
        CAPACITY,
        /** `ifdef, `ifndef or `elsif not followed by a macro name. */
        MISSING_IDENTIFIER,
        /** `elsif or `else outside any conditional block. */
        UNMATCHED_ALTERNATIVE,
        /** `elsif or `else after the `else of the same block. */
        BRANCH_AFTER_ELSE,
        /** `endif outside any conditional block. */
        UNMATCHED_CLOSE,
        /** Conditional block still open at end of input. */
        MISSING_CLOSE
    }

    private final Kind kind;
    @CheckForNull
    private final Token token;

    public FlowTreeException(@Nonnull Kind kind, @CheckForNull Token token, @Nonnull String msg) {
        super(format(token, msg));
        this.kind = kind;
        this.token = token;
    }

    @Nonnull
    private static String format(@CheckForNull Token token, @Nonnull String msg) {
        if (token == null || token.getLine() == -1)
            return msg;
        return "Error at " + token.getLine() + ":" + token.getColumn() + ": " + msg;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /** Returns the offending token, if there is one. */
    @CheckForNull
    public Token getToken() {
        return token;
    }
}
