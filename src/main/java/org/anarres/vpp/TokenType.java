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
 * The categories of {@link Token} the flow tree distinguishes.
 *
 * Only the conditional directives carry meaning to the flow tree;
 * everything else is payload which is copied into the variants.
 */
public enum TokenType {

    IDENTIFIER,
    NUMBER,
    STRING,
    WHITESPACE,
    NL,
    CCOMMENT,
    CPPCOMMENT,
    OTHER,

    PP_DEFINE("define"),
    PP_IFDEF("ifdef"),
    PP_IFNDEF("ifndef"),
    PP_ELSIF("elsif"),
    PP_ELSE("else"),
    PP_ENDIF("endif");

    @CheckForNull
    private final String directive;

    TokenType() {
        this(null);
    }

    TokenType(@CheckForNull String directive) {
        this.directive = directive;
    }

    /**
     * Returns the directive name without the leading backtick,
     * or null if this is not a directive.
     */
    @CheckForNull
    public String getDirective() {
        return directive;
    }

    /** `ifdef or `ifndef. */
    public boolean isOpening() {
        return this == PP_IFDEF || this == PP_IFNDEF;
    }

    /** `elsif. */
    public boolean isAlternative() {
        return this == PP_ELSIF;
    }

    /** `else. */
    public boolean isFinalAlternative() {
        return this == PP_ELSE;
    }

    /** `endif. */
    public boolean isClosing() {
        return this == PP_ENDIF;
    }

    /** Directives which are followed by the name of the macro they test. */
    public boolean isMacroTest() {
        return isOpening() || isAlternative();
    }

    public boolean isConditional() {
        return isOpening() || isAlternative() || isFinalAlternative() || isClosing();
    }

    /** Layout which may separate a directive from its macro name. */
    public boolean isWhite() {
        return this == WHITESPACE || this == CCOMMENT;
    }

    /**
     * Looks up a directive by its name, without the backtick.
     *
     * @return the directive type, or null if the name is not a known directive.
     */
    @CheckForNull
    public static TokenType forDirective(@Nonnull String name) {
        for (TokenType type : values()) {
            if (name.equals(type.directive))
                return type;
        }
        return null;
    }
}
