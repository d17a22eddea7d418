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
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * The control flow graph over the positions of a token sequence.
 *
 * Position {@link #size()} is the end of the sequence; it has no
 * successors. A macro-testing directive has two successors, the
 * entry of its own branch first; every other position has one.
 *
 * @see FlowGraphBuilder
 */
public final class FlowGraph {

    public static final int NO_MACRO = -1;

    private final List<Token> tokens;
    private final int[][] edges;
    private final int[] macroIds;

    /* pp */ FlowGraph(@Nonnull List<Token> tokens, @Nonnull int[][] edges, @Nonnull int[] macroIds) {
        this.tokens = tokens;
        this.edges = edges;
        this.macroIds = macroIds;
    }

    /** Returns the number of tokens; also the terminal position. */
    public int size() {
        return tokens.size();
    }

    public boolean isTerminal(@Nonnegative int position) {
        return position == tokens.size();
    }

    @Nonnull
    public Token getToken(@Nonnegative int position) {
        return tokens.get(position);
    }

    /* pp */ int[] successors(@Nonnegative int position) {
        return edges[position];
    }

    /** Returns the successors of the given position, in exploration order. */
    @Nonnull
    public List<Integer> getSuccessors(@Nonnegative int position) {
        if (isTerminal(position))
            return Collections.emptyList();
        int[] next = edges[position];
        List<Integer> out = new ArrayList<>(next.length);
        for (int n : next)
            out.add(n);
        return Collections.unmodifiableList(out);
    }

    /**
     * Returns the ID of the macro tested at the given position,
     * or {@link #NO_MACRO} if it is not an `ifdef, `ifndef or `elsif.
     */
    public int getMacroId(@Nonnegative int position) {
        return macroIds[position];
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < edges.length; i++) {
            buf.append(i).append(" -> ").append(getSuccessors(i)).append('\n');
        }
        return buf.toString();
    }
}
