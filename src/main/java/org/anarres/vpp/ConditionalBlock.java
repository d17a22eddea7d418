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

import java.util.List;
import javax.annotation.Nonnull;

import org.pcollections.Empty;
import org.pcollections.PVector;

/**
 * One `ifdef/`ifndef block, as positions in the token sequence.
 *
 * Positions strictly increase: open &lt; elsif... &lt; else &lt; endif.
 * A block under construction has no endif; {@link ConditionalBlockExtractor}
 * only ever returns closed blocks.
 */
public final class ConditionalBlock {

    public static final int NONE = -1;

    private final int open;
    private final PVector<Integer> elsifs;
    private final int elseAt;
    private final int endif;

    /* pp */ ConditionalBlock(int open) {
        this(open, Empty.<Integer>vector(), NONE, NONE);
    }

    private ConditionalBlock(int open, PVector<Integer> elsifs, int elseAt, int endif) {
        this.open = open;
        this.elsifs = elsifs;
        this.elseAt = elseAt;
        this.endif = endif;
    }

    ConditionalBlock withElsif(int position) {
        return new ConditionalBlock(open, elsifs.plus(position), elseAt, endif);
    }

    ConditionalBlock withElse(int position) {
        return new ConditionalBlock(open, elsifs, position, endif);
    }

    ConditionalBlock withEndif(int position) {
        return new ConditionalBlock(open, elsifs, elseAt, position);
    }

    /** Position of the `ifdef or `ifndef. */
    public int getOpen() {
        return open;
    }

    /** Positions of the `elsif directives, in source order. */
    @Nonnull
    public List<Integer> getElsifs() {
        return elsifs;
    }

    /** Position of the `else, or {@link #NONE}. */
    public int getElse() {
        return elseAt;
    }

    public boolean hasElse() {
        return elseAt != NONE;
    }

    /** Position of the `endif, or {@link #NONE} while still open. */
    public int getEndif() {
        return endif;
    }

    public boolean isClosed() {
        return endif != NONE;
    }

    /**
     * Returns the position of the directive which ends the branch
     * starting at the given directive: the next `elsif, the `else,
     * or the `endif.
     */
    /* pp */ int nextAlternative(int position) {
        if (position == open) {
            if (!elsifs.isEmpty())
                return elsifs.get(0);
        } else {
            int idx = elsifs.indexOf(position);
            if (idx >= 0 && idx + 1 < elsifs.size())
                return elsifs.get(idx + 1);
        }
        if (hasElse() && position != elseAt)
            return elseAt;
        return endif;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof ConditionalBlock) {
            ConditionalBlock o = (ConditionalBlock) obj;
            return o.open == open
                    && o.elsifs.equals(elsifs)
                    && o.elseAt == elseAt
                    && o.endif == endif;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return ((open * 31 + elsifs.hashCode()) * 31 + elseAt) * 31 + endif;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append("open=").append(open);
        for (int elsif : elsifs)
            buf.append(", elsif=").append(elsif);
        if (hasElse())
            buf.append(", else=").append(elseAt);
        buf.append(", endif=").append(endif);
        return buf.toString();
    }
}
