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
import java.util.BitSet;
import java.util.List;
import javax.annotation.Nonnull;

import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a {@link FlowGraph} depth first, generating one
 * {@link Variant} per path from the first position to the end.
 *
 * At each `ifdef, `ifndef or `elsif the search forks on the tested
 * macro, assuming it defined first and undefined second. Once a macro
 * is assumed on a path, later tests of the same macro on that path
 * follow the assumption instead of forking again, so the number of
 * variants is bounded by 2^(distinct macros tested), not by the
 * number of tests.
 *
 * Runs of tokens between branch points are walked iteratively, so the
 * recursion depth is the number of branch points on a path.
 */
public class VariantEnumerator {

    private static final Logger LOG = LoggerFactory.getLogger(VariantEnumerator.class);

    private static final boolean[] DEFINED_FIRST = {true, false};

    private final FlowGraph graph;

    /* The variant being generated. */
    private final List<Token> sequence = new ArrayList<>();
    private final BitSet macrosMask = new BitSet();
    private final BitSet assumed = new BitSet();

    private VariantReceiver receiver;
    private boolean wantsMore;
    private int emitted;
    private long appended;

    public VariantEnumerator(@Nonnull FlowGraph graph) {
        this.graph = graph;
    }

    /**
     * Generates variants until all have been generated or the
     * receiver asks to stop.
     *
     * @return the number of variants delivered to the receiver.
     */
    public int enumerate(@Nonnull VariantReceiver receiver) {
        this.receiver = receiver;
        this.wantsMore = true;
        this.emitted = 0;
        try {
            search(0);
        } finally {
            this.receiver = null;
        }
        if (!sequence.isEmpty() || !macrosMask.isEmpty() || !assumed.isEmpty())
            throw new IllegalStateException("Unbalanced variant state after search: " + sequence);
        return emitted;
    }

    private void search(int position) {
        if (!wantsMore)
            return;
        int mark = sequence.size();
        try {
            while (!graph.isTerminal(position)) {
                int macroId = graph.getMacroId(position);
                if (macroId != FlowGraph.NO_MACRO) {
                    branch(position, macroId);
                    return;
                }
                Token token = graph.getToken(position);
                /* `else and `endif carry no tokens. */
                if (!token.getType().isConditional()) {
                    sequence.add(token);
                    appended++;
                }
                position = graph.successors(position)[0];
            }
            emit();
        } finally {
            while (sequence.size() > mark)
                sequence.remove(sequence.size() - 1);
        }
    }

    private void branch(int position, int macroId) {
        int[] next = graph.successors(position);
        boolean negated = graph.getToken(position).getType() == TokenType.PP_IFNDEF;

        if (assumed.get(macroId)) {
            boolean enter = macrosMask.get(macroId) != negated;
            search(enter ? next[0] : next[1]);
            return;
        }

        for (boolean defined : DEFINED_FIRST) {
            if (!wantsMore)
                return;
            assumed.set(macroId);
            macrosMask.set(macroId, defined);
            try {
                search(defined != negated ? next[0] : next[1]);
            } finally {
                assumed.clear(macroId);
                macrosMask.clear(macroId);
            }
        }
    }

    private void emit() {
        Variant variant = new Variant(TreePVector.from(sequence), macrosMask, assumed);
        emitted++;
        if (LOG.isDebugEnabled())
            LOG.debug("Variant " + emitted + ": mask=" + macrosMask
                    + " assumed=" + assumed + " tokens=" + sequence.size());
        if (!receiver.receive(variant)) {
            wantsMore = false;
            LOG.debug("Receiver stopped generation after " + emitted + " variants");
        }
    }

    /** Returns the number of tokens appended to variants so far. */
    /* pp */ long getAppendCount() {
        return appended;
    }
}
