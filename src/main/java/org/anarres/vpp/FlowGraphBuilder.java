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

import java.util.Arrays;
import java.util.List;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link FlowGraph} of a token sequence from its
 * extracted {@link ConditionalBlock ConditionalBlocks}.
 */
public class FlowGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(FlowGraphBuilder.class);

    private final List<Token> tokens;
    private final ConditionalBlockExtractor extractor;

    public FlowGraphBuilder(@Nonnull List<Token> tokens, @Nonnull ConditionalBlockExtractor extractor) {
        this.tokens = tokens;
        this.extractor = extractor;
    }

    @Nonnull
    public FlowGraph build(@Nonnull List<ConditionalBlock> blocks) {
        int size = tokens.size();
        int[][] edges = new int[size][];
        int[] macroIds = new int[size];
        Arrays.fill(macroIds, FlowGraph.NO_MACRO);

        for (int i = 0; i < size; i++)
            edges[i] = new int[]{i + 1};

        for (ConditionalBlock block : blocks) {
            if (!block.isClosed())
                throw new IllegalStateException("Unclosed block " + block);
            addBlockEdges(block, edges, macroIds);
        }

        LOG.debug("Built flow graph of " + size + " positions over "
                + blocks.size() + " conditional blocks");
        return new FlowGraph(tokens, edges, macroIds);
    }

    private void addBlockEdges(@Nonnull ConditionalBlock block, @Nonnull int[][] edges, @Nonnull int[] macroIds) {
        /*
         * Branches merge at the `endif, which carries nothing. Merging after it
         * instead would run a nested branch into the directive which follows
         * its `endif, such as the `else of the enclosing block.
         */
        int endif = block.getEndif();

        addBranchEdges(block, block.getOpen(), endif, edges, macroIds);
        for (int elsif : block.getElsifs())
            addBranchEdges(block, elsif, endif, edges, macroIds);

        if (block.hasElse()) {
            int start = extractor.getBodyStart(block.getElse());
            if (start < endif) {
                edges[block.getElse()] = new int[]{start};
                edges[endif - 1] = new int[]{endif};
            } else {
                edges[block.getElse()] = new int[]{endif};
            }
        }
    }

    /* An `ifdef, `ifndef or `elsif: its own body first, then the next alternative. */
    private void addBranchEdges(@Nonnull ConditionalBlock block, int directive, int endif,
            @Nonnull int[][] edges, @Nonnull int[] macroIds) {
        int start = extractor.getBodyStart(directive);
        int next = block.nextAlternative(directive);
        macroIds[directive] = extractor.getMacroId(directive);
        if (start < next) {
            edges[directive] = new int[]{start, next};
            edges[next - 1] = new int[]{endif};
        } else {
            edges[directive] = new int[]{endif, next};
        }
    }
}
