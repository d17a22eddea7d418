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
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.vpp.FlowTreeException.Kind.*;

/**
 * Pairs every `ifdef/`ifndef with its `elsif, `else and `endif
 * directives in a single scan, validating the nesting.
 *
 * Each macro tested by a directive is registered with the
 * {@link MacroRegistry} as it is seen.
 */
public class ConditionalBlockExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionalBlockExtractor.class);

    private final List<Token> tokens;
    private final MacroRegistry registry;

    /* Per macro-testing directive: the tested macro, and where its branch body begins. */
    private final Map<Integer, Integer> macroIds = new HashMap<>();
    private final Map<Integer, Integer> bodyStarts = new HashMap<>();

    public ConditionalBlockExtractor(@Nonnull List<Token> tokens, @Nonnull MacroRegistry registry) {
        this.tokens = tokens;
        this.registry = registry;
    }

    /**
     * Scans the token sequence.
     *
     * @return the blocks, ordered by the position of their opening directive.
     * @throws FlowTreeException if the conditional structure is malformed,
     *  or too many distinct macros are tested.
     */
    @Nonnull
    public List<ConditionalBlock> extract()
            throws FlowTreeException {
        Stack<ConditionalBlock> states = new Stack<>();
        List<ConditionalBlock> blocks = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            Token tok = tokens.get(i);
            TokenType type = tok.getType();
            if (type.isOpening()) {
                macro(i);
                states.push(new ConditionalBlock(i));
            } else if (type.isAlternative()) {
                ConditionalBlock block = top(states, tok);
                if (block.hasElse())
                    throw new FlowTreeException(BRANCH_AFTER_ELSE, tok,
                            "`elsif after `else");
                macro(i);
                states.push(states.pop().withElsif(i));
            } else if (type.isFinalAlternative()) {
                ConditionalBlock block = top(states, tok);
                if (block.hasElse())
                    throw new FlowTreeException(BRANCH_AFTER_ELSE, tok,
                            "`else after `else");
                bodyStarts.put(i, i + 1);
                states.push(states.pop().withElse(i));
            } else if (type.isClosing()) {
                if (states.isEmpty())
                    throw new FlowTreeException(UNMATCHED_CLOSE, tok,
                            "`endif without `ifdef");
                blocks.add(states.pop().withEndif(i));
            }
        }

        if (!states.isEmpty()) {
            Token open = tokens.get(states.peek().getOpen());
            throw new FlowTreeException(MISSING_CLOSE, open,
                    "Unterminated `" + open.getType().getDirective()
                    + " (" + states.size() + " block(s) open at end of input)");
        }

        Collections.sort(blocks, Comparator.comparingInt(ConditionalBlock::getOpen));
        LOG.debug("Extracted " + blocks.size() + " conditional blocks testing "
                + registry.size() + " macros");
        return blocks;
    }

    @Nonnull
    private static ConditionalBlock top(@Nonnull Stack<ConditionalBlock> states, @Nonnull Token tok)
            throws FlowTreeException {
        if (states.isEmpty())
            throw new FlowTreeException(UNMATCHED_ALTERNATIVE, tok,
                    "`" + tok.getType().getDirective() + " without `ifdef");
        return states.peek();
    }

    /* Reads and registers the macro name following the directive at the given position. */
    private void macro(int position)
            throws FlowTreeException {
        Token directive = tokens.get(position);
        int i = position + 1;
        while (i < tokens.size() && tokens.get(i).getType().isWhite())
            i++;
        if (i >= tokens.size())
            throw new FlowTreeException(MISSING_IDENTIFIER, directive,
                    "Expected identifier after `" + directive.getType().getDirective()
                    + ", not end of input");
        Token name = tokens.get(i);
        if (name.getType() != TokenType.IDENTIFIER)
            throw new FlowTreeException(MISSING_IDENTIFIER, name,
                    "Expected identifier after `" + directive.getType().getDirective()
                    + ", not " + name.getText());
        macroIds.put(position, registry.idFor(name.getText(), name));
        bodyStarts.put(position, i + 1);
    }

    /**
     * Returns the ID of the macro tested by the `ifdef, `ifndef or
     * `elsif at the given position.
     */
    public int getMacroId(int position) {
        Integer id = macroIds.get(position);
        if (id == null)
            throw new IllegalStateException("No macro test at " + position);
        return id;
    }

    /**
     * Returns the position of the first token of the branch body
     * introduced by the directive at the given position. For a
     * macro test this is the token after the macro name.
     */
    public int getBodyStart(int position) {
        Integer start = bodyStarts.get(position);
        if (start == null)
            throw new IllegalStateException("No branch at " + position);
        return start;
    }
}
