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
import java.util.Objects;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The control flow tree of a lexed Verilog source file.
 *
 * Enumerates every variant of the file: one directive-free token
 * sequence for each combination of `ifdef assumptions which changes
 * the selected tokens.
 *
 * <pre>
 * FlowTree tree = new FlowTree(new DirectiveLexer(text).tokens());
 * tree.enumerate(variant -&gt; {
 *     lint(variant.getSequence());
 *     return true;
 * });
 * </pre>
 *
 * Structural errors are reported before any variant is generated.
 * A FlowTree is not thread safe.
 */
public class FlowTree {

    private static final Logger LOG = LoggerFactory.getLogger(FlowTree.class);

    private final List<Token> source;
    private final MacroRegistry registry;

    @CheckForNull
    private FlowGraph graph;

    public FlowTree(@Nonnull List<Token> source, @Nonnegative int capacity) {
        this.source = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(source, "source")));
        this.registry = new MacroRegistry(capacity);
    }

    public FlowTree(@Nonnull List<Token> source) {
        this(source, MacroRegistry.DEFAULT_CAPACITY);
    }

    /**
     * Generates all possible variants, delivering each to the receiver
     * until the receiver returns false.
     *
     * @return the number of variants delivered.
     * @throws FlowTreeException if the conditional directives are malformed,
     *  or test more distinct macros than the registry capacity. No variant
     *  is delivered in this case.
     */
    public int enumerate(@Nonnull VariantReceiver receiver)
            throws FlowTreeException {
        Objects.requireNonNull(receiver, "receiver");
        int count = new VariantEnumerator(getFlowGraph()).enumerate(receiver);
        LOG.debug("Generated " + count + " variants");
        return count;
    }

    /**
     * Returns the control flow graph, building it on first use.
     *
     * @throws FlowTreeException if the conditional directives are malformed.
     */
    @Nonnull
    public FlowGraph getFlowGraph()
            throws FlowTreeException {
        if (graph == null) {
            ConditionalBlockExtractor extractor = new ConditionalBlockExtractor(source, registry);
            List<ConditionalBlock> blocks = extractor.extract();
            graph = new FlowGraphBuilder(source, extractor).build(blocks);
        }
        return graph;
    }

    /**
     * Returns the registry naming the macro IDs used in variant masks.
     * It is populated by the first call to {@link #enumerate(VariantReceiver)}.
     */
    @Nonnull
    public MacroRegistry getMacroRegistry() {
        return registry;
    }

    @Nonnull
    public List<Token> getSource() {
        return source;
    }
}
