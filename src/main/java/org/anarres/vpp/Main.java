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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints every variant of the given Verilog source files.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final String STDIN = "<stdin>";

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.in, System.out));
    }

    /**
     * Runs the variant generator.
     *
     * @return the process exit status.
     */
    public static int run(@Nonnull String[] args, @Nonnull InputStream in, @Nonnull PrintStream out)
            throws IOException {
        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Logs the macros and control flow graph of each file.");
        OptionSpec<?> jsonOption = parser.accepts("json",
                "Prints each variant as a JSON object on its own line.");
        OptionSpec<Integer> limitOption = parser.acceptsAll(Arrays.asList("limit", "n"),
                "Stops after the given number of variants per file.")
                .withRequiredArg().ofType(Integer.class).describedAs("count");
        OptionSpec<Integer> capacityOption = parser.accepts("capacity",
                "Maximum number of distinct macros tested by conditionals.")
                .withRequiredArg().ofType(Integer.class).describedAs("count")
                .defaultsTo(MacroRegistry.DEFAULT_CAPACITY);
        OptionSpec<File> inputsOption = parser.nonOptions()
                .ofType(File.class).describedAs("Files to process.");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            LOG.error(e.getMessage());
            parser.printHelpOn(out);
            return 2;
        }

        if (options.has(helpOption)) {
            parser.printHelpOn(out);
            return 0;
        }

        Generator generator = new Generator(out);
        generator.json = options.has(jsonOption);
        generator.debug = options.has(debugOption);
        generator.capacity = options.valueOf(capacityOption);
        if (generator.capacity < 0) {
            LOG.error("--capacity must not be negative, not " + generator.capacity);
            return 2;
        }
        if (options.has(limitOption)) {
            generator.limit = options.valueOf(limitOption);
            if (generator.limit < 1) {
                LOG.error("--limit must be at least 1, not " + generator.limit);
                return 2;
            }
        }

        int status = 0;
        List<File> inputs = options.valuesOf(inputsOption);
        if (inputs.isEmpty()) {
            String source = IOUtils.toString(in, StandardCharsets.UTF_8);
            if (!generator.generate(STDIN, source))
                status = 1;
        } else {
            for (File input : inputs) {
                String source;
                try {
                    source = FileUtils.readFileToString(input, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    LOG.error("Cannot read " + input + ": " + e.getMessage());
                    status = 1;
                    continue;
                }
                if (!generator.generate(input.getPath(), source))
                    status = 1;
            }
        }
        out.flush();
        return status;
    }

    private static class Generator {

        private final PrintStream out;
        private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

        boolean json;
        boolean debug;
        int capacity = MacroRegistry.DEFAULT_CAPACITY;
        int limit = Integer.MAX_VALUE;

        Generator(@Nonnull PrintStream out) {
            this.out = out;
        }

        /** Returns false if the file could not be processed. */
        boolean generate(@Nonnull String path, @Nonnull String source) {
            FlowTree tree = new FlowTree(new DirectiveLexer(source).tokens(), capacity);
            try {
                if (debug) {
                    FlowGraph graph = tree.getFlowGraph();
                    LOG.info(path + ": " + tree.getMacroRegistry());
                    LOG.info(path + ": flow graph\n" + graph);
                }
                int count = tree.enumerate(new VariantReceiver() {
                    int index = 0;

                    @Override
                    public boolean receive(Variant variant) {
                        index++;
                        print(path, index, variant, tree.getMacroRegistry());
                        return index < limit;
                    }
                });
                LOG.info(path + ": " + count + " variant(s)");
                return true;
            } catch (FlowTreeException e) {
                LOG.error(path + ": " + e.getMessage());
                return false;
            }
        }

        private void print(@Nonnull String path, int index, @Nonnull Variant variant, @Nonnull MacroRegistry registry) {
            if (json) {
                JsonObject result = new JsonObject();
                result.addProperty("file", path);
                result.addProperty("variant", index);
                for (Map.Entry<String, JsonElement> e : variant.toJson(registry).entrySet())
                    result.add(e.getKey(), e.getValue());
                out.println(gson.toJson(result));
            } else {
                out.println("// " + path + " variant " + index + ": " + variant.getAssumptions(registry));
                String text = variant.getText();
                out.print(text);
                if (!text.endsWith("\n"))
                    out.println();
            }
        }
    }
}
