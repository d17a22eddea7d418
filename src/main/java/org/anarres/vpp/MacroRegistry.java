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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * Assigns each macro tested by a conditional a dense integer ID,
 * used as its bit offset in {@link Variant} masks.
 */
public class MacroRegistry {

    public static final int DEFAULT_CAPACITY = 128;

    private final int capacity;
    private final Map<String, Integer> ids = new HashMap<>();
    private final List<String> names = new ArrayList<>();

    public MacroRegistry(@Nonnegative int capacity) {
        if (capacity < 0)
            throw new IllegalArgumentException("Negative capacity " + capacity);
        this.capacity = capacity;
    }

    public MacroRegistry() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Returns the ID of the given macro, allocating the next free ID
     * if the macro has not been seen before.
     *
     * @param name the macro name.
     * @param token the token naming the macro, for error reporting.
     * @throws FlowTreeException if a new ID would exceed the capacity.
     */
    public int idFor(@Nonnull String name, @CheckForNull Token token)
            throws FlowTreeException {
        Integer id = ids.get(name);
        if (id != null)
            return id;
        if (names.size() >= capacity)
            throw new FlowTreeException(FlowTreeException.Kind.CAPACITY, token,
                    "Too many conditional macros: '" + name
                    + "' exceeds the limit of " + capacity);
        id = names.size();
        ids.put(name, id);
        names.add(name);
        return id;
    }

    public int idFor(@Nonnull String name)
            throws FlowTreeException {
        return idFor(name, null);
    }

    /**
     * Returns the ID of a registered macro.
     *
     * @throws IllegalStateException if the macro was never registered.
     */
    public int getId(@Nonnull String name) {
        Integer id = ids.get(name);
        if (id == null)
            throw new IllegalStateException("Unregistered macro " + name);
        return id;
    }

    public boolean contains(@Nonnull String name) {
        return ids.containsKey(name);
    }

    @Nonnull
    public String nameOf(@Nonnegative int id) {
        return names.get(id);
    }

    public int size() {
        return names.size();
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "MacroRegistry" + names;
    }
}
