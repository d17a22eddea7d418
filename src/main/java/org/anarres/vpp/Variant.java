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

import java.util.BitSet;
import java.util.List;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.pcollections.PVector;

/**
 * One directive-free token sequence of a source file, together with
 * the macro assumptions which select it.
 *
 * Bit i of the macros mask is set when the macro with ID i is assumed
 * defined. Bit i of the assumed set is set when that macro was tested
 * on the path to this variant, in either direction; a macro whose
 * assumed bit is clear does not affect this variant.
 */
public final class Variant {

    private final PVector<Token> sequence;
    private final BitSet macrosMask;
    private final BitSet assumed;

    public Variant(@Nonnull PVector<Token> sequence, @Nonnull BitSet macrosMask, @Nonnull BitSet assumed) {
        this.sequence = sequence;
        this.macrosMask = (BitSet) macrosMask.clone();
        this.assumed = (BitSet) assumed.clone();
    }

    @Nonnull
    public List<Token> getSequence() {
        return sequence;
    }

    /** Returns a copy of the macros mask. */
    @Nonnull
    public BitSet getMacrosMask() {
        return (BitSet) macrosMask.clone();
    }

    /** Returns a copy of the set of tested macros. */
    @Nonnull
    public BitSet getAssumed() {
        return (BitSet) assumed.clone();
    }

    public boolean isDefined(@Nonnegative int macroId) {
        return macrosMask.get(macroId);
    }

    public boolean isAssumed(@Nonnegative int macroId) {
        return assumed.get(macroId);
    }

    /** Returns the concatenated text of the tokens of this variant. */
    @Nonnull
    public String getText() {
        StringBuilder buf = new StringBuilder();
        for (Token token : sequence)
            buf.append(token.getText());
        return buf.toString();
    }

    /**
     * Describes the assumptions as "+NAME" for defined and "-NAME"
     * for undefined macros, in ID order.
     */
    @Nonnull
    public String getAssumptions(@Nonnull MacroRegistry registry) {
        StringBuilder buf = new StringBuilder();
        for (int id = assumed.nextSetBit(0); id >= 0; id = assumed.nextSetBit(id + 1)) {
            if (buf.length() > 0)
                buf.append(' ');
            buf.append(macrosMask.get(id) ? '+' : '-').append(registry.nameOf(id));
        }
        return buf.toString();
    }

    @Nonnull
    public JsonObject toJson(@Nonnull MacroRegistry registry) {
        JsonObject result = new JsonObject();
        JsonArray defined = new JsonArray();
        JsonArray undefined = new JsonArray();
        for (int id = assumed.nextSetBit(0); id >= 0; id = assumed.nextSetBit(id + 1)) {
            JsonPrimitive name = new JsonPrimitive(registry.nameOf(id));
            if (macrosMask.get(id))
                defined.add(name);
            else
                undefined.add(name);
        }
        result.add("defined", defined);
        result.add("undefined", undefined);
        result.addProperty("text", getText());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Variant) {
            Variant o = (Variant) obj;
            return o.sequence.equals(sequence)
                    && o.macrosMask.equals(macrosMask)
                    && o.assumed.equals(assumed);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return sequence.hashCode() ^ macrosMask.hashCode() ^ (assumed.hashCode() << 1);
    }

    @Override
    public String toString() {
        return "mask=" + macrosMask + ", assumed=" + assumed + ", sequence=" + sequence;
    }
}
