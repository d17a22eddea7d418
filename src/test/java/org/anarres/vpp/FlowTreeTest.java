package org.anarres.vpp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FlowTreeTest {

    private static List<String> words(Variant variant) {
        List<String> out = new ArrayList<>();
        for (Token token : variant.getSequence()) {
            TokenType type = token.getType();
            if (!type.isWhite() && type != TokenType.NL)
                out.add(token.getText());
        }
        return out;
    }

    private static BitSet bits(int... ids) {
        BitSet set = new BitSet();
        for (int id : ids)
            set.set(id);
        return set;
    }

    private static FlowTree tree(String source) {
        return new FlowTree(new DirectiveLexer(source).tokens());
    }

    private static List<Variant> variants(FlowTree tree) throws FlowTreeException {
        List<Variant> out = new ArrayList<>();
        int count = tree.enumerate(variant -> out.add(variant));
        assertEquals(out.size(), count);
        return out;
    }

    private static List<Variant> variants(String source) throws FlowTreeException {
        return variants(tree(source));
    }

    private static List<List<String>> allWords(List<Variant> variants) {
        List<List<String>> out = new ArrayList<>();
        for (Variant variant : variants)
            out.add(words(variant));
        return out;
    }

    @Nested
    @DisplayName("Variant generation")
    class Generation {

        @Test
        void sourceWithoutConditionalsHasOneVariant() throws Exception {
            List<Token> tokens = new DirectiveLexer("module m;\n  wire w;\nendmodule\n").tokens();
            List<Variant> variants = variants(new FlowTree(tokens));
            assertEquals(1, variants.size());
            assertEquals(tokens, variants.get(0).getSequence());
            assertTrue(variants.get(0).getMacrosMask().isEmpty());
            assertTrue(variants.get(0).getAssumed().isEmpty());
        }

        @Test
        void emptySourceHasOneEmptyVariant() throws Exception {
            List<Variant> variants = variants("");
            assertEquals(1, variants.size());
            assertTrue(variants.get(0).getSequence().isEmpty());
        }

        @Test
        void singleIfdefHasTwoVariants() throws Exception {
            List<Variant> variants = variants("a\n`ifdef A\nb\n`endif\nc\n");
            assertEquals(2, variants.size());

            assertEquals(Arrays.asList("a", "b", "c"), words(variants.get(0)));
            assertEquals(bits(0), variants.get(0).getMacrosMask());
            assertEquals(bits(0), variants.get(0).getAssumed());

            assertEquals(Arrays.asList("a", "c"), words(variants.get(1)));
            assertEquals(bits(), variants.get(1).getMacrosMask());
            assertEquals(bits(0), variants.get(1).getAssumed());
        }

        @Test
        void elseSelectsExactlyOneBody() throws Exception {
            List<Variant> variants = variants("`ifdef A x `else y `endif z");
            assertEquals(Arrays.asList(
                    Arrays.asList("x", "z"),
                    Arrays.asList("y", "z")), allWords(variants));
            assertTrue(variants.get(0).isDefined(0));
            assertFalse(variants.get(1).isDefined(0));
        }

        @Test
        void repeatedMacroTestReusesAssumption() throws Exception {
            List<Variant> variants = variants("`ifdef A x `endif m `ifdef A y `endif");
            assertEquals(Arrays.asList(
                    Arrays.asList("x", "m", "y"),
                    Collections.singletonList("m")), allWords(variants));
        }

        @Test
        void independentMacrosGiveEveryCombination() throws Exception {
            List<Variant> variants = variants("`ifdef A a `endif `ifdef B b `endif");
            assertEquals(Arrays.asList(
                    Arrays.asList("a", "b"),
                    Collections.singletonList("a"),
                    Collections.singletonList("b"),
                    Collections.<String>emptyList()), allWords(variants));
            assertEquals(bits(0, 1), variants.get(0).getMacrosMask());
            assertEquals(bits(0), variants.get(1).getMacrosMask());
            assertEquals(bits(1), variants.get(2).getMacrosMask());
            assertEquals(bits(), variants.get(3).getMacrosMask());
            for (Variant variant : variants)
                assertEquals(bits(0, 1), variant.getAssumed());
        }

        @Test
        void nestedBlockOnlyForksInsideItsParent() throws Exception {
            List<Variant> variants = variants("`ifdef A a `ifdef B b `endif `endif c");
            assertEquals(Arrays.asList(
                    Arrays.asList("a", "b", "c"),
                    Arrays.asList("a", "c"),
                    Collections.singletonList("c")), allWords(variants));
            assertEquals(bits(0), variants.get(2).getAssumed());
        }

        @Test
        void nestedBlocksInBothBranchesGiveCrossProduct() throws Exception {
            List<Variant> variants = variants(
                    "`ifdef A\n"
                    + "  `ifdef B ab `else a `endif\n"
                    + "`else\n"
                    + "  `ifdef B b `else n `endif\n"
                    + "`endif\n");
            assertEquals(Arrays.asList(
                    Collections.singletonList("ab"),
                    Collections.singletonList("a"),
                    Collections.singletonList("b"),
                    Collections.singletonList("n")), allWords(variants));
            for (Variant variant : variants)
                assertEquals(bits(0, 1), variant.getAssumed());
        }

        @Test
        void nestedEndifRightBeforeOuterElse() throws Exception {
            List<Token> tokens = Arrays.asList(
                    new Token(TokenType.PP_IFDEF, "`ifdef"), new Token(TokenType.IDENTIFIER, "A"),
                    new Token(TokenType.PP_IFDEF, "`ifdef"), new Token(TokenType.IDENTIFIER, "B"),
                    new Token(TokenType.IDENTIFIER, "x"), new Token(TokenType.PP_ENDIF, "`endif"),
                    new Token(TokenType.PP_ELSE, "`else"), new Token(TokenType.IDENTIFIER, "y"),
                    new Token(TokenType.PP_ENDIF, "`endif"));
            List<Variant> variants = variants(new FlowTree(tokens));
            assertEquals(Arrays.asList(
                    Collections.singletonList("x"),
                    Collections.<String>emptyList(),
                    Collections.singletonList("y")), allWords(variants));
            assertEquals(bits(0, 1), variants.get(0).getMacrosMask());
            assertEquals(bits(0), variants.get(1).getMacrosMask());
            assertEquals(bits(0, 1), variants.get(1).getAssumed());
            assertEquals(bits(), variants.get(2).getMacrosMask());
            assertEquals(bits(0), variants.get(2).getAssumed());
        }

        @Test
        void nestedEndifRightBeforeOuterElsif() throws Exception {
            List<Variant> variants = variants("`ifdef A `ifdef B x `endif`elsif C z `endif");
            assertEquals(Arrays.asList(
                    Collections.singletonList("x"),
                    Collections.<String>emptyList(),
                    Collections.singletonList("z"),
                    Collections.<String>emptyList()), allWords(variants));
            assertEquals(bits(0, 1), variants.get(0).getAssumed());
            assertEquals(bits(0, 1), variants.get(1).getAssumed());
            assertEquals(bits(0, 2), variants.get(2).getAssumed());
            assertEquals(bits(2), variants.get(2).getMacrosMask());
            assertEquals(bits(0, 2), variants.get(3).getAssumed());
            assertEquals(bits(), variants.get(3).getMacrosMask());
        }

        @Test
        void elsifChainTestsEachMacroInTurn() throws Exception {
            List<Variant> variants = variants("`ifdef A a `elsif B b `else c `endif");
            assertEquals(Arrays.asList(
                    Collections.singletonList("a"),
                    Collections.singletonList("b"),
                    Collections.singletonList("c")), allWords(variants));
            assertEquals(bits(0), variants.get(0).getAssumed());
            assertEquals(bits(0, 1), variants.get(1).getAssumed());
            assertEquals(bits(1), variants.get(1).getMacrosMask());
            assertEquals(bits(), variants.get(2).getMacrosMask());
        }

        @Test
        void elsifFollowsEarlierAssumption() throws Exception {
            List<Variant> variants = variants("`ifdef A a `endif `ifdef B x `elsif A y `endif");
            assertEquals(Arrays.asList(
                    Arrays.asList("a", "x"),
                    Arrays.asList("a", "y"),
                    Collections.singletonList("x"),
                    Collections.<String>emptyList()), allWords(variants));
        }

        @Test
        void ifndefEntersBodyWhenUndefined() throws Exception {
            List<Variant> variants = variants("`ifndef A a `else b `endif");
            assertEquals(Arrays.asList(
                    Collections.singletonList("b"),
                    Collections.singletonList("a")), allWords(variants));
            assertTrue(variants.get(0).isDefined(0));
            assertFalse(variants.get(1).isDefined(0));
        }

        @Test
        void ifndefAfterIfdefReusesAssumption() throws Exception {
            List<Variant> variants = variants("`ifdef A a `endif `ifndef A n `endif");
            assertEquals(Arrays.asList(
                    Collections.singletonList("a"),
                    Collections.singletonList("n")), allWords(variants));
        }

        @Test
        void emptyBranchesStillFork() throws Exception {
            List<Variant> variants = variants("`ifdef A `else `endif x");
            assertEquals(2, variants.size());
            assertEquals(Collections.singletonList("x"), words(variants.get(0)));
            assertEquals(Collections.singletonList("x"), words(variants.get(1)));
            assertNotEquals(variants.get(0).getMacrosMask(), variants.get(1).getMacrosMask());

            variants = variants("`ifdef A`endif");
            assertEquals(2, variants.size());
            assertTrue(variants.get(0).getSequence().isEmpty());
        }

        @Test
        void variantsContainNoDirectivesOrMacroNames() throws Exception {
            for (Variant variant : variants("`ifdef FOO x `elsif BAR y `else z `endif")) {
                for (Token token : variant.getSequence()) {
                    assertFalse(token.getType().isConditional(), token.toString());
                    assertNotEquals("FOO", token.getText());
                    assertNotEquals("BAR", token.getText());
                }
            }
        }

        @Test
        void enumerationIsDeterministic() throws Exception {
            String source = "`ifdef A a `elsif B b `endif `ifndef C c `endif `ifdef B d `endif";
            FlowTree tree = tree(source);
            assertEquals(variants(tree), variants(tree));
            assertEquals(variants(tree), variants(source));
        }
    }

    @Nested
    @DisplayName("Early stop")
    class EarlyStop {

        @Test
        void receiverStopsAfterKVariants() throws Exception {
            FlowTree tree = tree("`ifdef A a `endif `ifdef B b `endif `ifdef C c `endif");
            List<Variant> received = new ArrayList<>();
            int count = tree.enumerate(variant -> {
                received.add(variant);
                return received.size() < 3;
            });
            assertEquals(3, count);
            assertEquals(3, received.size());
        }

        @Test
        void noTokensAreAppendedAfterStop() throws Exception {
            FlowGraph graph = tree("x `ifdef A a `endif `ifdef B b `endif y").getFlowGraph();
            VariantEnumerator enumerator = new VariantEnumerator(graph);
            long[] appendedAtStop = new long[1];
            int[] calls = new int[1];
            int count = enumerator.enumerate(variant -> {
                calls[0]++;
                if (calls[0] == 2) {
                    appendedAtStop[0] = enumerator.getAppendCount();
                    return false;
                }
                return true;
            });
            assertEquals(2, count);
            assertEquals(2, calls[0]);
            assertEquals(appendedAtStop[0], enumerator.getAppendCount());
        }

        @Test
        void stopOnFirstVariantWithFullCapacity() throws Exception {
            StringBuilder source = new StringBuilder();
            for (int i = 0; i < MacroRegistry.DEFAULT_CAPACITY; i++)
                source.append("`ifdef M").append(i).append(" x").append(i).append(" `endif\n");
            FlowTree tree = tree(source.toString());
            List<Variant> received = new ArrayList<>();
            int count = tree.enumerate(variant -> {
                received.add(variant);
                return false;
            });
            assertEquals(1, count);
            assertEquals(MacroRegistry.DEFAULT_CAPACITY, tree.getMacroRegistry().size());
            assertEquals(MacroRegistry.DEFAULT_CAPACITY, received.get(0).getMacrosMask().cardinality());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        private void assertFails(FlowTreeException.Kind kind, String source) {
            List<Variant> received = new ArrayList<>();
            FlowTreeException e = assertThrows(FlowTreeException.class,
                    () -> tree(source).enumerate(variant -> received.add(variant)));
            assertEquals(kind, e.getKind());
            assertTrue(received.isEmpty());
        }

        @Test
        void unmatchedEndif() {
            assertFails(FlowTreeException.Kind.UNMATCHED_CLOSE, "x\n`endif\n");
        }

        @Test
        void tooManyMacros() {
            StringBuilder source = new StringBuilder();
            for (int i = 0; i <= MacroRegistry.DEFAULT_CAPACITY; i++)
                source.append("`ifdef M").append(i).append(" `endif\n");
            assertFails(FlowTreeException.Kind.CAPACITY, source.toString());
        }

        @Test
        void smallerCapacity() {
            FlowTree tree = new FlowTree(new DirectiveLexer("`ifdef A `elsif B `elsif A `endif").tokens(), 1);
            FlowTreeException e = assertThrows(FlowTreeException.class,
                    () -> tree.enumerate(variant -> true));
            assertEquals(FlowTreeException.Kind.CAPACITY, e.getKind());
            assertEquals("B", e.getToken().getText());
        }

        @Test
        void missingEndif() {
            assertFails(FlowTreeException.Kind.MISSING_CLOSE, "`ifdef A\nx\n");
        }

        @Test
        void missingMacroName() {
            assertFails(FlowTreeException.Kind.MISSING_IDENTIFIER, "`ifdef\nx\n`endif\n");
        }

        @Test
        void elseWithoutIfdef() {
            assertFails(FlowTreeException.Kind.UNMATCHED_ALTERNATIVE, "`else x `endif");
        }

        @Test
        void elsifAfterElse() {
            assertFails(FlowTreeException.Kind.BRANCH_AFTER_ELSE, "`ifdef A `else `elsif B `endif");
        }
    }
}
