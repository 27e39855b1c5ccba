package ru.byprogminer.lispmacros.macro;

import org.junit.jupiter.api.Test;
import ru.byprogminer.lispmacros.reader.LispReader;
import ru.byprogminer.lispmacros.syntax.Cst;
import ru.byprogminer.lispmacros.syntax.SrcPos;

import java.util.Arrays;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SubstitutorTest {

    private static Cst read(String text) {
        return LispReader.read(text, "template").get(0);
    }

    private static Binding single(String text) {
        return new Binding.Single(read(text));
    }

    private static Binding seqOf(Binding... items) {
        return new Binding.Sequence(Arrays.asList(items), SrcPos.synthetic());
    }

    private static Binding seq(String... items) {
        return seqOf(Arrays.stream(items).map(SubstitutorTest::single).toArray(Binding[]::new));
    }

    private static String substitute(String template, Map<String, Binding> bindings) {
        return new Substitutor(bindings).substitute(read(template)).toString();
    }

    @Test
    public void replacesBoundIdentifiers() {
        final Map<String, Binding> bindings = Map.of("x", single("(g 1)"), "y", single("2"));

        assertThat(substitute("(f x [y z] \"s\")", bindings), is("(f (g 1) [2 z] \"s\")"));
        assertThat(substitute("x", bindings), is("(g 1)"));
    }

    @Test
    public void substitutedValuesAreNotRescanned() {
        assertThat(substitute("(f x)", Map.of("x", single("y"), "y", single("1"))), is("(f y)"));
    }

    @Test
    public void sequenceOutsideEllipsisBecomesList() {
        assertThat(substitute("(f xs)", Map.of("xs", seq("1", "2"))), is("(f [1 2])"));
    }

    @Test
    public void ellipsisSplicesEachItem() {
        assertThat(substitute("(f xs ... end)", Map.of("xs", seq("1", "2", "3"))), is("(f 1 2 3 end)"));
        assertThat(substitute("[xs ...]", Map.of("xs", seq())), is("[]"));
    }

    @Test
    public void sequencesAreZipped() {
        final Map<String, Binding> bindings = Map.of("c1", seq("1", "2", "3"), "c2", seq("a", "b", "c"));

        assertThat(substitute("(do (c1 and c2) ...)", bindings), is("(do (1 and a) (2 and b) (3 and c))"));
    }

    @Test
    public void shortSequencesAndSingularsBroadcast() {
        final Map<String, Binding> bindings = Map.of("xs", seq("1", "2", "3"), "ys", seq("a"), "k", single("z"));

        assertThat(substitute("(f (k xs ys) ...)", bindings), is("(f (z 1 a) (z 2 a) (z 3 a))"));
    }

    @Test
    public void emptySequenceVanishesFromLongerIterations() {
        final Map<String, Binding> bindings = Map.of("xs", seq("1", "2"), "es", seq());

        assertThat(substitute("(f (xs es) ...)", bindings), is("(f (1) (2))"));
    }

    @Test
    public void nestedEllipsesFlattenLevelByLevel() {
        final Map<String, Binding> bindings = Map.of(
                "a", seq("1", "4", "5"),
                "b", seqOf(seq("2", "3"), seq(), seq("6"))
        );

        assertThat(substitute("((a b ...) ...)", bindings), is("((1 2 3) (4) (5 6))"));
    }

    @Test
    public void macroQuoteIsLeftAlone() {
        final Map<String, Binding> bindings = Map.of("xs", seq("1", "2"));

        assertThat(substitute("(f (macro-quote (xs ...)))", bindings), is("(f (xs ...))"));
        assertThat(substitute("[macro-quote xs]", bindings), is("xs"));
        assertThat(substitute("(g (macro-quote ...) xs ...)", bindings), is("(g ... 1 2)"));
    }

    @Test
    public void macroQuoteTakesExactlyOneElement() {
        final MacroException e = assertThrows(MacroException.class,
                () -> substitute("(f (macro-quote a b))", Map.of()));

        assertThat(e.getKind(), is(MacroException.Kind.ARITY_MISMATCH));
        assertThat(e.getDescription(), is("Arity mismatch in `macro-quote`. Expected 1, found 2"));

        assertThat(assertThrows(MacroException.class, () -> substitute("(macro-quote)", Map.of())).getKind(),
                is(MacroException.Kind.ARITY_MISMATCH));
    }

    @Test
    public void ellipsisNeedsASequenceVariable() {
        final MacroException e = assertThrows(MacroException.class,
                () -> substitute("(f x ...)", Map.of("x", single("1"))));

        assertThat(e.getKind(), is(MacroException.Kind.EMPTY_SEQUENCE_FLATTEN));
        assertThat(e.getPos().column(), is(4));
    }
}
