package ru.byprogminer.lispmacros.macro;

import org.junit.jupiter.api.Test;
import ru.byprogminer.lispmacros.reader.LispReader;
import ru.byprogminer.lispmacros.syntax.Cst;

import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class MacroPatternTest {

    private static Cst read(String text) {
        return LispReader.read(text, "pattern").get(0);
    }

    private static MacroPattern parse(String text, String... literals) {
        return MacroPattern.parse(read(text), Set.of(literals));
    }

    private static MacroException.Kind parseError(String text, String... literals) {
        return assertThrows(MacroException.class, () -> parse(text, literals)).getKind();
    }

    @Test
    public void mirrorsTreeShape() {
        final MacroPattern pattern = parse("(a [b c] ...)");

        assertThat(pattern, is(new MacroPattern.SExpr(List.of(
                new MacroPattern.Ident("a"),
                new MacroPattern.ListForm(List.of(new MacroPattern.Ident("b"), new MacroPattern.Ident("c")), false),
                new MacroPattern.Ident("...")
        ), false)));
    }

    @Test
    public void rejectsLiteralValues() {
        assertThat(parseError("(a 1)"), is(MacroException.Kind.MALFORMED_PATTERN));
        assertThat(parseError("\"s\""), is(MacroException.Kind.MALFORMED_PATTERN));
    }

    @Test
    public void rejectsAdjacentRepeats() {
        assertThat(parseError("(a ... b ...)"), is(MacroException.Kind.AMBIGUOUS_PATTERN));
        assertThat(parseError("(a ... b c ...)"), is(MacroException.Kind.AMBIGUOUS_PATTERN));
        assertThat(parseError("(x (a ... b ...))"), is(MacroException.Kind.AMBIGUOUS_PATTERN));
    }

    @Test
    public void literalDelimitsRepeats() {
        assertThat(parse("(a ... => b ...)", "=>"), instanceOf(MacroPattern.SExpr.class));
        assertThat(parse("(a ... (k =>) b ...)", "=>"), instanceOf(MacroPattern.SExpr.class));

        // not declared as a literal, so it is a variable
        assertThat(parseError("(a ... => b ...)"), is(MacroException.Kind.AMBIGUOUS_PATTERN));
    }

    @Test
    public void escapeDisablesAmbiguityCheck() {
        final MacroPattern pattern = parse("(macro-escape a ... b ...)");

        assertThat(pattern, instanceOf(MacroPattern.SExpr.class));

        final MacroPattern.SExpr sexpr = (MacroPattern.SExpr) pattern;
        assertThat(sexpr.escaped(), is(true));
        assertThat(sexpr.elements().size(), is(4));
        assertThat(sexpr.elements().get(0), is(new MacroPattern.Ident("a")));
    }

    @Test
    public void ellipsisMustFollowAPattern() {
        assertThat(parseError("(... a)"), is(MacroException.Kind.MALFORMED_PATTERN));
        assertThat(parseError("[macro-escape a ... ...]"), is(MacroException.Kind.MALFORMED_PATTERN));
    }

    @Test
    public void collectsVariableNames() {
        final MacroPattern pattern = parse("(a (b c) ... => [d (e ...)])", "=>");

        assertThat(pattern.variableNames(Set.of("=>")), contains("a", "b", "c", "d", "e"));
        assertThat(parse("(=> ...)", "=>").variableNames(Set.of("=>")), is(empty()));
    }

    @Test
    public void unambiguityScan() {
        final MacroPattern a = new MacroPattern.Ident("a");
        final MacroPattern lit = new MacroPattern.Ident("lit");
        final MacroPattern dots = new MacroPattern.Ident("...");

        assertThat(MacroPattern.isUnambiguous(List.of(a, dots, a, dots), Set.of()), is(false));
        assertThat(MacroPattern.isUnambiguous(List.of(a, dots, lit, a, dots), Set.of("lit")), is(true));
        assertThat(MacroPattern.isUnambiguous(List.of(a, dots, a), Set.of()), is(true));
    }
}
