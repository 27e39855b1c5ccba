package ru.byprogminer.lispmacros.macro;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import ru.byprogminer.lispmacros.syntax.Cst;
import ru.byprogminer.lispmacros.syntax.CstVisitor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiled pattern of a macro rule.
 *
 * <p>An identifier is either a syntax literal of the owning macro, which must
 * appear verbatim, or a variable. The identifier {@code ...} marks the
 * preceding element as repeated. A pattern built by {@link #parse} is
 * guaranteed to be unambiguous unless it was escaped with {@code macro-escape}.
 */
public sealed interface MacroPattern permits MacroPattern.Ident, MacroPattern.SExpr, MacroPattern.ListForm {

    <R> R accept(PatternVisitor<R> visitor);

    /**
     * Whether a syntax literal occurs anywhere in this pattern.
     */
    boolean containsLiteral(Set<String> literals);

    void collectVariables(Set<String> literals, Set<String> out);

    default Set<String> variableNames(Set<String> literals) {
        final Set<String> result = new LinkedHashSet<>();

        collectVariables(literals, result);
        return result;
    }

    default boolean isEllipsis() {
        return this instanceof Ident ident && ident.name().equals(Keywords.ELLIPSIS);
    }

    static MacroPattern parse(Cst tree, Set<String> literals) {
        return tree.accept(new Parser(literals));
    }

    /**
     * Two repeats with no literal-containing pattern between them can split
     * their arguments in several ways and are rejected.
     */
    static boolean isUnambiguous(List<MacroPattern> patterns, Set<String> literals) {
        boolean unresolvedRepeat = false;

        for (final MacroPattern p : patterns) {
            if (p.isEllipsis()) {
                if (unresolvedRepeat) {
                    return false;
                }

                unresolvedRepeat = true;
            } else if (p.containsLiteral(literals)) {
                unresolvedRepeat = false;
            }
        }

        return true;
    }

    private static boolean anyContainsLiteral(List<MacroPattern> patterns, Set<String> literals) {
        return patterns.stream().anyMatch(p -> p.containsLiteral(literals));
    }

    private static void collectAll(List<MacroPattern> patterns, Set<String> literals, Set<String> out) {
        for (final MacroPattern p : patterns) {
            p.collectVariables(literals, out);
        }
    }

    record Ident(@NonNull String name) implements MacroPattern {

        public boolean isLiteral(Set<String> literals) {
            return literals.contains(name);
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitIdent(this);
        }

        @Override
        public boolean containsLiteral(Set<String> literals) {
            return isLiteral(literals);
        }

        @Override
        public void collectVariables(Set<String> literals, Set<String> out) {
            if (!isEllipsis() && !isLiteral(literals)) {
                out.add(name);
            }
        }
    }

    record SExpr(@NonNull List<MacroPattern> elements, boolean escaped) implements MacroPattern {

        public SExpr {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitSExpr(this);
        }

        @Override
        public boolean containsLiteral(Set<String> literals) {
            return anyContainsLiteral(elements, literals);
        }

        @Override
        public void collectVariables(Set<String> literals, Set<String> out) {
            collectAll(elements, literals, out);
        }
    }

    record ListForm(@NonNull List<MacroPattern> elements, boolean escaped) implements MacroPattern {

        public ListForm {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitList(this);
        }

        @Override
        public boolean containsLiteral(Set<String> literals) {
            return anyContainsLiteral(elements, literals);
        }

        @Override
        public void collectVariables(Set<String> literals, Set<String> out) {
            collectAll(elements, literals, out);
        }
    }

    @RequiredArgsConstructor
    final class Parser implements CstVisitor<MacroPattern> {

        private final Set<String> literals;

        @Override
        public MacroPattern visitIdent(Cst.Ident ident) {
            return new Ident(ident.name());
        }

        @Override
        public MacroPattern visitSExpr(Cst.SExpr sexpr) {
            final List<Cst> elements = sexpr.elements();
            final boolean escaped = isEscaped(elements);

            return new SExpr(parseElements(sexpr, escaped), escaped);
        }

        @Override
        public MacroPattern visitList(Cst.ListForm list) {
            final List<Cst> elements = list.elements();
            final boolean escaped = isEscaped(elements);

            return new ListForm(parseElements(list, escaped), escaped);
        }

        @Override
        public MacroPattern visitLiteral(Cst.Literal literal) {
            throw new MacroException(MacroException.Kind.MALFORMED_PATTERN, literal.pos(),
                    "Expected list or identifier in pattern, found `" + literal + "`");
        }

        private static boolean isEscaped(List<Cst> elements) {
            return !elements.isEmpty() && elements.get(0).isIdent(Keywords.MACRO_ESCAPE);
        }

        private List<MacroPattern> parseElements(Cst tree, boolean escaped) {
            final List<Cst> elements = tree.children().orElseThrow();
            final List<MacroPattern> result = new ArrayList<>(elements.size());

            for (final Cst element : escaped ? elements.subList(1, elements.size()) : elements) {
                result.add(element.accept(this));
            }

            if (!escaped && !isUnambiguous(result, literals)) {
                throw new MacroException(MacroException.Kind.AMBIGUOUS_PATTERN, tree.pos(),
                        "Ambiguous pattern `" + tree + "`: repeated patterns need a literal between them");
            }

            for (int i = 0; i < result.size(); ++i) {
                if (result.get(i).isEllipsis() && (i == 0 || result.get(i - 1).isEllipsis())) {
                    throw new MacroException(MacroException.Kind.MALFORMED_PATTERN, tree.pos(),
                            "`" + Keywords.ELLIPSIS + "` must follow the pattern it repeats in `" + tree + "`");
                }
            }

            return result;
        }
    }
}
