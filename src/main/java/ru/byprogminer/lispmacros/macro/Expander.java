package ru.byprogminer.lispmacros.macro;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import ru.byprogminer.lispmacros.syntax.Cst;
import ru.byprogminer.lispmacros.syntax.SrcPos;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites macro definitions and invocations into primitive syntax.
 *
 * <p>Recognized forms:
 * <ul>
 * <li>{@code (quote ...)} is left untouched;</li>
 * <li>{@code (def-macro name (literal*) (pattern template)*)} registers a macro and vanishes;</li>
 * <li>{@code (name arg*)} with a registered {@code name} is replaced by the
 * template of the first matching rule, which is expanded again;</li>
 * <li>other call forms are expanded element-wise.</li>
 * </ul>
 * Macros are visible from their definition onward; there is no hygiene.
 */
@RequiredArgsConstructor
public class Expander {

    private static final Logger logger = Logger.getLogger(Expander.class.getName());

    @NonNull private final ExpansionOptions options;

    public Expander() {
        this(ExpansionOptions.defaults());
    }

    /**
     * Expands a program with a fresh registry.
     */
    public List<Cst> expandProgram(List<Cst> forms) {
        final MacroRegistry registry = new MacroRegistry();
        final List<Cst> result = new ArrayList<>(forms.size());

        for (final Cst form : forms) {
            expand(form, registry).ifPresent(result::add);
        }

        return result;
    }

    /**
     * @return the expanded tree, or empty if it vanished
     */
    public Optional<Cst> expand(Cst tree, MacroRegistry registry) {
        return expand(tree, registry, 0);
    }

    private Optional<Cst> expand(Cst tree, MacroRegistry registry, int depth) {
        if (!(tree instanceof Cst.SExpr sexpr) || sexpr.elements().isEmpty()) {
            return Optional.of(tree);
        }

        final List<Cst> elements = sexpr.elements();
        final List<Cst> tail = elements.subList(1, elements.size());
        final String head = elements.get(0).identName().orElse(null);

        if (Keywords.QUOTE.equals(head)) {
            return Optional.of(tree);
        }

        if (Keywords.DEF_MACRO.equals(head)) {
            final Macro macro = Macro.parse(tail, sexpr.pos());
            registry.define(macro, sexpr.pos());

            logger.log(Level.FINE, "{0}: defined macro {1} with {2} rule(s)",
                    new Object[] {sexpr.pos(), macro.name(), macro.rules().size()});
            return Optional.empty();
        }

        final Optional<Macro> macro = head != null ? registry.lookup(head) : Optional.empty();
        if (macro.isPresent()) {
            return applyMacro(macro.get(), tail, sexpr.pos(), registry, depth);
        }

        final List<Cst> expanded = new ArrayList<>(elements.size());
        for (final Cst element : elements) {
            expand(element, registry, depth).ifPresent(expanded::add);
        }

        return Optional.of(new Cst.SExpr(expanded, sexpr.pos()));
    }

    private Optional<Cst> applyMacro(Macro macro, List<Cst> args, SrcPos pos, MacroRegistry registry, int depth) {
        if (depth >= options.getMaxExpansionDepth()) {
            throw new MacroException(MacroException.Kind.RECURSION_LIMIT_EXCEEDED, pos,
                    "Expansion of macro `" + macro.name() + "` nested deeper than "
                            + options.getMaxExpansionDepth() + " levels");
        }

        final Cst substituted = macro.apply(args, pos).withExpansionSite(pos);

        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "{0}: {1} expanded to {2}", new Object[] {pos, macro.name(), substituted});
        }

        return expand(substituted, registry, depth + 1);
    }
}
