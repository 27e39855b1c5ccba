package ru.byprogminer.lispmacros.macro;

import lombok.NonNull;
import ru.byprogminer.lispmacros.syntax.Cst;
import ru.byprogminer.lispmacros.syntax.CstPrinter;
import ru.byprogminer.lispmacros.syntax.SrcPos;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Macro defined by a series of rules, tried in declaration order.
 *
 * @param literals identifiers that must match verbatim in the patterns of this macro
 */
public record Macro(@NonNull String name, @NonNull Set<String> literals, @NonNull List<Rule> rules) {

    public record Rule(@NonNull MacroPattern pattern, @NonNull Cst template) {}

    public Macro {
        literals = Set.copyOf(literals);
        rules = List.copyOf(rules);
    }

    /**
     * Builds a macro from the parts of {@code (def-macro name (literal*) (pattern template)*)}
     * following the {@code def-macro} keyword.
     */
    public static Macro parse(List<Cst> parts, SrcPos pos) {
        if (parts.isEmpty()) {
            throw new MacroException(MacroException.Kind.MALFORMED_DEFINITION, pos,
                    "Name missing in macro definition");
        }

        final Cst nameTree = parts.get(0);
        final String name = nameTree.identName().orElseThrow(() -> new MacroException(
                MacroException.Kind.MALFORMED_DEFINITION, nameTree.pos(),
                "Expected macro name identifier, found `" + nameTree + "`"));

        if (Keywords.RESERVED.contains(name)) {
            throw new MacroException(MacroException.Kind.MALFORMED_DEFINITION, nameTree.pos(),
                    "`" + name + "` is reserved and cannot name a macro");
        }

        if (parts.size() < 2) {
            throw new MacroException(MacroException.Kind.MALFORMED_DEFINITION, pos,
                    "Literals list missing in definition of macro `" + name + "`");
        }

        final Set<String> literals = parseLiterals(parts.get(1));
        final List<Rule> rules = new ArrayList<>(parts.size() - 2);

        for (final Cst maybeRule : parts.subList(2, parts.size())) {
            final List<Cst> rule = maybeRule.children().orElseThrow(() -> new MacroException(
                    MacroException.Kind.MALFORMED_DEFINITION, maybeRule.pos(),
                    "Expected rule list, found `" + maybeRule + "`"));

            if (rule.size() != 2) {
                throw new MacroException(MacroException.Kind.MALFORMED_DEFINITION, maybeRule.pos(),
                        "Expected pattern and template in rule `" + maybeRule + "`");
            }

            rules.add(new Rule(MacroPattern.parse(rule.get(0), literals), rule.get(1)));
        }

        return new Macro(name, literals, rules);
    }

    private static Set<String> parseLiterals(Cst maybeLiterals) {
        final List<Cst> items = maybeLiterals.children().orElseThrow(() -> new MacroException(
                MacroException.Kind.MALFORMED_DEFINITION, maybeLiterals.pos(),
                "Expected literals list, found `" + maybeLiterals + "`"));

        final Set<String> result = new LinkedHashSet<>();
        for (final Cst item : items) {
            final String literal = item.identName().orElseThrow(() -> new MacroException(
                    MacroException.Kind.MALFORMED_DEFINITION, item.pos(),
                    "Expected literal identifier, found `" + item + "`"));

            if (Keywords.RESERVED.contains(literal)) {
                throw new MacroException(MacroException.Kind.MALFORMED_DEFINITION, item.pos(),
                        "`" + literal + "` is reserved and cannot be a syntax literal");
            }

            result.add(literal);
        }

        return result;
    }

    /**
     * Substitutes the template of the first rule whose pattern matches {@code args}.
     *
     * @throws MacroException if no rule matches
     */
    public Cst apply(List<Cst> args, SrcPos pos) {
        final Matcher matcher = new Matcher(literals);

        for (final Rule rule : rules) {
            final Optional<Map<String, Binding>> bound = matcher.matchArguments(rule.pattern(), args, pos);

            if (bound.isPresent()) {
                return new Substitutor(bound.get()).substitute(rule.template());
            }
        }

        throw new MacroException(MacroException.Kind.NO_RULE_MATCHED, pos,
                "No rule of macro `" + name + "` matched arguments (" + CstPrinter.print(args) + ")");
    }
}
