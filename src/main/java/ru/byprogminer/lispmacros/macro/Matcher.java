package ru.byprogminer.lispmacros.macro;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import ru.byprogminer.lispmacros.syntax.Cst;
import ru.byprogminer.lispmacros.syntax.CstVisitor;
import ru.byprogminer.lispmacros.syntax.SrcPos;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Matches syntax trees against the patterns of one macro.
 *
 * <p>Repeats are matched greedily without backtracking. This finds the only
 * possible split because {@link MacroPattern#parse} rejects ambiguous patterns.
 */
@RequiredArgsConstructor
public class Matcher {

    @NonNull private final Set<String> literals;

    /**
     * Matches the arguments of an invocation against a rule pattern. The
     * outer shape of the pattern is not compared, only its elements.
     */
    public Optional<Map<String, Binding>> matchArguments(MacroPattern pattern, List<Cst> args, SrcPos pos) {
        return Optional.ofNullable(pattern.accept(new PatternVisitor<Map<String, Binding>>() {

            @Override
            public Map<String, Binding> visitIdent(MacroPattern.Ident ident) {
                if (ident.isLiteral(literals) || ident.isEllipsis()) {
                    return null;
                }

                final List<Binding> items = args.stream().<Binding>map(Binding.Single::new).toList();
                return Map.of(ident.name(), new Binding.Sequence(items, span(args, pos)));
            }

            @Override
            public Map<String, Binding> visitSExpr(MacroPattern.SExpr sexpr) {
                return matchAll(sexpr.elements(), args, pos);
            }

            @Override
            public Map<String, Binding> visitList(MacroPattern.ListForm list) {
                return matchAll(list.elements(), args, pos);
            }
        }));
    }

    public Optional<Map<String, Binding>> match(MacroPattern pattern, Cst tree) {
        return Optional.ofNullable(bind(pattern, tree));
    }

    private Map<String, Binding> bind(MacroPattern pattern, Cst tree) {
        return tree.accept(new TreeMatcher(pattern));
    }

    /**
     * @return bindings, or {@code null} unless all patterns and all arguments were consumed
     */
    private Map<String, Binding> matchAll(List<MacroPattern> patterns, List<Cst> args, SrcPos pos) {
        final Map<String, Binding> result = new HashMap<>();

        int pi = 0, ai = 0;
        while (pi < patterns.size()) {
            final MacroPattern pattern = patterns.get(pi);

            if (pi + 1 < patterns.size() && patterns.get(pi + 1).isEllipsis()) {
                final int next = pi + 2;
                final int delimiter = findDelimiter(patterns, next);
                final int end;

                if (delimiter >= 0) {
                    // patterns between the repeat and its delimiter take one argument each
                    final int between = delimiter - next;

                    int i = ai + between;
                    while (i < args.size() && bind(patterns.get(delimiter), args.get(i)) == null) {
                        ++i;
                    }

                    end = Math.min(i, args.size()) - between;
                } else {
                    end = args.size() - minimumArity(patterns, next);
                }

                if (end < ai) {
                    return null;
                }

                final Map<String, Binding> repeated = matchRepeat(pattern, args.subList(ai, end), pos);
                if (repeated == null) {
                    return null;
                }

                result.putAll(repeated);
                pi = next;
                ai = end;
                continue;
            }

            if (ai >= args.size()) {
                return null;
            }

            final Map<String, Binding> bound = bind(pattern, args.get(ai));
            if (bound == null) {
                return null;
            }

            result.putAll(bound);
            ++pi;
            ++ai;
        }

        if (ai != args.size()) {
            return null;
        }

        return result;
    }

    private Map<String, Binding> matchRepeat(MacroPattern pattern, List<Cst> args, SrcPos pos) {
        final Map<String, List<Binding>> accumulators = new LinkedHashMap<>();

        for (final String name : pattern.variableNames(literals)) {
            accumulators.put(name, new ArrayList<>());
        }

        for (final Cst arg : args) {
            final Map<String, Binding> bound = bind(pattern, arg);
            if (bound == null) {
                return null;
            }

            if (!bound.keySet().equals(accumulators.keySet())) {
                throw new MacroEngineError("pattern variables " + accumulators.keySet()
                        + " disagree with bound variables " + bound.keySet() + " at " + arg.pos());
            }

            for (final Map.Entry<String, Binding> e : bound.entrySet()) {
                accumulators.get(e.getKey()).add(e.getValue());
            }
        }

        final SrcPos seqPos = span(args, pos);
        final Map<String, Binding> result = new HashMap<>();

        for (final Map.Entry<String, List<Binding>> e : accumulators.entrySet()) {
            result.put(e.getKey(), new Binding.Sequence(e.getValue(), seqPos));
        }

        return result;
    }

    /**
     * Index of the first literal-containing pattern at or after {@code from}
     * that is reached before another repeat, or -1.
     */
    private int findDelimiter(List<MacroPattern> patterns, int from) {
        for (int i = from; i < patterns.size() && !patterns.get(i).isEllipsis(); ++i) {
            if (patterns.get(i).containsLiteral(literals)) {
                return i;
            }

            if (i + 1 < patterns.size() && patterns.get(i + 1).isEllipsis()) {
                break;
            }
        }

        return -1;
    }

    private static int minimumArity(List<MacroPattern> patterns, int from) {
        int result = 0;

        for (int i = from; i < patterns.size(); ++i) {
            final boolean repeated = i + 1 < patterns.size() && patterns.get(i + 1).isEllipsis();

            if (!patterns.get(i).isEllipsis() && !repeated) {
                ++result;
            }
        }

        return result;
    }

    private static SrcPos span(List<Cst> args, SrcPos fallback) {
        if (args.isEmpty()) {
            return fallback;
        }

        return args.get(0).pos().to(args.get(args.size() - 1).pos());
    }

    @RequiredArgsConstructor
    private class TreeMatcher implements CstVisitor<Map<String, Binding>> {

        private final MacroPattern pattern;

        @Override
        public Map<String, Binding> visitIdent(Cst.Ident ident) {
            if (pattern instanceof MacroPattern.Ident pi && pi.isLiteral(literals)) {
                return pi.name().equals(ident.name()) ? Map.of() : null;
            }

            return bindVariable(ident);
        }

        @Override
        public Map<String, Binding> visitSExpr(Cst.SExpr sexpr) {
            if (pattern instanceof MacroPattern.SExpr ps) {
                return matchAll(ps.elements(), sexpr.elements(), sexpr.pos());
            }

            return bindVariable(sexpr);
        }

        @Override
        public Map<String, Binding> visitList(Cst.ListForm list) {
            if (pattern instanceof MacroPattern.ListForm pl) {
                return matchAll(pl.elements(), list.elements(), list.pos());
            }

            return bindVariable(list);
        }

        @Override
        public Map<String, Binding> visitLiteral(Cst.Literal literal) {
            return bindVariable(literal);
        }

        private Map<String, Binding> bindVariable(Cst tree) {
            return pattern.accept(new PatternVisitor<Map<String, Binding>>() {

                @Override
                public Map<String, Binding> visitIdent(MacroPattern.Ident ident) {
                    if (ident.isLiteral(literals)) {
                        return null;
                    }

                    return Map.of(ident.name(), new Binding.Single(tree));
                }

                @Override
                public Map<String, Binding> visitSExpr(MacroPattern.SExpr sexpr) {
                    return null;
                }

                @Override
                public Map<String, Binding> visitList(MacroPattern.ListForm list) {
                    return null;
                }
            });
        }
    }
}
