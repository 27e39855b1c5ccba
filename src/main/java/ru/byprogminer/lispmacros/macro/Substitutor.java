package ru.byprogminer.lispmacros.macro;

import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import ru.byprogminer.lispmacros.syntax.Cst;
import ru.byprogminer.lispmacros.syntax.CstVisitor;
import ru.byprogminer.lispmacros.syntax.SrcPos;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Instantiates macro templates with the bindings of a matched rule.
 *
 * <p>Substituted values are inserted verbatim and are not searched for
 * further variable references.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class Substitutor {

    @NonNull private final Map<String, Binding> bindings;

    /**
     * Variables that are exhausted in the current ellipsis iteration; their references vanish.
     */
    @NonNull private final Set<String> omitted;

    public Substitutor(Map<String, Binding> bindings) {
        this(bindings, Set.of());
    }

    public Cst substitute(Cst template) {
        final List<Cst> result = new ArrayList<>(1);

        substituteInto(template, result);

        if (result.size() != 1) {
            throw new MacroEngineError("template " + template + " substituted to " + result.size() + " trees");
        }

        return result.get(0);
    }

    private void substituteInto(Cst template, List<Cst> out) {
        template.accept(new CstVisitor<Void>() {

            @Override
            public Void visitIdent(Cst.Ident ident) {
                if (omitted.contains(ident.name())) {
                    return null;
                }

                final Binding binding = bindings.get(ident.name());
                out.add(binding != null ? binding.toCst() : ident);
                return null;
            }

            @Override
            public Void visitSExpr(Cst.SExpr sexpr) {
                out.add(substituteForm(sexpr.elements(), sexpr.pos(), Cst.SExpr::new));
                return null;
            }

            @Override
            public Void visitList(Cst.ListForm list) {
                out.add(substituteForm(list.elements(), list.pos(), Cst.ListForm::new));
                return null;
            }

            @Override
            public Void visitLiteral(Cst.Literal literal) {
                out.add(literal);
                return null;
            }
        });
    }

    private Cst substituteForm(List<Cst> elements, SrcPos pos, BiFunction<List<Cst>, SrcPos, Cst> rebuild) {
        if (!elements.isEmpty() && elements.get(0).isIdent(Keywords.MACRO_QUOTE)) {
            if (elements.size() != 2) {
                throw new MacroException(MacroException.Kind.ARITY_MISMATCH, pos,
                        "Arity mismatch in `" + Keywords.MACRO_QUOTE + "`. Expected 1, found " + (elements.size() - 1));
            }

            return elements.get(1);
        }

        final List<Cst> result = new ArrayList<>(elements.size());

        for (int i = 0, size = elements.size(); i < size; ++i) {
            final Cst element = elements.get(i);

            if (element.isIdent(Keywords.ELLIPSIS)) {
                continue;
            }

            if (i + 1 < size && elements.get(i + 1).isIdent(Keywords.ELLIPSIS)) {
                flatten(element, result);
            } else {
                substituteInto(element, result);
            }
        }

        return rebuild.apply(result, pos);
    }

    /**
     * Instantiates {@code template} once per item of the longest sequence
     * variable it references, splicing the results into {@code out}.
     *
     * <pre>
     * (c1 and c2) ... ; c1 is [1 2 3], c2 is [a b c]
     * ; expands to
     * (1 and a) (2 and b) (3 and c)
     * </pre>
     */
    private void flatten(Cst template, List<Cst> out) {
        final OptionalInt max = maxSequenceLength(template);

        if (max.isEmpty()) {
            throw new MacroException(MacroException.Kind.EMPTY_SEQUENCE_FLATTEN, template.pos(),
                    "`" + template + "` is followed by `" + Keywords.ELLIPSIS
                            + "` but contains no sequence variables");
        }

        for (int i = 0; i < max.getAsInt(); ++i) {
            final Map<String, Binding> iteration = new HashMap<>(bindings);
            final Set<String> exhausted = new HashSet<>(omitted);

            for (final Map.Entry<String, Binding> e : bindings.entrySet()) {
                if (e.getValue() instanceof Binding.Sequence seq) {
                    if (seq.size() == 0) {
                        iteration.remove(e.getKey());
                        exhausted.add(e.getKey());
                    } else {
                        iteration.put(e.getKey(), seq.itemFor(i));
                    }
                }
            }

            new Substitutor(iteration, exhausted).substituteInto(template, out);
        }
    }

    private OptionalInt maxSequenceLength(Cst template) {
        if (template instanceof Cst.Ident ident) {
            if (bindings.get(ident.name()) instanceof Binding.Sequence seq) {
                return OptionalInt.of(seq.size());
            }

            return OptionalInt.empty();
        }

        final List<Cst> elements = template.children().orElse(List.of());
        if (!elements.isEmpty() && elements.get(0).isIdent(Keywords.MACRO_QUOTE)) {
            return OptionalInt.empty();
        }

        return elements.stream()
                .map(this::maxSequenceLength)
                .filter(OptionalInt::isPresent)
                .mapToInt(OptionalInt::getAsInt)
                .max();
    }
}
