package ru.byprogminer.lispmacros.macro;

import lombok.NonNull;
import ru.byprogminer.lispmacros.syntax.Cst;
import ru.byprogminer.lispmacros.syntax.SrcPos;

import java.util.List;

/**
 * Value of a pattern variable after a successful match.
 */
public sealed interface Binding permits Binding.Single, Binding.Sequence {

    Cst toCst();

    record Single(@NonNull Cst value) implements Binding {

        @Override
        public Cst toCst() {
            return value;
        }
    }

    /**
     * Matches of a repeated sub-pattern, one item per repetition, in argument order.
     */
    record Sequence(@NonNull List<Binding> items, @NonNull SrcPos pos) implements Binding {

        public Sequence {
            items = List.copyOf(items);
        }

        public int size() {
            return items.size();
        }

        /**
         * Item for iteration {@code i}; a shorter sequence repeats its last item.
         */
        public Binding itemFor(int i) {
            return items.get(Math.min(i, items.size() - 1));
        }

        @Override
        public Cst toCst() {
            return new Cst.ListForm(items.stream().map(Binding::toCst).toList(), pos);
        }
    }
}
