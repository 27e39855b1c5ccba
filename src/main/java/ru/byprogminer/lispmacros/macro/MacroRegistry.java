package ru.byprogminer.lispmacros.macro;

import lombok.NoArgsConstructor;
import ru.byprogminer.lispmacros.syntax.SrcPos;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Macros defined so far in one expansion pass. A single flat namespace.
 */
@NoArgsConstructor
public class MacroRegistry {

    private final Map<String, Macro> macros = new HashMap<>();

    /**
     * @throws MacroException if a macro with the same name is already defined
     */
    public void define(Macro macro, SrcPos pos) {
        if (macros.putIfAbsent(macro.name(), macro) != null) {
            throw new MacroException(MacroException.Kind.DUPLICATE_MACRO_NAME, pos,
                    "Duplicate definition of macro `" + macro.name() + "`");
        }
    }

    public Optional<Macro> lookup(String name) {
        return Optional.ofNullable(macros.get(name));
    }
}
