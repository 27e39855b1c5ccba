package ru.byprogminer.lispmacros.macro;

import java.util.Set;

/**
 * Words the expander treats specially regardless of the macro registry.
 */
public final class Keywords {

    public static final String QUOTE = "quote";
    public static final String DEF_MACRO = "def-macro";
    public static final String MACRO_QUOTE = "macro-quote";
    public static final String MACRO_ESCAPE = "macro-escape";
    public static final String ELLIPSIS = "...";

    public static final Set<String> RESERVED = Set.of(QUOTE, DEF_MACRO, MACRO_QUOTE, MACRO_ESCAPE, ELLIPSIS);

    private Keywords() {}
}
