package ru.byprogminer.lispmacros.macro;

import lombok.Getter;
import lombok.NonNull;
import ru.byprogminer.lispmacros.syntax.SrcPos;

/**
 * Fatal diagnostic raised during macro expansion. The first one aborts the pass.
 */
@Getter
public class MacroException extends RuntimeException {

    public enum Kind {
        MALFORMED_DEFINITION,
        MALFORMED_PATTERN,
        AMBIGUOUS_PATTERN,
        DUPLICATE_MACRO_NAME,
        NO_RULE_MATCHED,
        ARITY_MISMATCH,
        EMPTY_SEQUENCE_FLATTEN,
        RECURSION_LIMIT_EXCEEDED,
    }

    private final Kind kind;
    private final SrcPos pos;
    private final String description;

    public MacroException(@NonNull Kind kind, @NonNull SrcPos pos, @NonNull String description) {
        super(pos + ": " + description);

        this.kind = kind;
        this.pos = pos;
        this.description = description;
    }
}
