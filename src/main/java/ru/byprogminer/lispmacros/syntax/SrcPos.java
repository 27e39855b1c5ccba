package ru.byprogminer.lispmacros.syntax;

import lombok.NonNull;

/**
 * Span of source text a syntax node was read from.
 *
 * <p>Nodes produced by macro expansion additionally carry the position of the
 * invocation that produced them (the expansion site).
 */
public record SrcPos(
        @NonNull String source,
        int line,
        int column,
        int endLine,
        int endColumn,
        SrcPos expansionSite
) {

    public static SrcPos at(String source, int line, int column) {
        return new SrcPos(source, line, column, line, column, null);
    }

    public static SrcPos synthetic() {
        return at("<synthetic>", 0, 0);
    }

    public SrcPos to(SrcPos other) {
        return new SrcPos(source, line, column, other.endLine, other.endColumn, expansionSite);
    }

    /**
     * Attaches an expansion site. A position that already has one keeps it,
     * so the innermost invocation stays visible.
     */
    public SrcPos withExpansionSite(@NonNull SrcPos site) {
        if (expansionSite != null) {
            return this;
        }

        return new SrcPos(source, line, column, endLine, endColumn, site);
    }

    @Override
    public String toString() {
        final String here = source + ":" + line + ":" + column;

        if (expansionSite == null) {
            return here;
        }

        return here + " (expanded from " + expansionSite + ")";
    }
}
