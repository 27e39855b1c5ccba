package ru.byprogminer.lispmacros.macro;

public interface PatternVisitor<R> {

    R visitIdent(MacroPattern.Ident ident);

    R visitSExpr(MacroPattern.SExpr sexpr);

    R visitList(MacroPattern.ListForm list);
}
