package ru.byprogminer.lispmacros.syntax;

public interface CstVisitor<R> {

    R visitIdent(Cst.Ident ident);

    R visitSExpr(Cst.SExpr sexpr);

    R visitList(Cst.ListForm list);

    R visitLiteral(Cst.Literal literal);
}
