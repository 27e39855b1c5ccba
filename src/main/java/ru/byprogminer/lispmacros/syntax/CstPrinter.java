package ru.byprogminer.lispmacros.syntax;

import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public final class CstPrinter implements CstVisitor<Void> {

    private final StringBuilder sb;

    public static String print(Cst tree) {
        final StringBuilder sb = new StringBuilder();

        tree.accept(new CstPrinter(sb));
        return sb.toString();
    }

    public static String print(List<? extends Cst> trees) {
        final StringBuilder sb = new StringBuilder();
        final CstPrinter printer = new CstPrinter(sb);

        printer.printSeq(trees);
        return sb.toString();
    }

    @Override
    public Void visitIdent(Cst.Ident ident) {
        sb.append(ident.name());
        return null;
    }

    @Override
    public Void visitSExpr(Cst.SExpr sexpr) {
        sb.append('(');
        printSeq(sexpr.elements());
        sb.append(')');
        return null;
    }

    @Override
    public Void visitList(Cst.ListForm list) {
        sb.append('[');
        printSeq(list.elements());
        sb.append(']');
        return null;
    }

    @Override
    public Void visitLiteral(Cst.Literal literal) {
        sb.append(literal.text());
        return null;
    }

    private void printSeq(List<? extends Cst> trees) {
        for (int i = 0, size = trees.size(); i < size; ++i) {
            if (i > 0) {
                sb.append(' ');
            }

            trees.get(i).accept(this);
        }
    }
}
