package ru.byprogminer.lispmacros.syntax;

import lombok.NonNull;

import java.util.List;
import java.util.Optional;

/**
 * Concrete syntax tree node.
 */
public sealed interface Cst permits Cst.Ident, Cst.SExpr, Cst.ListForm, Cst.Literal {

    SrcPos pos();

    <R> R accept(CstVisitor<R> visitor);

    /**
     * Copy of this tree with every node tagged with the given expansion site.
     */
    Cst withExpansionSite(SrcPos site);

    default Optional<String> identName() {
        return this instanceof Ident ident ? Optional.of(ident.name()) : Optional.empty();
    }

    default boolean isIdent(String name) {
        return this instanceof Ident ident && ident.name().equals(name);
    }

    default Optional<List<Cst>> children() {
        if (this instanceof SExpr sexpr) {
            return Optional.of(sexpr.elements());
        }

        if (this instanceof ListForm list) {
            return Optional.of(list.elements());
        }

        return Optional.empty();
    }

    private static List<Cst> tagAll(List<Cst> elements, SrcPos site) {
        return elements.stream().map(e -> e.withExpansionSite(site)).toList();
    }

    record Ident(@NonNull String name, @NonNull SrcPos pos) implements Cst {

        @Override
        public <R> R accept(CstVisitor<R> visitor) {
            return visitor.visitIdent(this);
        }

        @Override
        public Ident withExpansionSite(SrcPos site) {
            return new Ident(name, pos.withExpansionSite(site));
        }

        @Override
        public String toString() {
            return CstPrinter.print(this);
        }
    }

    record SExpr(@NonNull List<Cst> elements, @NonNull SrcPos pos) implements Cst {

        public SExpr {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(CstVisitor<R> visitor) {
            return visitor.visitSExpr(this);
        }

        @Override
        public SExpr withExpansionSite(SrcPos site) {
            return new SExpr(tagAll(elements, site), pos.withExpansionSite(site));
        }

        @Override
        public String toString() {
            return CstPrinter.print(this);
        }
    }

    record ListForm(@NonNull List<Cst> elements, @NonNull SrcPos pos) implements Cst {

        public ListForm {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(CstVisitor<R> visitor) {
            return visitor.visitList(this);
        }

        @Override
        public ListForm withExpansionSite(SrcPos site) {
            return new ListForm(tagAll(elements, site), pos.withExpansionSite(site));
        }

        @Override
        public String toString() {
            return CstPrinter.print(this);
        }
    }

    record Literal(@NonNull String text, @NonNull SrcPos pos) implements Cst {

        @Override
        public <R> R accept(CstVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public Literal withExpansionSite(SrcPos site) {
            return new Literal(text, pos.withExpansionSite(site));
        }

        @Override
        public String toString() {
            return CstPrinter.print(this);
        }
    }
}
