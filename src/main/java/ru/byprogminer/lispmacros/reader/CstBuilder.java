package ru.byprogminer.lispmacros.reader;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import ru.byprogminer.lispmacros.syntax.Cst;
import ru.byprogminer.lispmacros.syntax.SrcPos;

import java.util.List;

@RequiredArgsConstructor
public class CstBuilder extends LispBaseVisitor<Cst> {

    @NonNull private final String sourceName;

    public List<Cst> buildProgram(LispParser.ProgramContext ctx) {
        return forms(ctx.form());
    }

    @Override
    public Cst visitFormIdent(LispParser.FormIdentContext ctx) {
        return new Cst.Ident(ctx.IDENT().getText(), makePos(ctx));
    }

    @Override
    public Cst visitFormSExpr(LispParser.FormSExprContext ctx) {
        return new Cst.SExpr(forms(ctx.form()), makePos(ctx));
    }

    @Override
    public Cst visitFormList(LispParser.FormListContext ctx) {
        return new Cst.ListForm(forms(ctx.form()), makePos(ctx));
    }

    @Override
    public Cst visitFormLiteral(LispParser.FormLiteralContext ctx) {
        return new Cst.Literal(ctx.getText(), makePos(ctx));
    }

    private List<Cst> forms(List<LispParser.FormContext> forms) {
        return forms.stream().map(this::visit).toList();
    }

    private SrcPos makePos(ParserRuleContext ctx) {
        final Token start = ctx.getStart();
        final Token stop = ctx.getStop() != null ? ctx.getStop() : start;

        return new SrcPos(
                sourceName,
                start.getLine(),
                start.getCharPositionInLine() + 1,
                stop.getLine(),
                stop.getCharPositionInLine() + 1 + stop.getText().length(),
                null
        );
    }
}
