package ru.byprogminer.lispmacros.reader;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import ru.byprogminer.lispmacros.syntax.Cst;

import java.util.List;

public final class LispReader {

    private LispReader() {}

    /**
     * Reads every top-level form of {@code text}.
     *
     * @throws org.antlr.v4.runtime.misc.ParseCancellationException on a syntax error
     */
    public static List<Cst> read(String text, String sourceName) {
        final LispLexer lexer = new LispLexer(CharStreams.fromString(text, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        final LispParser parser = new LispParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        return new CstBuilder(sourceName).buildProgram(parser.program());
    }
}
