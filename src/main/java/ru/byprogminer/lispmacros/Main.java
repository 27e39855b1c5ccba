package ru.byprogminer.lispmacros;

import org.antlr.v4.runtime.misc.ParseCancellationException;
import ru.byprogminer.lispmacros.macro.ExpansionOptions;
import ru.byprogminer.lispmacros.macro.Expander;
import ru.byprogminer.lispmacros.macro.MacroException;
import ru.byprogminer.lispmacros.reader.LispReader;
import ru.byprogminer.lispmacros.syntax.Cst;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class Main {

    public static void main(String[] args) {
        final PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        final PrintWriter err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);

        System.exit(run(args, out, err));
    }

    public static int run(String[] args, PrintWriter out, PrintWriter err) {
        if (args.length != 1) {
            err.println("Usage: lisp-macros <filename>");
            return 2;
        }

        final String path = args[0];
        final String text;

        try {
            text = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Unable to read file " + path);
            e.printStackTrace(err);
            return 1;
        }

        try {
            final List<Cst> forms = LispReader.read(text, path);
            final Expander expander = new Expander(ExpansionOptions.fromSystemProperties());

            for (final Cst form : expander.expandProgram(forms)) {
                out.println(form);
            }

            return 0;
        } catch (ParseCancellationException e) {
            err.println(path + ":" + e.getMessage());
            return 1;
        } catch (MacroException e) {
            err.println(e.getMessage());
            return 1;
        } finally {
            out.flush();
        }
    }
}
