package ru.byprogminer.lispmacros;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class MainTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        return Main.run(args, new PrintWriter(out, true), new PrintWriter(err, true));
    }

    @Test
    public void printsExpandedForms(@TempDir Path dir) throws IOException {
        final Path file = dir.resolve("prog.lisp");
        Files.writeString(file, ""
                + "; doubles every argument\n"
                + "(def-macro twice () ((x ...) (do x ... x ...)))\n"
                + "(twice (a) (b))\n"
                + "(quote (twice))\n", StandardCharsets.UTF_8);

        assertThat(run(file.toString()), is(0));
        assertThat(out.toString().lines().toList(), is(List.of("(do (a) (b) (a) (b))", "(quote (twice))")));
        assertThat(err.toString(), is(""));
    }

    @Test
    public void reportsDiagnosticWithPosition(@TempDir Path dir) throws IOException {
        final Path file = dir.resolve("bad.lisp");
        Files.writeString(file, "(def-macro m () (() 1))\n(def-macro m () (() 2))\n", StandardCharsets.UTF_8);

        assertThat(run(file.toString()), is(1));
        assertThat(err.toString(), containsString(file + ":2:1: Duplicate definition of macro `m`"));
    }

    @Test
    public void reportsRunawayExpansion(@TempDir Path dir) throws IOException {
        final Path file = dir.resolve("loop.lisp");
        Files.writeString(file, "(def-macro grow () ((x) (grow (f x))))\n(grow 0)\n", StandardCharsets.UTF_8);

        assertThat(run(file.toString()), is(1));
        assertThat(err.toString(), containsString("nested deeper than 256 levels"));
    }

    @Test
    public void reportsSyntaxError(@TempDir Path dir) throws IOException {
        final Path file = dir.resolve("broken.lisp");
        Files.writeString(file, "(a (b)\n", StandardCharsets.UTF_8);

        assertThat(run(file.toString()), is(1));
        assertThat(err.toString(), containsString(file + ":"));
    }

    @Test
    public void reportsUnreadableFile(@TempDir Path dir) {
        final Path missing = dir.resolve("missing.lisp");

        assertThat(run(missing.toString()), is(1));
        assertThat(err.toString(), containsString("Unable to read file " + missing));
    }

    @Test
    public void requiresExactlyOneArgument() {
        assertThat(run(), is(2));
        assertThat(err.toString(), containsString("Usage"));
    }
}
