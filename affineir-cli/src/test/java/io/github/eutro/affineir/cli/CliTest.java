package io.github.eutro.affineir.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {
    private static final String FOLDABLE = "func @f() -> index {\n"
            + "  %c = constant 2 : index\n"
            + "  %a = affine.apply affine_map<(d0) -> (d0 * 3)>(%c)\n"
            + "  return %a : index\n"
            + "}\n";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return Cli.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testHelp() {
        assertEquals(0, run("", "--help"));
        assertTrue(out().startsWith("usage: affineir-opt"));
        assertEquals("", err());
    }

    @Test
    void testBadArguments() {
        assertEquals(1, run("", "--frobnicate", "-"));
        assertEquals("--frobnicate: unknown flag", err().trim());

        err.reset();
        assertEquals(1, run(""));
        assertTrue(err().startsWith("usage: affineir-opt"));

        err.reset();
        assertEquals(1, run("", "-", "other.mlir"));
        assertEquals("other.mlir: input already specified", err().trim());

        err.reset();
        assertEquals(1, run("", "-", "-o"));
        assertEquals("-o: expected file", err().trim());
    }

    @Test
    void testRoundTripFromStdin() {
        assertEquals(0, run(FOLDABLE, "-"));
        String printed = out();
        assertTrue(printed.startsWith("module {\n  func @f() -> index {\n"), printed);
        assertTrue(printed.contains("affine.apply affine_map<(d0) -> (d0 * 3)> (%0)"), printed);
    }

    @Test
    void testCanonicalize() {
        assertEquals(0, run(FOLDABLE, "--canonicalize", "-"));
        String printed = out();
        assertTrue(printed.contains("%0 = constant 6 : index"), printed);
        assertTrue(printed.contains("return %0 : index"), printed);
        assertFalse(printed.contains("affine.apply"), printed);
        assertFalse(printed.contains("constant 2"), printed);
    }

    @Test
    void testGeneric() {
        assertEquals(0, run(FOLDABLE, "--generic", "-"));
        assertTrue(out().contains("\"affine.apply\"(%0) {map = affine_map<(d0) -> (d0 * 3)>} : (index) -> index"),
                out());
    }

    @Test
    void testVerifyOnly() {
        assertEquals(0, run(FOLDABLE, "--verify-only", "--canonicalize", "-"));
        assertEquals("", out());

        assertEquals(1, run("func @f() -> index {\n"
                + "  %a = affine.apply affine_map<(d0) -> (d0 + 1)>(%b)\n"
                + "  %b = constant 1 : index\n"
                + "  return %a : index\n"
                + "}\n", "--verify-only", "-"));
        assertTrue(err().startsWith("<stdin>:"), err());
    }

    @Test
    void testParseError() {
        assertEquals(1, run("func @f() {\n  foo.bar\n}\n", "-"));
        assertEquals("<stdin>:2:3: error: custom op 'foo.bar' is unknown", err().trim());
        assertEquals("", out());
    }

    @Test
    void testFiles(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("in.mlir");
        Path output = dir.resolve("out.mlir");
        Files.write(input, FOLDABLE.getBytes(StandardCharsets.UTF_8));

        assertEquals(0, run("", "--compose", "--dce", input.toString(), "-o", output.toString()));
        assertEquals("", out());
        String written = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertTrue(written.startsWith("module {"), written);

        assertEquals(1, run("", dir.resolve("missing.mlir").toString()));
        assertTrue(err().startsWith("could not read file"), err());
    }
}
