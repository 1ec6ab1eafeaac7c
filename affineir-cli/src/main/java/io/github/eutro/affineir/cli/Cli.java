package io.github.eutro.affineir.cli;

import io.github.eutro.affineir.asm.AsmParser;
import io.github.eutro.affineir.asm.AsmPrinter;
import io.github.eutro.affineir.asm.ParseException;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.VerificationException;
import io.github.eutro.affineir.ops.IRContext;
import io.github.eutro.affineir.passes.IRPass;
import io.github.eutro.affineir.passes.meta.VerifyPass;
import io.github.eutro.affineir.passes.opts.Canonicalize;
import io.github.eutro.affineir.passes.opts.ComposeAffineApplies;
import io.github.eutro.affineir.passes.opts.EliminateDeadOps;
import org.jetbrains.annotations.Nullable;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * {@code affineir-opt}: reads IR in textual form, verifies it, runs the requested passes in the order given,
 * verifies the result and prints it.
 */
public class Cli {
    private static final Logger LOGGER = Logger.getLogger(Cli.class.getName());

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.in, System.out, System.err));
    }

    private static void configureLogging() {
        try (InputStream stream = Cli.class.getResourceAsStream("/logging.properties")) {
            if (stream != null) LogManager.getLogManager().readConfiguration(stream);
        } catch (IOException e) {
            System.err.println("could not read logging configuration: " + e);
        }
    }

    private static void setVerbose() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    /**
     * Run the tool.
     *
     * @param args The command line arguments.
     * @param in   Read when the input file is {@code -}.
     * @param out  Where the IR is printed, unless an output file is given.
     * @param err  Where errors and usage are printed.
     * @return The exit code.
     */
    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        @Nullable String input = null;
        @Nullable Path output = null;
        boolean generic = false;
        boolean verifyOnly = false;
        boolean suppressFlags = false;
        List<IRPass<Operation, Operation>> passes = new ArrayList<>();
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-") && !arg.equals("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp(out);
                        return 0;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            err.printf("%s: expected file%n", arg);
                            return 1;
                        }
                        if (output != null) {
                            err.printf("%s: output already specified%n", arg);
                            return 1;
                        }
                        output = Paths.get(args[i++]);
                        break;
                    case "--canonicalize":
                        passes.add(Canonicalize.INSTANCE);
                        break;
                    case "--dce":
                        passes.add(EliminateDeadOps.INSTANCE);
                        break;
                    case "--compose":
                        passes.add(ComposeAffineApplies.INSTANCE);
                        break;
                    case "--generic":
                        generic = true;
                        break;
                    case "--verify-only":
                        verifyOnly = true;
                        break;
                    case "-v":
                    case "--verbose":
                        setVerbose();
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            if (input != null) {
                err.printf("%s: input already specified%n", arg);
                return 1;
            }
            input = arg;
        }
        if (input == null) {
            printHelp(err);
            return 1;
        }

        String fileName = input.equals("-") ? "<stdin>" : input;
        String source;
        try {
            source = input.equals("-")
                    ? new String(readAll(in), StandardCharsets.UTF_8)
                    : new String(Files.readAllBytes(Paths.get(input)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.printf("could not read file %s: %s%n", input, e);
            return 1;
        }

        Operation module;
        try {
            module = AsmParser.parseModule(source, fileName, IRContext.withDefaultDialects()).getOperation();
        } catch (ParseException e) {
            err.println(e.getDiagnostic());
            return 1;
        }

        IRPass<Operation, Operation> pipeline = VerifyPass.INSTANCE;
        if (!verifyOnly) {
            for (IRPass<Operation, Operation> pass : passes) {
                pipeline = pipeline.then(pass);
            }
            if (!passes.isEmpty()) pipeline = pipeline.then(VerifyPass.INSTANCE);
        }
        try {
            module = pipeline.run(module);
        } catch (VerificationException e) {
            err.println(e.getDiagnostic());
            return 1;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "passes failed on " + fileName, e);
            err.printf("internal error: %s%n", e);
            return 1;
        }
        LOGGER.fine(() -> "ran " + passes.size() + " passes on " + fileName);
        if (verifyOnly) return 0;

        String printed = AsmPrinter.printToString(module, generic);
        if (output == null) {
            out.print(printed);
            out.flush();
            return 0;
        }
        Path outputPath = output;
        try {
            Files.write(outputPath, printed.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            err.printf("could not write file %s: %s%n", outputPath, e);
            return 1;
        }
        LOGGER.info(() -> "wrote " + outputPath);
        return 0;
    }

    private static byte[] readAll(InputStream in) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        int read;
        while ((read = in.read(buf)) != -1) {
            bytes.write(buf, 0, read);
        }
        return bytes.toByteArray();
    }

    private static void printHelp(PrintStream stream) {
        stream.println(
                "usage: affineir-opt [options] <file>|-\n" +
                        "\n" +
                        "  <file>|- : the IR to read, - for standard input\n" +
                        "  -o|--output <file> : write the IR to <file> instead of standard output\n" +
                        "  --canonicalize : fold and apply canonicalization patterns\n" +
                        "  --dce : erase unused pure operations\n" +
                        "  --compose : fully compose affine.apply chains into their users\n" +
                        "  --generic : print every operation in the generic form\n" +
                        "  --verify-only : only verify the input, printing nothing\n" +
                        "  -v|--verbose : log passes and rewrites\n" +
                        "  -h|--help : show this help"
        );
    }
}
