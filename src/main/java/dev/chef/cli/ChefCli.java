package dev.chef.cli;

import ch.qos.logback.classic.Level;
import dev.chef.engine.ChefBuildException;
import dev.chef.engine.ChefRuntimeException;
import dev.chef.engine.ChefSyntaxException;
import dev.chef.engine.Kitchen;
import dev.chef.engine.ProgramLoader;
import dev.chef.engine.ProgramSerializer;
import dev.chef.io.InputSource;
import dev.chef.io.ReaderInputSource;
import dev.chef.io.WriterOutputSink;
import dev.chef.model.KitchenLimits;
import dev.chef.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line entry point: cook a recipe file.
 */
@Command(
    name = "chef",
    mixinStandardHelpOptions = true,
    description = "Run a program written in the Chef recipe language."
)
public class ChefCli implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_IO_ERROR = 1;
    public static final int EXIT_SYNTAX_ERROR = 2;
    public static final int EXIT_BUILD_ERROR = 3;
    public static final int EXIT_RUNTIME_ERROR = 4;

    private static final Logger LOG = LoggerFactory.getLogger(ChefCli.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Recipe file to cook")
    private Path recipeFile;

    @Option(names = {"-i", "--input"}, description = "File of whitespace-separated integers for the refrigerator (default: standard input)")
    private Path inputFile;

    @Option(names = "--dump", description = "Print the built program as JSON instead of cooking it")
    private boolean dump;

    @Option(names = "--seed", description = "Seed for mixing bowls that are mixed well")
    private Long seed;

    @Option(names = "--max-call-depth", description = "Limit on nested 'Serve with' calls (default: ${DEFAULT-VALUE})",
        defaultValue = "" + KitchenLimits.DEFAULT_MAX_CALL_DEPTH)
    private int maxCallDepth;

    @Option(names = "--max-steps", description = "Give up after this many steps (default: unlimited)")
    private Long maxSteps;

    @Option(names = {"-v", "--verbose"}, description = "Log parsing, loop resolution and recipe calls")
    private boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        validateLimits();
        if (verbose) {
            var root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.chef");
            root.setLevel(Level.DEBUG);
        }

        Program program;
        try {
            program = ProgramLoader.loadFromFile(recipeFile);
        } catch (IOException e) {
            err.println("Error: cannot read " + recipeFile + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        } catch (ChefSyntaxException e) {
            err.println("Syntax error: " + e.getMessage());
            return EXIT_SYNTAX_ERROR;
        } catch (ChefBuildException e) {
            err.println("Build error: " + e.getMessage());
            return EXIT_BUILD_ERROR;
        }

        if (dump) {
            out.println(ProgramSerializer.toJson(program));
            out.flush();
            return EXIT_OK;
        }

        KitchenLimits limits = KitchenLimits.defaults()
            .withMaxCallDepth(maxCallDepth)
            .withSeed(seed);
        if (maxSteps != null) {
            limits = limits.withMaxSteps(maxSteps);
        }

        try (Reader reader = openInput()) {
            InputSource input = new ReaderInputSource(reader);
            new Kitchen(limits).run(program, input, new WriterOutputSink(out));
        } catch (IOException e) {
            err.println("Error: cannot read " + inputName() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        } catch (UncheckedIOException e) {
            out.println();
            out.flush();
            err.println("Error: cannot read " + inputName() + ": " + e.getCause().getMessage());
            return EXIT_IO_ERROR;
        } catch (ChefRuntimeException e) {
            out.println();
            out.flush();
            LOG.debug("Run failed", e);
            err.println("Runtime error: " + e.getMessage());
            return EXIT_RUNTIME_ERROR;
        }
        out.println();
        out.flush();
        return EXIT_OK;
    }

    /** Range checks for the limit options, reported by picocli as usage errors. */
    private void validateLimits() {
        if (maxCallDepth < 1) {
            throw new ParameterException(spec.commandLine(),
                "--max-call-depth must be at least 1, not " + maxCallDepth);
        }
        if (maxSteps != null && maxSteps < 0) {
            throw new ParameterException(spec.commandLine(),
                "--max-steps must not be negative, not " + maxSteps);
        }
    }

    private String inputName() {
        return inputFile == null ? "standard input" : inputFile.toString();
    }

    private Reader openInput() throws IOException {
        if (inputFile == null) {
            // Closing this reader must not close System.in for the caller.
            return new InputStreamReader(new NonClosingInputStream(System.in), StandardCharsets.UTF_8);
        }
        return Files.newBufferedReader(inputFile, StandardCharsets.UTF_8);
    }

    private static final class NonClosingInputStream extends FilterInputStream {
        NonClosingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() {
            // keep the underlying stream open
        }
    }
}
