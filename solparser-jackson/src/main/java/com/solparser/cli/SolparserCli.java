package com.solparser.cli;

import com.solparser.InvalidInputException;
import com.solparser.LoweringResult;
import com.solparser.ParseOptions;
import com.solparser.Parser;
import com.solparser.diagnostics.Diagnostic;
import com.solparser.json.AstJsonProvider;
import com.solparser.json.AstJsonSerializer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Command line front end: parses Solidity files (or inline source) and prints the AST as JSON,
 * the diagnostics, or the token list.
 *
 * Usage:
 *   java -cp ... com.solparser.cli.SolparserCli [options] [files...]
 *
 * Options:
 *   --source=TEXT               Parse TEXT instead of (or in addition to) files
 *   --mode=ast|diagnostics|tokens  What to print (default: ast)
 *   --pretty                    Indent JSON output
 *   --threads=N                 Number of worker threads (default: available processors)
 *   --verbose                   Enable debug logging
 *   --help                      Print this help
 *
 * Inputs are parsed in parallel and printed in the order given. Syntax and lowering
 * diagnostics do not change the exit code; only unreadable input or bad options do.
 */
public class SolparserCli {

    public enum Mode {
        AST, DIAGNOSTICS, TOKENS
    }

    private record Input(String name, String source) {
    }

    private final Config config;
    private final PrintStream out;
    private final PrintStream err;
    private final AstJsonSerializer json = AstJsonProvider.load().serializer();

    SolparserCli(Config config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the command line without exiting the JVM.
     *
     * @return the process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        Config config = Config.parse(args, err);
        if (config == null) {
            printUsage(err);
            return 1;
        }
        if (config.help) {
            printUsage(out);
            return 0;
        }
        if (config.verbose) {
            // Read by slf4j-simple when the first logger is created.
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        try {
            return new SolparserCli(config, out, err).execute();
        } catch (InvalidInputException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    int execute() {
        List<Input> inputs = readInputs();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(config.threads, inputs.size())));
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (Input input : inputs) {
                futures.add(executor.submit(() -> render(input, inputs.size() > 1)));
            }
            for (Future<String> future : futures) {
                out.print(future.get());
            }
            out.flush();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return 1;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InvalidInputException invalid) {
                throw invalid;
            }
            err.println("Fatal error: " + cause.getMessage());
            return 1;
        } finally {
            executor.shutdownNow();
        }
    }

    private List<Input> readInputs() {
        List<Input> inputs = new ArrayList<>();
        if (config.source != null) {
            inputs.add(new Input("<source>", config.source));
        }
        for (Path file : config.files) {
            try {
                inputs.add(new Input(file.toString(), Files.readString(file)));
            } catch (IOException e) {
                throw new InvalidInputException("Cannot read " + file + ": " + e.getMessage(), e);
            }
        }
        return inputs;
    }

    private String render(Input input, boolean withHeader) {
        LoweringResult result = Parser.parse(input.source(),
            ParseOptions.defaults().withTokens(config.mode == Mode.TOKENS));
        StringBuilder text = new StringBuilder();
        if (withHeader) {
            text.append("==> ").append(input.name()).append(" <==").append(System.lineSeparator());
        }
        switch (config.mode) {
            case AST -> {
                text.append(json.serialize(result.sourceUnit(), config.pretty));
                text.append(System.lineSeparator());
                reportDiagnostics(input, result);
            }
            case DIAGNOSTICS -> {
                for (Diagnostic diagnostic : result.diagnostics()) {
                    text.append(diagnostic.format()).append(System.lineSeparator());
                }
            }
            case TOKENS -> {
                text.append(json.serializeTokens(result.tokens(), config.pretty)).append(System.lineSeparator());
                reportDiagnostics(input, result);
            }
        }
        return text.toString();
    }

    private void reportDiagnostics(Input input, LoweringResult result) {
        if (!result.hasDiagnostics()) {
            return;
        }
        StringBuilder lines = new StringBuilder();
        for (Diagnostic diagnostic : result.diagnostics()) {
            lines.append(input.name()).append(": ").append(diagnostic.format()).append(System.lineSeparator());
        }
        synchronized (err) {
            err.print(lines);
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: SolparserCli [options] [files...]");
        stream.println();
        stream.println("Options:");
        stream.println("  --source=TEXT                   Parse TEXT as a source unit");
        stream.println("  --mode=ast|diagnostics|tokens   What to print (default: ast)");
        stream.println("  --pretty                        Indent JSON output");
        stream.println("  --threads=N                     Number of worker threads (default: available processors)");
        stream.println("  --verbose, -v                   Enable debug logging");
        stream.println("  --help, -h                      Print this help");
    }

    public static class Config {
        Mode mode = Mode.AST;
        int threads = Runtime.getRuntime().availableProcessors();
        boolean pretty = false;
        boolean verbose = false;
        boolean help = false;
        String source;
        List<Path> files = new ArrayList<>();

        public static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                    return config;
                } else if (arg.startsWith("--mode=")) {
                    String mode = arg.substring(7).toUpperCase();
                    try {
                        config.mode = Mode.valueOf(mode);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid mode: " + arg.substring(7));
                        return null;
                    }
                } else if (arg.startsWith("--threads=")) {
                    try {
                        config.threads = Integer.parseInt(arg.substring(10));
                    } catch (NumberFormatException e) {
                        err.println("Invalid thread count: " + arg.substring(10));
                        return null;
                    }
                    if (config.threads < 1) {
                        err.println("Thread count must be at least 1");
                        return null;
                    }
                } else if (arg.startsWith("--source=")) {
                    config.source = arg.substring(9);
                } else if (arg.equals("--pretty")) {
                    config.pretty = true;
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.files.add(Path.of(arg));
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.source == null && config.files.isEmpty()) {
                err.println("Error: No input specified");
                return null;
            }

            return config;
        }
    }
}
