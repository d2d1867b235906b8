package splc.cli;

import splc.CompilerOptions;
import splc.io.BasicWriter;
import splc.io.IntermediateWriter;
import splc.lexer.Lexer;
import splc.lexer.LexerException;
import splc.lower.LoweringException;
import splc.lower.LoweringPipeline;
import splc.parser.ParseException;
import splc.parser.Parser;
import splc.runtime.ExecutionException;
import splc.runtime.ExecutionResult;
import splc.runtime.FlatMachine;
import splc.sema.ScopeAnalyzer;
import splc.sema.SemanticException;
import splc.sema.TypeChecker;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.LogManager;

public final class Main {
    static final int OK = 0;
    static final int COMPILE_ERROR = 1;
    static final int USAGE_ERROR = 2;

    private static final String USAGE = "Usage: splc <input.spl> [output.bas] [options]";

    private static final String HELP = USAGE + """


            Compiles an SPL program into line-numbered BASIC. Every call is inlined.
            The BASIC file goes next to the input unless output.bas is given.

            Options:
              --intermediate <file>    also write the inlined code with symbolic labels
              --run                    execute the program after compiling
              --verbose                log every compiler stage
              --quiet                  print errors only
              --max-inline-depth <n>   deepest call chain to inline (default 64)
              --line-start <n>         first line number (default 10)
              --line-step <n>          line number increment (default 10)
              --max-steps <n>          instructions --run may execute (default 1000000)
              --help                   show this message
            """;

    private record Request(Path input, Path output, Path intermediate, CompilerOptions options,
                           boolean execute, boolean quiet) {}

    private final PrintStream out;
    private final PrintStream err;

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new Main(System.out, System.err).run(args));
    }

    int run(String[] args) {
        List<String> positional = new ArrayList<>();
        boolean execute = false;
        boolean verbose = false;
        boolean quiet = false;
        Path intermediate = null;
        CompilerOptions options = CompilerOptions.defaults();
        try {
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--help", "-h" -> {
                        out.print(HELP);
                        return OK;
                    }
                    case "--run" -> execute = true;
                    case "--verbose" -> verbose = true;
                    case "--quiet" -> quiet = true;
                    case "--intermediate" -> intermediate = Path.of(stringArg(args, ++i, a));
                    case "--max-inline-depth" -> options = options.withMaxInlineDepth(intArg(args, ++i, a));
                    case "--line-start" -> options = options.withLineNumbering(intArg(args, ++i, a), options.lineStep());
                    case "--line-step" -> options = options.withLineNumbering(options.lineStart(), intArg(args, ++i, a));
                    case "--max-steps" -> options = options.withMaxSteps(intArg(args, ++i, a));
                    default -> {
                        if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + a);
                        positional.add(a);
                    }
                }
            }
            if (verbose && quiet) {
                throw new IllegalArgumentException("--verbose and --quiet exclude each other");
            }
            if (positional.isEmpty() || positional.size() > 2) {
                throw new IllegalArgumentException("Expected an input file and an optional output file");
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return USAGE_ERROR;
        }

        if (verbose) enableVerboseLogging();

        Path input = Path.of(positional.get(0));
        Path output = positional.size() == 2
                ? Path.of(positional.get(1))
                : Path.of(input.toString().replaceFirst("\\.spl$", "") + ".bas");

        try {
            return compile(new Request(input, output, intermediate, options, execute, quiet));
        } catch (LexerException | ParseException | SemanticException | LoweringException e) {
            err.println("error: " + e.getMessage());
            return COMPILE_ERROR;
        } catch (ExecutionException e) {
            err.println("runtime error: " + e.getMessage());
            return COMPILE_ERROR;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return COMPILE_ERROR;
        }
    }

    private int compile(Request r) throws IOException {
        // 1. Reading
        String source = Files.readString(r.input());
        progress(r, "[1/7] Reading: " + r.input());

        // 2. Lexer
        var tokens = new Lexer(source).tokenize();
        progress(r, "[2/7] Lexer: " + tokens.size() + " tokens");

        // 3. Parser
        var program = new Parser(tokens).parseProgram();
        progress(r, "[3/7] Parser: " + program.procedures().size() + " procedures, "
                + program.functions().size() + " functions");

        // 4. Scopes
        var table = new ScopeAnalyzer().analyze(program);
        progress(r, "[4/7] Scope analysis: OK");

        // 5. Types
        new TypeChecker(table).check(program);
        progress(r, "[5/7] Type checker: OK");

        // 6. Lowering
        var flat = new LoweringPipeline(r.options()).lower(program, table);
        progress(r, "[6/7] Lowering: " + flat.size() + " instructions");

        // 7. Writing
        if (r.intermediate() != null) {
            IntermediateWriter.write(r.intermediate(), flat);
            progress(r, "      Intermediate: " + r.intermediate());
        }
        BasicWriter.write(r.output(), flat);
        progress(r, "[7/7] Writing: " + r.output());

        progress(r, "");
        progress(r, "Success: " + r.output());
        progress(r, "  Instructions:  " + flat.size());
        progress(r, "  Inlined calls: " + flat.inlinedCallSites());
        progress(r, "  Slots:         " + flat.slots().size());

        if (r.execute()) {
            ExecutionResult result = new FlatMachine(r.options().maxSteps()).run(flat);
            progress(r, "");
            for (String line : result.output()) out.println(line);
            progress(r, "(" + result.steps() + " steps)");
        }
        return OK;
    }

    private void progress(Request r, String line) {
        if (!r.quiet()) out.println(line);
    }

    private static String stringArg(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }

    private static int intArg(String[] args, int i, String option) {
        String value = stringArg(args, i, option);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number for " + option + ": " + value, e);
        }
    }

    private void enableVerboseLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/splc-logging.properties")) {
            if (in == null) {
                err.println("warning: splc-logging.properties not found, logging unchanged");
                return;
            }
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            err.println("warning: could not load logging configuration: " + e.getMessage());
        }
    }
}
