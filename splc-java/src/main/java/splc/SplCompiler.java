package splc;

import splc.ast.Program;
import splc.lexer.Lexer;
import splc.lower.FlatProgram;
import splc.lower.LoweringPipeline;
import splc.parser.Parser;
import splc.sema.ScopeAnalyzer;
import splc.sema.SymbolTable;
import splc.sema.TypeChecker;

import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

public final class SplCompiler {
    private static final Logger LOGGER = Logger.getLogger(SplCompiler.class.getName());

    private final CompilerOptions options;

    public SplCompiler() {
        this(CompilerOptions.defaults());
    }

    public SplCompiler(CompilerOptions options) {
        this.options = checkNotNull(options, "options");
    }

    public CompilerOptions options() {
        return options;
    }

    public FlatProgram compile(String source) {
        checkNotNull(source, "source");
        Program program = new Parser(new Lexer(source).tokenize()).parseProgram();
        SymbolTable table = new ScopeAnalyzer().analyze(program);
        new TypeChecker(table).check(program);
        LOGGER.fine("Front end OK");
        return new LoweringPipeline(options).lower(program, table);
    }
}
