package splc.lower;

import com.google.common.collect.ImmutableList;
import splc.CompilerOptions;
import splc.ast.Program;
import splc.sema.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public final class LoweringPipeline {
    private static final Logger LOGGER = Logger.getLogger(LoweringPipeline.class.getName());

    private final CompilerOptions options;

    public LoweringPipeline(CompilerOptions options) {
        this.options = options;
    }

    public FlatProgram lower(Program program, SymbolTable table) {
        // 1) flat names for globals and main variables
        SymbolFlattener flattener = new SymbolFlattener(table);
        flattener.flatten();

        // 2) recursion check, before any inlining
        CallGraph graph = new CallGraphBuilder(table).build();

        // 3) inline every call into main, then name the per-copy slots
        InstructionNode main = new Inliner(table, flattener, options.maxInlineDepth())
                .inline(program.main(), graph);
        main = flattener.materialize(main);

        // 4) units: globals initialization, then main
        Linearizer linearizer = new Linearizer();
        List<FlatInstruction> code = new ArrayList<>();
        code.addAll(linearizer.linearize(SymbolFlattener.GLOBAL_UNIT, flattener.globalInitialization()));
        code.addAll(linearizer.linearize(SymbolFlattener.MAIN_UNIT, main));

        // 5) line numbers
        LabelTable labels = new LabelResolver(options.lineStart(), options.lineStep()).resolve(code);

        FlatProgram result = new FlatProgram(ImmutableList.copyOf(code), labels, flattener.slots(),
                linearizer.inlinedCalls());
        LOGGER.fine(() -> "Lowered program: " + result.size() + " instructions, "
                + result.inlinedCallSites() + " inlined call sites");
        return result;
    }
}
