package splc.lower;

import org.junit.jupiter.api.Test;
import splc.CompilerOptions;
import splc.runtime.ExecutionResult;
import splc.runtime.FlatMachine;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static splc.lower.LowerFixtures.*;

public class LoweringPipelineTest {

    private static final String SCENARIO = """
            glob { c }
            proc { show() { local { } print c } }
            func { double(n) { local { }; return (n plus n) } }
            main { var { x } x = 5; c = double(x); show(); halt }
            """;

    @Test
    void scenario_lowers_to_straight_line_code() {
        FlatProgram flat = lower(SCENARIO);

        assertEquals(List.of(
                "10 ASSIGN GLOBAL_c = 0",
                "20 ASSIGN MAIN_x = 5",
                "30 ASSIGN DOUBLE_1_n = MAIN_x",
                "40 ASSIGN DOUBLE_1_RESULT = (DOUBLE_1_n ADD DOUBLE_1_n)",
                "50 ASSIGN GLOBAL_c = DOUBLE_1_RESULT",
                "60 PRINT GLOBAL_c",
                "70 HALT"
        ), flat.instructions().stream().map(FlatInstruction::toString).toList());
        assertEquals(2, flat.inlinedCallSites());
        assertEquals(0, flat.labels().size());
    }

    @Test
    void scenario_prints_the_doubled_value() {
        FlatProgram flat = lower(SCENARIO);
        ExecutionResult r = new FlatMachine(100).run(flat);

        assertEquals(List.of("10"), r.output());
        assertEquals(10, r.valueOf("GLOBAL_c"));
        assertEquals(7, r.steps());

        FlatInstruction print = flat.get(5);
        assertEquals(FlatOpcode.PRINT, print.opcode());
        assertSame(flat.slot("GLOBAL_c"), ((FlatExpr.Ref) print.value()).slot());
    }

    @Test
    void do_until_body_runs_once_when_condition_is_already_true() {
        ExecutionResult r = run("""
                glob { } proc { } func { }
                main { var { c } c = 5; do { c = (c plus 1) } until (c > 0); halt }
                """);
        assertEquals(6, r.valueOf("MAIN_c"));
    }

    @Test
    void while_body_runs_zero_times_when_condition_is_false() {
        ExecutionResult r = run("""
                glob { } proc { } func { }
                main { var { c } c = 5; while (c > 100) { c = (c plus 1) }; halt }
                """);
        assertEquals(5, r.valueOf("MAIN_c"));
    }

    @Test
    void program_may_fall_off_the_end() {
        FlatProgram flat = lower("glob { } proc { } func { } main { var { x } x = 1 }");
        assertEquals(1, flat.size());
        assertEquals(FlatOpcode.ASSIGN, flat.get(0).opcode());
    }

    @Test
    void line_numbering_follows_options() {
        FlatProgram flat = lower(SCENARIO, CompilerOptions.defaults().withLineNumbering(1, 1));
        assertEquals(1, flat.get(0).line());
        assertEquals(7, flat.get(6).line());
    }

    @Test
    void every_instruction_is_resolved() {
        FlatProgram flat = lower("""
                glob { } proc { } func { }
                main { var { i } while (i > 3) { if (i eq 1) { print i } else { halt } } }
                """);
        for (FlatInstruction insn : flat.instructions()) {
            assertTrue(insn.isResolved(), insn.toString());
            if (insn.opcode().isJump()) assertTrue(insn.jumpLine() > 0, insn.toString());
        }
        assertEquals(FlatOpcode.HALT, flat.get(flat.size() - 1).opcode());
    }

    @Test
    void compilations_do_not_share_state() {
        FlatProgram first = lower(SCENARIO);
        FlatProgram second = lower(SCENARIO);
        assertEquals(
                first.instructions().stream().map(FlatInstruction::toString).toList(),
                second.instructions().stream().map(FlatInstruction::toString).toList());
    }
}
