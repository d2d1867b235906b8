package splc.lower;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import splc.CompilerOptions;
import splc.lower.InstructionNode.InlinedCall;
import splc.lower.InstructionNode.Sequence;
import splc.runtime.ExecutionResult;
import splc.runtime.FlatMachine;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static splc.lower.LowerFixtures.*;

public class InlinerTest {

    @Test
    void call_sites_use_disjoint_slots() {
        String src = """
                glob { g }
                proc { keep(v) { local { s } s = v; g = (g plus s) } }
                func { }
                main { var { } keep(3); keep(4); halt }
                """;
        FlatProgram flat = lower(src);

        Set<String> first = new HashSet<>();
        Set<String> second = new HashSet<>();
        for (FlatSlot s : flat.slots()) {
            if (s.owner().equals("keep") && s.instance() == 1) first.add(s.name());
            if (s.owner().equals("keep") && s.instance() == 2) second.add(s.name());
        }
        assertEquals(Set.of("KEEP_1_v", "KEEP_1_s"), first);
        assertEquals(Set.of("KEEP_2_v", "KEEP_2_s"), second);

        ExecutionResult r = new FlatMachine(100).run(flat);
        assertEquals(3, r.valueOf("KEEP_1_s"));
        assertEquals(4, r.valueOf("KEEP_2_s"));
        assertEquals(7, r.valueOf("GLOBAL_g"));
    }

    @Test
    void copies_of_a_function_return_independent_values() {
        ExecutionResult r = run("""
                glob { } proc { }
                func { inc(a) { local { b }; b = (a plus 1); return b } }
                main { var { x y } x = inc(1); y = inc(10); halt }
                """);
        assertEquals(2, r.valueOf("MAIN_x"));
        assertEquals(11, r.valueOf("MAIN_y"));
        assertEquals(2, r.valueOf("INC_1_b"));
        assertEquals(11, r.valueOf("INC_2_b"));
    }

    @Test
    void arguments_are_evaluated_left_to_right() {
        ExecutionResult r = run("""
                glob { g } proc { }
                func {
                  bump(k) { local { }; g = (g plus k); return g }
                  pair(a b) { local { }; return ((a mult 10) plus b) }
                }
                main { var { r } g = 1; r = pair(bump(1) bump(5)); halt }
                """);
        // bump(1) sees g = 1 and yields 2, then bump(5) yields 7
        assertEquals(27, r.valueOf("MAIN_r"));
        assertEquals(7, r.valueOf("GLOBAL_g"));
    }

    @Test
    void left_operand_is_read_before_calls_in_the_right_operand() {
        ExecutionResult r = run("""
                glob { g } proc { }
                func { bump(k) { local { }; g = (g plus k); return g } }
                main { var { r } g = 1; r = (g plus bump(5)); halt }
                """);
        assertEquals(7, r.valueOf("MAIN_r"));
        assertEquals(1, r.valueOf("MAIN_T1"));
    }

    @Test
    void parameter_is_assigned_before_inlined_body() {
        FlatProgram flat = lower("""
                glob { c } proc { }
                func { double(n) { local { }; return (n plus n) } }
                main { var { x } x = 5; c = double(x); halt }
                """);
        int param = indexOfAssignTo(flat, "DOUBLE_1_n");
        int result = indexOfAssignTo(flat, "DOUBLE_1_RESULT");
        int use = indexOfAssignTo(flat, "GLOBAL_c", 1);
        assertTrue(param < result && result < use, flat.instructions().toString());
        assertEquals(new FlatExpr.Ref(flat.slot("DOUBLE_1_RESULT")), flat.get(use).value());
    }

    @Test
    void nested_calls_are_inlined_innermost_first() {
        ExecutionResult r = run("""
                glob { } proc { }
                func {
                  sq(a) { local { }; return (a mult a) }
                  sumsq(a b) { local { }; return (sq(a) plus sq(b)) }
                }
                main { var { x } x = sumsq(3 4); print x }
                """);
        assertEquals(List.of("25"), r.output());
    }

    @Test
    void call_in_while_condition_runs_before_every_test() {
        ExecutionResult r = run("""
                glob { n } proc { }
                func { left(a) { local { }; n = (n minus a); return n } }
                main { var { c } n = 3; while (left(1) > 0) { c = (c plus 1) }; halt }
                """);
        assertEquals(2, r.valueOf("MAIN_c"));
        assertEquals(0, r.valueOf("GLOBAL_n"));
    }

    @Test
    void call_in_until_condition_runs_after_every_body() {
        ExecutionResult r = run("""
                glob { n } proc { }
                func { next(a) { local { }; n = (n plus a); return n } }
                main { var { c } do { c = (c plus 1) } until (next(2) > 5) }
                """);
        assertEquals(3, r.valueOf("MAIN_c"));
        assertEquals(6, r.valueOf("GLOBAL_n"));
    }

    @Test
    void halt_inside_procedure_stops_the_program() {
        ExecutionResult r = run("""
                glob { } proc { stop() { local { } print "bye"; halt } }
                func { }
                main { var { } stop(); print "never" }
                """);
        assertEquals(List.of("bye"), r.output());
    }

    @Test
    void inlined_tree_marks_each_copy() {
        var c = check("""
                glob { } proc { p() { local { } halt } }
                func { }
                main { var { } p(); p() }
                """);
        var flattener = new SymbolFlattener(c.table());
        flattener.flatten();
        var graph = new CallGraphBuilder(c.table()).build();
        var inliner = new Inliner(c.table(), flattener, 64);
        var main = (Sequence) inliner.inline(c.program().main(), graph);

        var first = assertInstanceOf(InlinedCall.class, main.nodes().get(0));
        var second = assertInstanceOf(InlinedCall.class, main.nodes().get(1));
        assertEquals("p", first.callee());
        assertEquals(1, first.depth());
        assertNotSame(first.frame(), second.frame());
        assertNotSame(inliner.expanded("p").frame(), first.frame());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 8})
    void chain_at_the_ceiling_is_inlined(int n) {
        FlatProgram flat = lower(chain(n), CompilerOptions.defaults().withMaxInlineDepth(8));
        ExecutionResult r = new FlatMachine(10_000).run(flat);
        assertEquals(n, r.valueOf("MAIN_r"));
        assertEquals(n, flat.inlinedCallSites());
    }

    @ParameterizedTest
    @ValueSource(ints = {9, 12})
    void chain_above_the_ceiling_is_rejected(int n) {
        var e = assertThrows(LoweringException.class,
                () -> lower(chain(n), CompilerOptions.defaults().withMaxInlineDepth(8)));
        assertEquals(ErrorKind.INLINING_DEPTH_EXCEEDED, e.kind());
        assertTrue(e.getMessage().contains("exceeds the maximum of 8"), e.getMessage());
    }

    @Test
    void default_ceiling_is_sixty_four() {
        assertDoesNotThrow(() -> lower(chain(64)));
        var e = assertThrows(LoweringException.class, () -> lower(chain(65)));
        assertEquals(ErrorKind.INLINING_DEPTH_EXCEEDED, e.kind());
        assertEquals("f1", e.subject());
    }

    private static int indexOfAssignTo(FlatProgram flat, String slot) {
        return indexOfAssignTo(flat, slot, 0);
    }

    /** Index of the {@code skip}+1-th assignment to {@code slot}. */
    private static int indexOfAssignTo(FlatProgram flat, String slot, int skip) {
        for (int i = 0; i < flat.size(); i++) {
            FlatInstruction insn = flat.get(i);
            if (insn.opcode() == FlatOpcode.ASSIGN && insn.target().name().equals(slot) && skip-- == 0) return i;
        }
        return fail("no assignment to " + slot);
    }
}
