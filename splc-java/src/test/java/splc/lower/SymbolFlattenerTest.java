package splc.lower;

import org.junit.jupiter.api.Test;
import splc.lower.InstructionNode.Assign;
import splc.lower.InstructionNode.Sequence;
import splc.sema.Declaration;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static splc.lower.LowerFixtures.*;

public class SymbolFlattenerTest {

    private static final String SHADOWING = """
            glob { v }
            proc { p(v) { local { w } w = v; print w } }
            func { }
            main { var { w } v = 1; p(2); p(3); w = v; halt }
            """;

    @Test
    void globals_and_main_variables_get_unit_names() {
        var c = check("glob { a b } proc { } func { } main { var { m } halt }");
        var flattener = new SymbolFlattener(c.table());
        flattener.flatten();

        assertEquals(List.of("GLOBAL_a", "GLOBAL_b", "MAIN_m"), names(flattener.slots()));
        assertEquals(List.of("GLOBAL_a", "GLOBAL_b"), names(flattener.globalSlots()));
        var m = flattener.slotFor(c.table().mainScope().getLocal("m"));
        assertEquals("MAIN", m.owner());
        assertEquals(0, m.instance());
        assertSame(c.table().mainScope().getLocal("m"), m.declaration());
    }

    @Test
    void shadowed_names_never_collide() {
        FlatProgram flat = lower(SHADOWING);
        List<String> names = names(flat.slots());

        assertEquals(names.size(), new HashSet<>(names).size(), names.toString());
        assertTrue(names.containsAll(List.of("GLOBAL_v", "MAIN_w", "P_1_v", "P_1_w", "P_2_v", "P_2_w")),
                names.toString());
    }

    @Test
    void each_copy_gets_its_own_instance_number() {
        FlatProgram flat = lower(SHADOWING);
        FlatSlot first = flat.slot("P_1_v");
        FlatSlot second = flat.slot("P_2_v");

        assertEquals("p", first.owner());
        assertEquals(1, first.instance());
        assertEquals(2, second.instance());
        assertSame(first.declaration(), second.declaration());
        assertEquals(Declaration.Kind.PARAM, first.declaration().kind());
    }

    @Test
    void temporaries_are_upper_case_and_have_no_declaration() {
        FlatProgram flat = lower("""
                glob { } proc { }
                func { f(a) { local { }; return a } }
                main { var { x } x = (x plus f(1)); halt }
                """);
        assertTrue(flat.slot("MAIN_T1").isTemporary());
        assertTrue(flat.slot("F_1_RESULT").isTemporary());
        assertFalse(flat.slot("F_1_a").isTemporary());
    }

    @Test
    void taken_candidate_gets_numeric_suffix() {
        var c = check("glob { } proc { } func { } main { var { } halt }");
        var flattener = new SymbolFlattener(c.table());
        flattener.flatten();
        flattener.register("MAIN_T1");

        FrameSlot temp = new FrameSlot(CallFrame.unit("MAIN"), null, "T");
        var unit = flattener.materialize(Sequence.of(List.of(new Assign(temp, new FlatExpr.Num(1)))));

        var assign = (Assign) ((Sequence) unit).nodes().get(0);
        assertEquals("MAIN_T1_2", ((FlatSlot) assign.target()).name());
    }

    @Test
    void registering_a_name_twice_is_a_defect() {
        var c = check("glob { g } proc { } func { } main { var { } halt }");
        var flattener = new SymbolFlattener(c.table());
        flattener.flatten();

        var e = assertThrows(LoweringDefect.class, () -> flattener.register("GLOBAL_g"));
        assertEquals(ErrorKind.FLAT_NAME_COLLISION, e.kind());
        assertEquals("GLOBAL_g", e.subject());
    }

    @Test
    void global_initialization_zeroes_every_global() {
        var c = check("glob { a b } proc { } func { } main { var { } halt }");
        var flattener = new SymbolFlattener(c.table());
        flattener.flatten();

        var init = (Sequence) flattener.globalInitialization();
        assertEquals(2, init.nodes().size());
        var first = (Assign) init.nodes().get(0);
        assertEquals("GLOBAL_a", ((FlatSlot) first.target()).name());
        assertEquals(new FlatExpr.Num(0), first.value());
    }

    @Test
    void flatten_twice_is_rejected() {
        var flattener = new SymbolFlattener(check("glob { } proc { } func { } main { var { } }").table());
        flattener.flatten();
        assertThrows(IllegalStateException.class, flattener::flatten);
    }
}
