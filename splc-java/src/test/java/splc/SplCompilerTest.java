package splc;

import org.junit.jupiter.api.Test;
import splc.lexer.LexerException;
import splc.lower.ErrorKind;
import splc.lower.FlatOpcode;
import splc.lower.LoweringException;
import splc.parser.ParseException;
import splc.sema.SemanticException;

import static org.junit.jupiter.api.Assertions.*;

public class SplCompilerTest {

    private final SplCompiler compiler = new SplCompiler();

    @Test
    void compiles_scenario() {
        var flat = compiler.compile("""
                glob { c }
                proc { show() { local { } print c } }
                func { double(n) { local { }; return (n plus n) } }
                main { var { x } x = 5; c = double(x); show(); halt }
                """);
        assertEquals(7, flat.size());
        assertEquals(FlatOpcode.HALT, flat.get(6).opcode());
    }

    @Test
    void each_stage_reports_its_own_error() {
        assertThrows(LexerException.class, () -> compiler.compile("glob { $ }"));
        assertThrows(ParseException.class, () -> compiler.compile("glob { } proc { }"));
        assertThrows(SemanticException.class,
                () -> compiler.compile("glob { } proc { } func { } main { var { } x = 1 }"));
        var e = assertThrows(LoweringException.class, () -> compiler.compile(
                "glob { } proc { p() { local { } p() } } func { } main { var { } halt }"));
        assertEquals(ErrorKind.RECURSIVE_DEFINITION, e.kind());
    }

    @Test
    void options_are_applied() {
        var custom = new SplCompiler(CompilerOptions.defaults().withLineNumbering(5, 5));
        var flat = custom.compile("glob { } proc { } func { } main { var { } halt }");
        assertEquals(5, flat.get(0).line());
        assertEquals(5, custom.options().lineStart());
    }
}
