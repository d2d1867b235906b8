package splc.sema;

import splc.ast.Program;
import splc.lexer.Lexer;
import splc.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class TypeCheckerTest {

    private static final String HEADER = """
            glob { g }
            proc { p(a) { local { } print a } }
            func { f(a) { local { }; return (a plus 1) } }
            """;

    private static void check(String mainBody) {
        Program program = new Parser(new Lexer(HEADER + "main { var { x } " + mainBody + " }").tokenize())
                .parseProgram();
        SymbolTable table = new ScopeAnalyzer().analyze(program);
        new TypeChecker(table).check(program);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x = f(g); p(x); halt",
            "x = (f(1) mult (neg 2))",
            "if ((x > 1) and (not (x eq 3))) { print x } else { print \"no\" }",
            "while (x > 0) { x = (x minus 1) }",
            "do { x = (x div 2) } until ((x eq 0) or (g > x))",
            "p(f(f(x)))"
    })
    void accepts_well_typed_programs(String body) {
        assertDoesNotThrow(() -> check(body));
    }

    @Test
    void rejects_function_called_as_statement() {
        var e = assertThrows(SemanticException.class, () -> check("f(1)"));
        assertTrue(e.getMessage().contains("Function 'f' called as a procedure"), e.getMessage());
    }

    @Test
    void rejects_procedure_used_as_value() {
        var e = assertThrows(SemanticException.class, () -> check("x = p(1)"));
        assertTrue(e.getMessage().contains("Procedure 'p' has no value"), e.getMessage());
    }

    @Test
    void rejects_numeric_condition() {
        var e = assertThrows(SemanticException.class, () -> check("if x { halt }"));
        assertEquals("if condition must be boolean", e.getMessage());
    }

    @Test
    void rejects_boolean_assignment() {
        assertThrows(SemanticException.class, () -> check("x = (x > 1)"));
    }

    @Test
    void rejects_boolean_argument() {
        assertThrows(SemanticException.class, () -> check("x = f((x eq 1))"));
    }

    @Test
    void rejects_arithmetic_on_boolean() {
        assertThrows(SemanticException.class, () -> check("if ((x > 1) plus 1) { halt }"));
    }

    @Test
    void rejects_not_on_number() {
        assertThrows(SemanticException.class, () -> check("while (not x) { halt }"));
    }

    @Test
    void rejects_boolean_return_value() {
        Program program = new Parser(new Lexer("""
                glob { } proc { } func { b(a) { local { }; return (a > 0) } } main { var { } halt }
                """).tokenize()).parseProgram();
        SymbolTable table = new ScopeAnalyzer().analyze(program);
        var e = assertThrows(SemanticException.class, () -> new TypeChecker(table).check(program));
        assertEquals("return value of b must be numeric", e.getMessage());
    }
}
