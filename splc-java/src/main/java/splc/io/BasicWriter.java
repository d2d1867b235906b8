package splc.io;

import splc.lower.FlatExpr;
import splc.lower.FlatInstruction;
import splc.lower.FlatProgram;
import splc.lower.FlatSlot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

public final class BasicWriter {

    private BasicWriter() {}

    // ---- public API ----

    public static void write(Path out, FlatProgram program) throws IOException {
        Files.writeString(out, render(program), StandardCharsets.UTF_8);
    }

    public static String render(FlatProgram program) {
        BasicNames names = BasicNames.of(program);
        StringBuilder sb = new StringBuilder();
        for (FlatInstruction insn : program.instructions()) {
            sb.append(line(insn, names)).append('\n');
        }
        return sb.toString();
    }

    static String line(FlatInstruction insn, BasicNames names) {
        checkArgument(insn.isResolved(), "Unresolved instruction: %s", insn);
        return insn.line() + " " + statement(insn, names);
    }

    // ---- internals ----

    private static String statement(FlatInstruction insn, BasicNames names) {
        return switch (insn.opcode()) {
            case ASSIGN -> names.name(insn.target()) + " = " + expr(insn.value(), names::name);
            case PRINT -> "PRINT " + expr(insn.value(), names::name);
            case JUMP_IF_FALSE -> "IF NOT " + parenthesized(insn.value(), names::name) + " THEN " + insn.jumpLine();
            case JUMP -> "GOTO " + insn.jumpLine();
            case HALT -> "STOP";
        };
    }

    static String expr(FlatExpr e, Function<FlatSlot, String> names) {
        if (e instanceof FlatExpr.Num n) return Integer.toString(n.value());
        if (e instanceof FlatExpr.Text t) return '"' + t.value() + '"';
        if (e instanceof FlatExpr.Ref r) return names.apply(r.slot());
        if (e instanceof FlatExpr.Unary u) {
            return switch (u.op()) {
                case NEG -> "-" + parenthesized(u.operand(), names);
                case NOT -> "NOT " + parenthesized(u.operand(), names);
            };
        }
        if (e instanceof FlatExpr.Binary b) {
            return "(" + expr(b.left(), names) + " " + operator(b.op()) + " " + expr(b.right(), names) + ")";
        }
        throw new IllegalStateException("Unknown expression: " + e.getClass().getSimpleName());
    }

    static String parenthesized(FlatExpr e, Function<FlatSlot, String> names) {
        String s = expr(e, names);
        return e instanceof FlatExpr.Binary ? s : "(" + s + ")";
    }

    private static String operator(FlatExpr.BinOp op) {
        return switch (op) {
            case EQ -> "=";
            case GT -> ">";
            case OR -> "OR";
            case AND -> "AND";
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case DIV -> "\\";
        };
    }
}
