package splc.io;

import splc.lower.FlatInstruction;
import splc.lower.FlatProgram;
import splc.lower.FlatSlot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class IntermediateWriter {

    private IntermediateWriter() {}

    public static void write(Path out, FlatProgram program) throws IOException {
        Files.writeString(out, render(program), StandardCharsets.UTF_8);
    }

    public static String render(FlatProgram program) {
        StringBuilder sb = new StringBuilder();
        for (FlatInstruction insn : program.instructions()) {
            for (String label : insn.labels()) sb.append("REM ").append(label).append('\n');
            sb.append(statement(insn)).append('\n');
        }
        return sb.toString();
    }

    private static String statement(FlatInstruction insn) {
        return switch (insn.opcode()) {
            case ASSIGN -> insn.target().name() + " = " + BasicWriter.expr(insn.value(), FlatSlot::name);
            case PRINT -> "PRINT " + BasicWriter.expr(insn.value(), FlatSlot::name);
            case JUMP_IF_FALSE -> "IF NOT " + BasicWriter.parenthesized(insn.value(), FlatSlot::name)
                    + " THEN " + insn.jumpLabel();
            case JUMP -> "GOTO " + insn.jumpLabel();
            case HALT -> "STOP";
        };
    }
}
