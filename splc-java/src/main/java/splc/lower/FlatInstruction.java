package splc.lower;

import com.google.common.base.Joiner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

public final class FlatInstruction {
    private final List<String> labels = new ArrayList<>();
    private final FlatOpcode opcode;
    private final FlatSlot target;      // ASSIGN only
    private final FlatExpr value;       // assigned value, printed value or condition
    private final String jumpLabel;     // jumps only
    private int line = -1;
    private int jumpLine = -1;
    private boolean frozen;

    private FlatInstruction(FlatOpcode opcode, FlatSlot target, FlatExpr value, String jumpLabel) {
        this.opcode = opcode;
        this.target = target;
        this.value = value;
        this.jumpLabel = jumpLabel;
    }

    public static FlatInstruction assign(FlatSlot target, FlatExpr value) {
        return new FlatInstruction(FlatOpcode.ASSIGN, checkNotNull(target), checkNotNull(value), null);
    }

    public static FlatInstruction print(FlatExpr value) {
        return new FlatInstruction(FlatOpcode.PRINT, null, checkNotNull(value), null);
    }

    public static FlatInstruction jumpIfFalse(FlatExpr condition, String label) {
        return new FlatInstruction(FlatOpcode.JUMP_IF_FALSE, null, checkNotNull(condition), checkNotNull(label));
    }

    public static FlatInstruction jump(String label) {
        return new FlatInstruction(FlatOpcode.JUMP, null, null, checkNotNull(label));
    }

    public static FlatInstruction halt() {
        return new FlatInstruction(FlatOpcode.HALT, null, null, null);
    }

    void addLabel(String label) {
        checkState(!frozen, "Instruction already resolved");
        labels.add(label);
    }

    void assignLine(int line) {
        checkState(!frozen, "Instruction already resolved");
        checkArgument(line > 0, "line must be positive: %s", line);
        this.line = line;
    }

    void resolveJump(int jumpLine) {
        checkState(!frozen, "Instruction already resolved");
        checkState(opcode.isJump(), "%s has no jump target", opcode);
        this.jumpLine = jumpLine;
    }

    void freeze() {
        checkState(line > 0, "No line assigned");
        checkState(!opcode.isJump() || jumpLine > 0, "Jump target not resolved");
        frozen = true;
    }

    public List<String> labels() { return Collections.unmodifiableList(labels); }

    public FlatOpcode opcode() { return opcode; }

    public FlatSlot target() { return target; }

    public FlatExpr value() { return value; }

    public String jumpLabel() { return jumpLabel; }

    // -1 until resolved
    public int line() { return line; }

    // -1 until resolved, and for non-jumps
    public int jumpLine() { return jumpLine; }

    public boolean isResolved() { return frozen; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (line > 0) sb.append(line).append(' ');
        if (!labels.isEmpty()) sb.append('[').append(Joiner.on(", ").join(labels)).append("] ");
        sb.append(opcode);
        if (target != null) sb.append(' ').append(target.name()).append(" =");
        if (value != null) sb.append(' ').append(value);
        if (jumpLabel != null) {
            sb.append(" -> ").append(jumpLabel);
            if (jumpLine > 0) sb.append(" (").append(jumpLine).append(')');
        }
        return sb.toString();
    }
}
