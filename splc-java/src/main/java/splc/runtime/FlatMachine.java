package splc.runtime;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import splc.lower.FlatExpr;
import splc.lower.FlatInstruction;
import splc.lower.FlatProgram;
import splc.lower.FlatSlot;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntSupplier;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

public final class FlatMachine {
    private static final Logger LOGGER = Logger.getLogger(FlatMachine.class.getName());

    private final long maxSteps;

    public FlatMachine(long maxSteps) {
        checkArgument(maxSteps > 0, "maxSteps must be positive: %s", maxSteps);
        this.maxSteps = maxSteps;
    }

    public ExecutionResult run(FlatProgram program) {
        List<FlatInstruction> code = program.instructions();
        Map<Integer, Integer> pcOfLine = new HashMap<>();
        for (int i = 0; i < code.size(); i++) {
            FlatInstruction insn = code.get(i);
            checkArgument(insn.isResolved(), "Unresolved instruction: %s", insn);
            pcOfLine.put(insn.line(), i);
        }

        Map<String, Integer> slots = new LinkedHashMap<>();
        for (FlatSlot s : program.slots()) slots.put(s.name(), 0);
        ImmutableList.Builder<String> output = ImmutableList.builder();

        long steps = 0;
        int pc = 0;
        while (pc < code.size()) {
            FlatInstruction insn = code.get(pc);
            if (++steps > maxSteps) {
                throw new ExecutionException("Step limit of " + maxSteps + " exceeded", insn.line());
            }
            Frame f = new Frame(slots, insn.line());
            switch (insn.opcode()) {
                case ASSIGN -> {
                    slots.put(insn.target().name(), f.num(insn.value()));
                    pc++;
                }
                case PRINT -> {
                    FlatExpr v = insn.value();
                    output.add(v instanceof FlatExpr.Text t ? t.value() : Integer.toString(f.num(v)));
                    pc++;
                }
                case JUMP_IF_FALSE -> pc = f.bool(insn.value()) ? pc + 1 : target(pcOfLine, insn);
                case JUMP -> pc = target(pcOfLine, insn);
                case HALT -> pc = code.size();
            }
        }

        long executed = steps;
        LOGGER.fine(() -> "Executed " + executed + " instructions");
        return new ExecutionResult(output.build(), ImmutableMap.copyOf(slots), steps);
    }

    private static int target(Map<Integer, Integer> pcOfLine, FlatInstruction insn) {
        Integer pc = pcOfLine.get(insn.jumpLine());
        if (pc == null) throw new ExecutionException("Jump to missing line " + insn.jumpLine(), insn.line());
        return pc;
    }

    private record Frame(Map<String, Integer> slots, int line) {

        int num(FlatExpr e) {
            if (e instanceof FlatExpr.Num n) return n.value();
            if (e instanceof FlatExpr.Ref r) return slots.getOrDefault(r.slot().name(), 0);
            if (e instanceof FlatExpr.Unary u && u.op() == FlatExpr.UnOp.NEG) {
                return arithmetic(() -> Math.negateExact(num(u.operand())));
            }
            if (e instanceof FlatExpr.Binary b && !b.op().isComparison() && !b.op().isLogical()) {
                int l = num(b.left());
                int r = num(b.right());
                return switch (b.op()) {
                    case ADD -> arithmetic(() -> Math.addExact(l, r));
                    case SUB -> arithmetic(() -> Math.subtractExact(l, r));
                    case MUL -> arithmetic(() -> Math.multiplyExact(l, r));
                    case DIV -> {
                        if (r == 0) throw new ExecutionException("Division by zero", line);
                        yield arithmetic(() -> l / r);
                    }
                    default -> throw new IllegalStateException("Not arithmetic: " + b.op());
                };
            }
            throw new IllegalStateException("Not a numeric expression: " + e);
        }

        boolean bool(FlatExpr e) {
            if (e instanceof FlatExpr.Unary u && u.op() == FlatExpr.UnOp.NOT) return !bool(u.operand());
            if (e instanceof FlatExpr.Binary b) {
                return switch (b.op()) {
                    case EQ -> num(b.left()) == num(b.right());
                    case GT -> num(b.left()) > num(b.right());
                    case AND -> bool(b.left()) && bool(b.right());
                    case OR -> bool(b.left()) || bool(b.right());
                    default -> throw new IllegalStateException("Not a condition: " + e);
                };
            }
            throw new IllegalStateException("Not a condition: " + e);
        }

        private int arithmetic(IntSupplier op) {
            try {
                return op.getAsInt();
            } catch (ArithmeticException ex) {
                throw new ExecutionException("Integer overflow", line);
            }
        }
    }
}
