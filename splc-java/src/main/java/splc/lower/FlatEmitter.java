package splc.lower;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;

public final class FlatEmitter {
    private final String unit;
    private final List<FlatInstruction> code = new ArrayList<>();
    private final List<Label> created = new ArrayList<>();
    private final List<String> pending = new ArrayList<>();
    private boolean finished;

    public FlatEmitter(String unit) {
        this.unit = unit;
    }

    public Label newLabel(Label.Kind kind) {
        Label l = new Label(unit + "_" + kind + (created.size() + 1));
        created.add(l);
        return l;
    }

    public void bind(Label l) {
        if (l.bound) throw new IllegalStateException("Label already bound: " + l);
        l.bound = true;
        pending.add(l.name());
    }

    public void emit(FlatInstruction insn) {
        checkState(!finished, "Unit %s already finished", unit);
        for (String name : pending) insn.addLabel(name);
        pending.clear();
        code.add(insn);
    }

    public void assign(FlatSlot target, FlatExpr value) {
        emit(FlatInstruction.assign(target, value));
    }

    public void print(FlatExpr value) {
        emit(FlatInstruction.print(value));
    }

    public void jmp(Label target) {
        emit(FlatInstruction.jump(target.name()));
    }

    public void jmpF(FlatExpr condition, Label target) {
        emit(FlatInstruction.jumpIfFalse(condition, target.name()));
    }

    public void halt() {
        emit(FlatInstruction.halt());
    }

    public List<FlatInstruction> finish() {
        for (Label l : created) {
            LoweringDefect.verify(l.bound, ErrorKind.UNRESOLVED_JUMP_TARGET, l.name(),
                    "label " + l + " never bound in unit " + unit);
        }
        if (!pending.isEmpty()) halt();
        finished = true;
        return code;
    }
}
