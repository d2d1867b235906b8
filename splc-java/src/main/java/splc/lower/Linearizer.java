package splc.lower;

import splc.lower.InstructionNode.Assign;
import splc.lower.InstructionNode.DoUntil;
import splc.lower.InstructionNode.Halt;
import splc.lower.InstructionNode.If;
import splc.lower.InstructionNode.InlinedCall;
import splc.lower.InstructionNode.Print;
import splc.lower.InstructionNode.Sequence;
import splc.lower.InstructionNode.While;

import java.util.List;
import java.util.logging.Logger;

/**
 * Turns the structured tree of one unit into flat instructions with symbolic labels.
 *
 * <pre>
 * if c {T}          jmpF c END; T; END:
 * if c {T} else {E} jmpF c ELSE; T; jmp END; ELSE: E; END:
 * while c {B}       TOP: pre; jmpF c END; B; jmp TOP; END:
 * do {B} until c    TOP: B; pre; jmpF c TOP
 * </pre>
 */
public final class Linearizer {
    private static final Logger LOGGER = Logger.getLogger(Linearizer.class.getName());

    private int inlinedCalls;

    public List<FlatInstruction> linearize(String unit, InstructionNode root) {
        FlatEmitter em = new FlatEmitter(unit);
        emit(em, root);
        List<FlatInstruction> code = em.finish();
        LOGGER.fine(() -> "Linearized " + unit + ": " + code.size() + " instructions");
        return code;
    }

    public int inlinedCalls() {
        return inlinedCalls;
    }

    private void emit(FlatEmitter em, InstructionNode node) {
        if (node instanceof Sequence s) {
            for (InstructionNode n : s.nodes()) emit(em, n);
        } else if (node instanceof Assign a) {
            em.assign(slot(a.target()), a.value());
        } else if (node instanceof Print p) {
            em.print(p.value());
        } else if (node instanceof Halt) {
            em.halt();
        } else if (node instanceof If i) {
            emitIf(em, i);
        } else if (node instanceof While w) {
            Label top = em.newLabel(Label.Kind.TOP);
            Label end = em.newLabel(Label.Kind.END);
            em.bind(top);
            emit(em, w.prelude());
            em.jmpF(w.condition(), end);
            emit(em, w.body());
            em.jmp(top);
            em.bind(end);
        } else if (node instanceof DoUntil d) {
            // loops while the condition is false
            Label top = em.newLabel(Label.Kind.TOP);
            em.bind(top);
            emit(em, d.body());
            emit(em, d.prelude());
            em.jmpF(d.condition(), top);
        } else if (node instanceof InlinedCall c) {
            inlinedCalls++;
            emit(em, c.body());
        } else {
            throw new IllegalStateException("Unknown node: " + node.getClass().getSimpleName());
        }
    }

    private void emitIf(FlatEmitter em, If i) {
        boolean hasElse = i.orElse() != null
                && !(i.orElse() instanceof Sequence s && s.isEmpty());
        if (!hasElse) {
            Label end = em.newLabel(Label.Kind.END);
            em.jmpF(i.condition(), end);
            emit(em, i.then());
            em.bind(end);
            return;
        }

        Label elseLabel = em.newLabel(Label.Kind.ELSE);
        Label end = em.newLabel(Label.Kind.END);
        em.jmpF(i.condition(), elseLabel);
        emit(em, i.then());
        em.jmp(end);
        em.bind(elseLabel);
        emit(em, i.orElse());
        em.bind(end);
    }

    private static FlatSlot slot(Storage s) {
        if (s instanceof FlatSlot slot) return slot;
        throw new IllegalStateException("Unnamed storage reached the linearizer: " + s);
    }
}
