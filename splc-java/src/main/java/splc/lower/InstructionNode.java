package splc.lower;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkNotNull;

public sealed interface InstructionNode {

    record Sequence(ImmutableList<InstructionNode> nodes) implements InstructionNode {
        public static Sequence of(List<InstructionNode> nodes) {
            return new Sequence(ImmutableList.copyOf(nodes));
        }

        public boolean isEmpty() {
            return nodes.stream().allMatch(n -> n instanceof Sequence s && s.isEmpty());
        }
    }

    record Assign(Storage target, FlatExpr value) implements InstructionNode {}

    record Print(FlatExpr value) implements InstructionNode {}

    record If(FlatExpr condition, InstructionNode then, InstructionNode orElse /* null without else */)
            implements InstructionNode {}

    // prelude runs before every test of condition
    record While(InstructionNode prelude, FlatExpr condition, InstructionNode body) implements InstructionNode {}

    record DoUntil(InstructionNode body, InstructionNode prelude, FlatExpr condition) implements InstructionNode {}

    record Halt() implements InstructionNode {}

    record InlinedCall(String callee, CallFrame frame, int depth, InstructionNode body) implements InstructionNode {
        public InlinedCall {
            checkNotNull(frame, "frame");
        }
    }

    static InstructionNode rename(InstructionNode node, Function<Storage, Storage> slots, UnaryOperator<CallFrame> frames) {
        if (node instanceof Sequence s) {
            ImmutableList.Builder<InstructionNode> out = ImmutableList.builder();
            for (InstructionNode n : s.nodes()) out.add(rename(n, slots, frames));
            return new Sequence(out.build());
        }
        if (node instanceof Assign a) {
            Storage target = slots.apply(a.target());
            return new Assign(target, a.value().rename(slots));
        }
        if (node instanceof Print p) return new Print(p.value().rename(slots));
        if (node instanceof If i) {
            FlatExpr cond = i.condition().rename(slots);
            InstructionNode then = rename(i.then(), slots, frames);
            InstructionNode orElse = i.orElse() == null ? null : rename(i.orElse(), slots, frames);
            return new If(cond, then, orElse);
        }
        if (node instanceof While w) {
            InstructionNode prelude = rename(w.prelude(), slots, frames);
            FlatExpr cond = w.condition().rename(slots);
            return new While(prelude, cond, rename(w.body(), slots, frames));
        }
        if (node instanceof DoUntil d) {
            InstructionNode body = rename(d.body(), slots, frames);
            InstructionNode prelude = rename(d.prelude(), slots, frames);
            return new DoUntil(body, prelude, d.condition().rename(slots));
        }
        if (node instanceof InlinedCall c) {
            CallFrame frame = frames.apply(c.frame());
            return new InlinedCall(c.callee(), frame, c.depth(), rename(c.body(), slots, frames));
        }
        if (node instanceof Halt) return node;
        throw new IllegalStateException("Unknown node: " + node.getClass().getSimpleName());
    }
}
