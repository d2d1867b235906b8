package splc.lower;

import com.google.common.collect.ImmutableList;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

record ExpandedCallable(
        String name,
        CallFrame frame,
        ImmutableList<FrameSlot> params,
        InstructionNode body,
        FrameSlot result,
        int depth,
        String chain
) {

    record Instance(CallFrame frame, ImmutableList<FrameSlot> params, InstructionNode body, FrameSlot result) {}

    Instance instantiate() {
        Map<CallFrame, CallFrame> frames = new HashMap<>();
        Map<FrameSlot, FrameSlot> slots = new HashMap<>();
        Function<CallFrame, CallFrame> freshFrame = f -> frames.computeIfAbsent(f, CallFrame::fresh);
        Function<FrameSlot, FrameSlot> freshSlot = s -> slots.computeIfAbsent(s,
                k -> new FrameSlot(freshFrame.apply(k.frame()), k.origin(), k.baseName()));

        ImmutableList.Builder<FrameSlot> newParams = ImmutableList.builder();
        for (FrameSlot p : params) newParams.add(freshSlot.apply(p));
        FrameSlot newResult = result == null ? null : freshSlot.apply(result);

        InstructionNode newBody = InstructionNode.rename(body,
                s -> s instanceof FrameSlot fs ? freshSlot.apply(fs) : s,
                freshFrame::apply);
        return new Instance(freshFrame.apply(frame), newParams.build(), newBody, newResult);
    }
}
