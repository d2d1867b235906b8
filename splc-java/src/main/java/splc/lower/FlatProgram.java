package splc.lower;

import com.google.common.collect.ImmutableList;

public record FlatProgram(
        ImmutableList<FlatInstruction> instructions,
        LabelTable labels,
        ImmutableList<FlatSlot> slots,
        int inlinedCallSites
) {
    public int size() {
        return instructions.size();
    }

    public FlatInstruction get(int index) {
        return instructions.get(index);
    }

    public FlatSlot slot(String name) {
        for (FlatSlot s : slots) {
            if (s.name().equals(name)) return s;
        }
        return null;
    }
}
