package splc.runtime;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public record ExecutionResult(ImmutableList<String> output, ImmutableMap<String, Integer> slots, long steps) {

    // never-written slots read as 0
    public int valueOf(String slot) {
        return slots.getOrDefault(slot, 0);
    }
}
