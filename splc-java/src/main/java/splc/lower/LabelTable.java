package splc.lower;

import com.google.common.collect.ImmutableMap;

public final class LabelTable {
    private final ImmutableMap<String, Integer> lines;

    LabelTable(ImmutableMap<String, Integer> lines) {
        this.lines = lines;
    }

    // -1 if no instruction carries the label
    public int lineOf(String label) {
        Integer line = lines.get(label);
        return line == null ? -1 : line;
    }

    public boolean contains(String label) {
        return lines.containsKey(label);
    }

    public int size() {
        return lines.size();
    }

    @Override
    public String toString() {
        return lines.toString();
    }
}
