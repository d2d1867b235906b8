package splc.lower;

import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Second pass over the emitted code: numbers the instructions, then rewrites each
 * jump's symbolic label to the line carrying it.
 */
public final class LabelResolver {
    private static final Logger LOGGER = Logger.getLogger(LabelResolver.class.getName());

    private final int lineStart;
    private final int lineStep;

    public LabelResolver(int lineStart, int lineStep) {
        this.lineStart = lineStart;
        this.lineStep = lineStep;
    }

    /**
     * Resolves and freezes {@code code} in place.
     *
     * @throws LoweringDefect {@link ErrorKind#UNRESOLVED_JUMP_TARGET} if a jump names a
     *                        label no instruction carries, or a label is carried twice
     */
    public LabelTable resolve(List<FlatInstruction> code) {
        // pass 1: lines and label positions
        Map<String, Integer> lines = new HashMap<>();
        int line = lineStart;
        for (FlatInstruction insn : code) {
            insn.assignLine(line);
            for (String label : insn.labels()) {
                Integer previous = lines.put(label, line);
                LoweringDefect.verify(previous == null, ErrorKind.UNRESOLVED_JUMP_TARGET, label,
                        "label " + label + " carried by lines " + previous + " and " + line);
            }
            line += lineStep;
        }
        LabelTable table = new LabelTable(ImmutableMap.copyOf(lines));

        // pass 2: jump targets
        for (FlatInstruction insn : code) {
            if (insn.opcode().isJump()) {
                int target = table.lineOf(insn.jumpLabel());
                LoweringDefect.verify(target > 0, ErrorKind.UNRESOLVED_JUMP_TARGET, insn.jumpLabel(),
                        "jump at line " + insn.line() + " to unknown label " + insn.jumpLabel());
                insn.resolveJump(target);
            }
            insn.freeze();
        }

        LOGGER.fine(() -> "Resolved " + table.size() + " labels over " + code.size() + " instructions");
        return table;
    }
}
