package splc.lower;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import splc.lower.InstructionNode.Assign;
import splc.lower.InstructionNode.Sequence;
import splc.sema.Declaration;
import splc.sema.Scope;
import splc.sema.ScopeKind;
import splc.sema.SymbolTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkState;

/**
 * Maps declarations to uniquely named {@link FlatSlot}s.
 *
 * <p>Globals and main variables get one slot each when the scope tree is flattened
 * ({@code GLOBAL_<name>}, {@code MAIN_<name>}). Parameters and locals of callables have
 * no slot of their own: every inlined copy owns a fresh {@link CallFrame}, and
 * {@link #materialize} names its slots {@code <CALLABLE>_<k>_<name>}, where k numbers
 * the copies of that callable in order of appearance. Temporaries use the upper-case
 * bases {@code RESULT} and {@code T<n>}, which no SPL name can spell.
 */
public final class SymbolFlattener {
    private static final Logger LOGGER = Logger.getLogger(SymbolFlattener.class.getName());

    static final String GLOBAL_UNIT = "GLOBAL";
    static final String MAIN_UNIT = "MAIN";
    static final String TEMP = "T";
    static final String RESULT = "RESULT";

    private final SymbolTable table;
    private final Set<String> taken = new HashSet<>();
    private final List<FlatSlot> slots = new ArrayList<>();
    private final Map<Declaration, FlatSlot> unitSlots = new LinkedHashMap<>();
    private boolean flattened;

    public SymbolFlattener(SymbolTable table) {
        this.table = table;
    }

    public void flatten() {
        checkState(!flattened, "Scope tree already flattened");
        visit(table.everywhere());
        flattened = true;
        LOGGER.fine(() -> "Flattened " + unitSlots.size() + " global/main declarations");
    }

    private void visit(Scope scope) {
        String owner = switch (scope.kind()) {
            case GLOBAL -> GLOBAL_UNIT;
            case MAIN -> MAIN_UNIT;
            default -> null;
        };
        if (owner != null) {
            for (Declaration d : scope.declarations()) {
                unitSlots.put(d, newSlot(owner + "_" + d.name(), d, owner, 0));
            }
        }
        // callable scopes are named per inlined copy
        if (scope.kind() == ScopeKind.PROCEDURE || scope.kind() == ScopeKind.FUNCTION) return;
        for (Scope child : scope.children()) visit(child);
    }

    public FlatSlot slotFor(Declaration d) {
        checkState(flattened, "Scope tree not flattened yet");
        FlatSlot slot = unitSlots.get(d);
        if (slot == null) throw new IllegalArgumentException("No unit slot for " + d);
        return slot;
    }

    public List<FlatSlot> globalSlots() {
        List<FlatSlot> out = new ArrayList<>();
        for (FlatSlot s : unitSlots.values()) {
            if (s.owner().equals(GLOBAL_UNIT)) out.add(s);
        }
        return out;
    }

    public InstructionNode globalInitialization() {
        List<InstructionNode> out = new ArrayList<>();
        for (FlatSlot s : globalSlots()) out.add(new Assign(s, new FlatExpr.Num(0)));
        return Sequence.of(out);
    }

    public ImmutableList<FlatSlot> slots() {
        return ImmutableList.copyOf(slots);
    }

    /**
     * Replaces every {@link FrameSlot} of {@code unit} with a named {@link FlatSlot}.
     * Slots of the same frame share an instance number.
     */
    public InstructionNode materialize(InstructionNode unit) {
        checkState(flattened, "Scope tree not flattened yet");
        Naming naming = new Naming();
        InstructionNode out = InstructionNode.rename(unit, naming::slot, naming::frame);
        LOGGER.fine(() -> "Materialized " + naming.named.size() + " frame slots in "
                + naming.instances.size() + " frames");
        return out;
    }

    private final class Naming {
        final Map<FrameSlot, FlatSlot> named = new HashMap<>();
        final Map<CallFrame, Integer> instances = new HashMap<>();
        final Map<String, Integer> copiesPerCallable = new HashMap<>();
        final Map<CallFrame, Integer> temps = new HashMap<>();

        CallFrame frame(CallFrame frame) {
            instance(frame);
            return frame;
        }

        int instance(CallFrame frame) {
            if (frame.isUnit()) return 0;
            return instances.computeIfAbsent(frame,
                    f -> copiesPerCallable.merge(f.owner(), 1, Integer::sum));
        }

        Storage slot(Storage s) {
            if (!(s instanceof FrameSlot fs)) return s;
            FlatSlot slot = named.get(fs);
            if (slot == null) {
                slot = name(fs);
                named.put(fs, slot);
            }
            return slot;
        }

        private FlatSlot name(FrameSlot fs) {
            CallFrame frame = fs.frame();
            int instance = instance(frame);
            String prefix = frame.isUnit()
                    ? frame.owner()
                    : Ascii.toUpperCase(frame.owner()) + "_" + instance;
            String base = fs.baseName();
            if (fs.origin() == null && base.equals(TEMP)) {
                base = TEMP + temps.merge(frame, 1, Integer::sum);
            }
            return newSlot(prefix + "_" + base, fs.origin(), frame.owner(), instance);
        }
    }

    private FlatSlot newSlot(String candidate, Declaration d, String owner, int instance) {
        String name = candidate;
        for (int n = 2; taken.contains(name); n++) name = candidate + "_" + n;
        register(name);
        FlatSlot slot = new FlatSlot(name, d, owner, instance);
        slots.add(slot);
        LOGGER.finer(() -> "slot " + slot.name() + (d == null ? " (temporary)" : " for " + d));
        return slot;
    }

    void register(String name) {
        LoweringDefect.verify(taken.add(name), ErrorKind.FLAT_NAME_COLLISION, name,
                "flat name registered twice: " + name);
    }
}
