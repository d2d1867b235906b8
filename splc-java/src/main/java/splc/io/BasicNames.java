package splc.io;

import com.google.common.base.Ascii;
import splc.lower.FlatProgram;
import splc.lower.FlatSlot;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * BASIC variable names for flat slots. GW-BASIC names hold only letters, digits and
 * '.', ignore case, count only the first 40 characters and must not start with FN.
 */
final class BasicNames {
    static final int SIGNIFICANT = 40;

    private final Map<String, String> byFlatName = new HashMap<>();
    private final Set<String> taken = new HashSet<>();

    static BasicNames of(FlatProgram program) {
        BasicNames names = new BasicNames();
        for (FlatSlot s : program.slots()) names.name(s);
        return names;
    }

    String name(FlatSlot slot) {
        return byFlatName.computeIfAbsent(slot.name(), this::assign);
    }

    private String assign(String flatName) {
        String base = flatName.replace('_', '.');
        if (Ascii.toUpperCase(base).startsWith("FN")) base = "V" + base;
        String name = fit(base, "");
        for (int n = 2; !taken.add(Ascii.toUpperCase(name)); n++) {
            name = fit(base, "." + n);
        }
        return name;
    }

    private static String fit(String base, String suffix) {
        int room = SIGNIFICANT - suffix.length();
        return (base.length() > room ? base.substring(0, room) : base) + suffix;
    }
}
