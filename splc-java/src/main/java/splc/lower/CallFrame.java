package splc.lower;

import static com.google.common.base.Preconditions.checkNotNull;

public final class CallFrame {
    private final String owner;
    private final boolean unit;

    private CallFrame(String owner, boolean unit) {
        this.owner = checkNotNull(owner, "owner");
        this.unit = unit;
    }

    public static CallFrame unit(String name) {
        return new CallFrame(name, true);
    }

    public static CallFrame of(String callable) {
        return new CallFrame(callable, false);
    }

    public CallFrame fresh() {
        return new CallFrame(owner, unit);
    }

    public String owner() { return owner; }

    public boolean isUnit() { return unit; }

    @Override
    public String toString() {
        return (unit ? "unit " : "frame ") + owner + "@" + Integer.toHexString(System.identityHashCode(this));
    }
}
