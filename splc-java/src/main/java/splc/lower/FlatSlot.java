package splc.lower;

import splc.sema.Declaration;

import static com.google.common.base.Preconditions.checkNotNull;

public record FlatSlot(String name, Declaration declaration, String owner, int instance) implements Storage {
    public FlatSlot {
        checkNotNull(name, "name");
        checkNotNull(owner, "owner");
    }

    public boolean isTemporary() {
        return declaration == null;
    }

    @Override
    public String toString() {
        return name;
    }
}
