package splc.lower;

import splc.sema.Declaration;

import static com.google.common.base.Preconditions.checkNotNull;

public final class FrameSlot implements Storage {
    private final CallFrame frame;
    private final Declaration origin;   // null for temporaries
    private final String baseName;

    public FrameSlot(CallFrame frame, Declaration origin, String baseName) {
        this.frame = checkNotNull(frame, "frame");
        this.origin = origin;
        this.baseName = checkNotNull(baseName, "baseName");
    }

    public CallFrame frame() { return frame; }

    public Declaration origin() { return origin; }

    public String baseName() { return baseName; }

    @Override
    public String toString() {
        return frame.owner() + "." + baseName;
    }
}
