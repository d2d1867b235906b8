package splc.lower;

public enum ErrorKind {
    RECURSIVE_DEFINITION(false),
    INLINING_DEPTH_EXCEEDED(false),
    FLAT_NAME_COLLISION(true),
    UNRESOLVED_JUMP_TARGET(true);

    private final boolean internal;

    ErrorKind(boolean internal) {
        this.internal = internal;
    }

    public boolean isInternal() {
        return internal;
    }
}
