package splc.lower;

import static com.google.common.base.Preconditions.checkArgument;

public class LoweringException extends RuntimeException {
    private final ErrorKind kind;
    private final String subject;

    public LoweringException(ErrorKind kind, String message, String subject) {
        super(message);
        checkArgument(!kind.isInternal(), "%s is an internal defect, not a user error", kind);
        this.kind = kind;
        this.subject = subject;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String subject() {
        return subject;
    }
}
