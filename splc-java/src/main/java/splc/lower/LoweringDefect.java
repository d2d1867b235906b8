package splc.lower;

import com.google.common.base.VerifyException;

import static com.google.common.base.Preconditions.checkArgument;

public class LoweringDefect extends VerifyException {
    private final ErrorKind kind;
    private final String subject;

    public LoweringDefect(ErrorKind kind, String message, String subject) {
        super("internal compiler error: " + message);
        checkArgument(kind.isInternal(), "%s is a user error, not a defect", kind);
        this.kind = kind;
        this.subject = subject;
    }

    static void verify(boolean expression, ErrorKind kind, String subject, String message) {
        if (!expression) throw new LoweringDefect(kind, message, subject);
    }

    public ErrorKind kind() {
        return kind;
    }

    public String subject() {
        return subject;
    }
}
