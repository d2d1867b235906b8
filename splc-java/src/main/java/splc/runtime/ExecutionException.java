package splc.runtime;

public class ExecutionException extends RuntimeException {
    private final int line;

    public ExecutionException(String message, int line) {
        super("[line " + line + "] " + message);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
