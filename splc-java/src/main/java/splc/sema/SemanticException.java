package splc.sema;

public class SemanticException extends RuntimeException {
    public SemanticException(String message) {
        super(message);
    }
}
