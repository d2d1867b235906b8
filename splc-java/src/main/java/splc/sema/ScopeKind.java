package splc.sema;

public enum ScopeKind {
    EVERYWHERE,
    GLOBAL,
    PROCEDURES,
    FUNCTIONS,
    MAIN,
    PROCEDURE,
    FUNCTION,
    LOCAL
}
