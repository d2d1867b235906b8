package splc.sema;

public record Declaration(String name, Kind kind, Scope scope) {
    public enum Kind {
        GLOBAL, PARAM, LOCAL
    }

    @Override
    public String toString() {
        return kind + " " + name + " in " + scope;
    }
}
