package splc.lower;

public record CallGraphEdge(String caller, String callee) {
    @Override
    public String toString() {
        return caller + " -> " + callee;
    }
}
