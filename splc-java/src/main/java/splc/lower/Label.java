package splc.lower;

public final class Label {
    public enum Kind { ELSE, END, TOP }

    private final String name;
    boolean bound;

    Label(String name) {
        this.name = name;
    }

    public String name() { return name; }

    @Override
    public String toString() { return name; }
}
