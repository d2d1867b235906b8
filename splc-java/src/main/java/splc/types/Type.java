package splc.types;

public enum Type {
    NUMERIC,
    BOOLEAN,
    STRING;     // only as a print operand

    public boolean isNumeric() {
        return this == NUMERIC;
    }
}
