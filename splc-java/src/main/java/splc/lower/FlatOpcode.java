package splc.lower;

public enum FlatOpcode {
    ASSIGN,         // target = value
    PRINT,          // value: Text or numeric atom
    JUMP_IF_FALSE,  // value: condition, jump when false
    JUMP,
    HALT;

    public boolean isJump() {
        return this == JUMP || this == JUMP_IF_FALSE;
    }
}
