package splc.lower;

import com.google.common.base.Verify;

import java.util.function.Function;

public sealed interface FlatExpr {

    enum UnOp { NEG, NOT }

    enum BinOp {
        EQ, GT, OR, AND, ADD, SUB, MUL, DIV;

        public boolean isComparison() { return this == EQ || this == GT; }

        public boolean isLogical() { return this == OR || this == AND; }
    }

    record Num(int value) implements FlatExpr {
        @Override public String toString() { return Integer.toString(value); }
    }

    record Text(String value) implements FlatExpr {
        @Override public String toString() { return '"' + value + '"'; }
    }

    record Ref(Storage storage) implements FlatExpr {
        public FlatSlot slot() {
            Verify.verify(storage instanceof FlatSlot, "unnamed storage %s", storage);
            return (FlatSlot) storage;
        }

        @Override public String toString() { return storage.toString(); }
    }

    record Unary(UnOp op, FlatExpr operand) implements FlatExpr {
        @Override public String toString() { return "(" + op + " " + operand + ")"; }
    }

    record Binary(FlatExpr left, BinOp op, FlatExpr right) implements FlatExpr {
        @Override public String toString() { return "(" + left + " " + op + " " + right + ")"; }
    }

    default FlatExpr rename(Function<Storage, Storage> slots) {
        if (this instanceof Ref r) return new Ref(slots.apply(r.storage()));
        if (this instanceof Unary u) return new Unary(u.op(), u.operand().rename(slots));
        if (this instanceof Binary b) {
            FlatExpr left = b.left().rename(slots);
            return new Binary(left, b.op(), b.right().rename(slots));
        }
        return this;
    }
}
