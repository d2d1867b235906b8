package splc.ast.expr;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    public enum Operator {
        EQ, GT,
        OR, AND,
        ADD, SUB, MUL, DIV
    }
}
