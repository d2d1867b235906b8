package splc.ast.expr;

public record NumberLiteral(int value) implements Expr {}
