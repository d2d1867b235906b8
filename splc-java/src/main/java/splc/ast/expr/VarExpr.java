package splc.ast.expr;

public record VarExpr(String name, int line) implements Expr {}
