package splc.ast.expr;

public sealed interface Expr
        permits NumberLiteral, StringLiteral, VarExpr,
        UnaryExpr, BinaryExpr, CallExpr {}
