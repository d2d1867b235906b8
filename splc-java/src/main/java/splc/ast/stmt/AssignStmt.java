package splc.ast.stmt;

import splc.ast.expr.Expr;

public record AssignStmt(
        String target,
        Expr value,
        int line
) implements Stmt {}
