package splc.ast.stmt;

import splc.ast.expr.Expr;

public record DoUntilStmt(
        BlockStmt body,
        Expr condition
) implements Stmt {}
