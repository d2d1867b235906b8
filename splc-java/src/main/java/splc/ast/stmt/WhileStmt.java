package splc.ast.stmt;

import splc.ast.expr.Expr;

public record WhileStmt(
        Expr condition,
        BlockStmt body
) implements Stmt {}
