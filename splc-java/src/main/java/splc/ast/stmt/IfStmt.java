package splc.ast.stmt;

import splc.ast.expr.Expr;

public record IfStmt(
        Expr condition,
        BlockStmt thenBlock,
        BlockStmt elseBlock      // null without else
) implements Stmt {}
