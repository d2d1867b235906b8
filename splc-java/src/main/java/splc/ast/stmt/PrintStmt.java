package splc.ast.stmt;

import splc.ast.expr.Expr;

// value is an atom or a StringLiteral
public record PrintStmt(Expr value) implements Stmt {}
