package splc.sema;

import splc.ast.Program;
import splc.ast.expr.*;
import splc.ast.stmt.*;
import splc.types.Type;

public final class TypeChecker {

    private final SymbolTable table;

    public TypeChecker(SymbolTable table) {
        this.table = table;
    }

    public void check(Program program) {
        for (CallableSymbol c : table.callables()) {
            checkBlock(c.decl().body());
            if (c.isFunction()) {
                requireNumeric(typeOf(c.decl().returnValue()), "return value of " + c.name());
            }
        }
        checkBlock(program.main().body());
    }

    private void checkBlock(BlockStmt b) {
        for (Stmt s : b.statements()) checkStmt(s);
    }

    private void checkStmt(Stmt s) {
        if (s instanceof BlockStmt b) {
            checkBlock(b);
        } else if (s instanceof AssignStmt a) {
            requireNumeric(typeOf(a.value()), "assignment to '" + a.target() + "'");
        } else if (s instanceof PrintStmt p) {
            Type t = typeOf(p.value());
            if (t == Type.BOOLEAN) throw new SemanticException("print expects a number or a string");
        } else if (s instanceof CallStmt c) {
            CallableSymbol callee = table.lookupCallable(c.call().callee());
            if (callee.isFunction()) {
                throw new SemanticException("[" + c.call().line() + "] Function '" + callee.name()
                        + "' called as a procedure; its value must be assigned");
            }
            checkArgs(c.call());
        } else if (s instanceof IfStmt i) {
            requireBool(typeOf(i.condition()), "if condition");
            checkBlock(i.thenBlock());
            if (i.elseBlock() != null) checkBlock(i.elseBlock());
        } else if (s instanceof WhileStmt w) {
            requireBool(typeOf(w.condition()), "while condition");
            checkBlock(w.body());
        } else if (s instanceof DoUntilStmt d) {
            checkBlock(d.body());
            requireBool(typeOf(d.condition()), "until condition");
        }
    }

    private void requireBool(Type t, String ctx) {
        if (t != Type.BOOLEAN) throw new SemanticException(ctx + " must be boolean");
    }

    private void requireNumeric(Type t, String ctx) {
        if (!t.isNumeric()) throw new SemanticException(ctx + " must be numeric");
    }

    private void checkArgs(CallExpr c) {
        for (int i = 0; i < c.args().size(); i++) {
            requireNumeric(typeOf(c.args().get(i)), "argument " + (i + 1) + " of " + c.callee());
        }
    }

    private Type typeOf(Expr e) {
        if (e instanceof NumberLiteral || e instanceof VarExpr) return Type.NUMERIC;
        if (e instanceof StringLiteral) return Type.STRING;

        if (e instanceof UnaryExpr u) {
            Type a = typeOf(u.expr());
            return switch (u.op()) {
                case NEG -> {
                    requireNumeric(a, "operand of 'neg'");
                    yield Type.NUMERIC;
                }
                case NOT -> {
                    requireBool(a, "operand of 'not'");
                    yield Type.BOOLEAN;
                }
            };
        }

        if (e instanceof BinaryExpr b) return typeBinary(b);

        if (e instanceof CallExpr c) {
            CallableSymbol callee = table.lookupCallable(c.callee());
            if (!callee.isFunction()) {
                throw new SemanticException("[" + c.line() + "] Procedure '" + c.callee() + "' has no value");
            }
            checkArgs(c);
            return Type.NUMERIC;
        }

        throw new IllegalStateException("Unsupported expr: " + e.getClass().getSimpleName());
    }

    private Type typeBinary(BinaryExpr b) {
        Type l = typeOf(b.left());
        Type r = typeOf(b.right());
        String ctx = "operand of '" + b.op().name().toLowerCase() + "'";

        return switch (b.op()) {
            case ADD, SUB, MUL, DIV -> {
                requireNumeric(l, ctx);
                requireNumeric(r, ctx);
                yield Type.NUMERIC;
            }
            case EQ, GT -> {
                requireNumeric(l, ctx);
                requireNumeric(r, ctx);
                yield Type.BOOLEAN;
            }
            case AND, OR -> {
                requireBool(l, ctx);
                requireBool(r, ctx);
                yield Type.BOOLEAN;
            }
        };
    }
}
