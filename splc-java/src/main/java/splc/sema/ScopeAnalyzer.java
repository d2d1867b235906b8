package splc.sema;

import splc.ast.Program;
import splc.ast.decl.CallableDecl;
import splc.ast.expr.*;
import splc.ast.stmt.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public final class ScopeAnalyzer {
    private static final Logger LOGGER = Logger.getLogger(ScopeAnalyzer.class.getName());

    private final SymbolTable table = new SymbolTable();

    public SymbolTable analyze(Program program) {
        // 1) declarations
        for (String g : program.globals()) table.globalScope().define(g, Declaration.Kind.GLOBAL);

        for (CallableDecl p : program.procedures()) declareCallable(p, table.procedureScope(), ScopeKind.PROCEDURE);
        for (CallableDecl f : program.functions()) declareCallable(f, table.functionScope(), ScopeKind.FUNCTION);

        for (String v : program.main().variables()) table.mainScope().define(v, Declaration.Kind.LOCAL);

        // 2) names shared between variables and callables
        checkEverywhereNames();

        // 3) uses
        for (CallableSymbol c : table.callables()) {
            checkBlock(c.decl().body(), c.localScope());
            if (c.decl().returnValue() != null) checkExpr(c.decl().returnValue(), c.localScope());
        }
        checkBlock(program.main().body(), table.mainScope());

        LOGGER.fine(() -> "Scope analysis OK: " + program.globals().size() + " globals, "
                + table.callables().size() + " procedures/functions");
        return table;
    }

    private void declareCallable(CallableDecl c, Scope set, ScopeKind kind) {
        Scope scope = table.newScope(kind, c.name(), set);
        Scope local = table.newScope(ScopeKind.LOCAL, c.name(), scope);

        for (String p : c.params()) scope.define(p, Declaration.Kind.PARAM);
        for (String l : c.locals()) {
            if (scope.getLocal(l) != null) {
                throw new SemanticException("Local '" + l + "' shadows a parameter of " + c.name());
            }
            local.define(l, Declaration.Kind.LOCAL);
        }

        table.defineCallable(new CallableSymbol(c, scope, local));
    }

    private void checkEverywhereNames() {
        Set<String> variables = new HashSet<>();
        collectVariableNames(table.everywhere(), variables);

        for (CallableSymbol c : table.callables()) {
            if (variables.contains(c.name())) {
                String what = c.isFunction() ? "function" : "procedure";
                throw new SemanticException("Variable name '" + c.name() + "' conflicts with " + what + " name");
            }
        }
    }

    private static void collectVariableNames(Scope s, Set<String> out) {
        for (Declaration d : s.declarations()) out.add(d.name());
        for (Scope child : s.children()) collectVariableNames(child, out);
    }

    // ---------- uses ----------
    private void checkBlock(BlockStmt b, Scope scope) {
        for (Stmt s : b.statements()) checkStmt(s, scope);
    }

    private void checkStmt(Stmt s, Scope scope) {
        if (s instanceof BlockStmt b) {
            checkBlock(b, scope);
        } else if (s instanceof AssignStmt a) {
            requireVariable(a.target(), a.line(), scope);
            checkExpr(a.value(), scope);
        } else if (s instanceof PrintStmt p) {
            checkExpr(p.value(), scope);
        } else if (s instanceof CallStmt c) {
            checkCall(c.call(), scope);
        } else if (s instanceof IfStmt i) {
            checkExpr(i.condition(), scope);
            checkBlock(i.thenBlock(), scope);
            if (i.elseBlock() != null) checkBlock(i.elseBlock(), scope);
        } else if (s instanceof WhileStmt w) {
            checkExpr(w.condition(), scope);
            checkBlock(w.body(), scope);
        } else if (s instanceof DoUntilStmt d) {
            checkBlock(d.body(), scope);
            checkExpr(d.condition(), scope);
        } else if (!(s instanceof HaltStmt)) {
            throw new IllegalStateException("Unsupported statement: " + s.getClass().getSimpleName());
        }
    }

    private void checkExpr(Expr e, Scope scope) {
        if (e instanceof VarExpr v) {
            requireVariable(v.name(), v.line(), scope);
        } else if (e instanceof UnaryExpr u) {
            checkExpr(u.expr(), scope);
        } else if (e instanceof BinaryExpr b) {
            checkExpr(b.left(), scope);
            checkExpr(b.right(), scope);
        } else if (e instanceof CallExpr c) {
            checkCall(c, scope);
        }
    }

    private void checkCall(CallExpr c, Scope scope) {
        CallableSymbol callee = table.lookupCallable(c.callee());
        if (callee == null) {
            throw new SemanticException("[" + c.line() + "] Undeclared procedure/function '" + c.callee() + "'");
        }
        List<String> params = callee.decl().params();
        if (params.size() != c.args().size()) {
            throw new SemanticException("[" + c.line() + "] Arity mismatch for " + c.callee()
                    + ": expected " + params.size() + ", got " + c.args().size());
        }
        for (Expr a : c.args()) checkExpr(a, scope);
    }

    private void requireVariable(String name, int line, Scope scope) {
        if (table.resolveVariable(scope, name) == null) {
            throw new SemanticException("[" + line + "] Undeclared variable '" + name + "' in " + scope);
        }
    }
}
