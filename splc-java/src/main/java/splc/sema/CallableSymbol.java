package splc.sema;

import splc.ast.decl.CallableDecl;

import java.util.ArrayList;
import java.util.List;

public record CallableSymbol(CallableDecl decl, Scope scope, Scope localScope) {

    public String name() { return decl.name(); }

    public boolean isFunction() { return decl.isFunction(); }

    // params, then locals
    public List<Declaration> frame() {
        List<Declaration> all = new ArrayList<>(scope.declarations());
        all.addAll(localScope.declarations());
        return all;
    }
}
