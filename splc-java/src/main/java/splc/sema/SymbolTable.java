package splc.sema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SymbolTable {
    private final Scope everywhere;
    private final Scope global;
    private final Scope procedures;
    private final Scope functions;
    private final Scope main;
    private final Map<String, CallableSymbol> callables = new LinkedHashMap<>();
    private int nextScopeId;

    public SymbolTable() {
        everywhere = newScope(ScopeKind.EVERYWHERE, "Everywhere", null);
        global = newScope(ScopeKind.GLOBAL, "Global", everywhere);
        procedures = newScope(ScopeKind.PROCEDURES, "Procedures", everywhere);
        functions = newScope(ScopeKind.FUNCTIONS, "Functions", everywhere);
        main = newScope(ScopeKind.MAIN, "Main", everywhere);
    }

    Scope newScope(ScopeKind kind, String owner, Scope parent) {
        return new Scope(nextScopeId++, kind, owner, parent);
    }

    void defineCallable(CallableSymbol sym) {
        if (callables.containsKey(sym.name())) {
            throw new SemanticException("Duplicate procedure/function name: " + sym.name());
        }
        callables.put(sym.name(), sym);
    }

    public Scope everywhere() { return everywhere; }
    public Scope globalScope() { return global; }
    public Scope procedureScope() { return procedures; }
    public Scope functionScope() { return functions; }
    public Scope mainScope() { return main; }

    public CallableSymbol lookupCallable(String name) {
        return callables.get(name);
    }

    // procedures first, then functions
    public Collection<CallableSymbol> callables() {
        return Collections.unmodifiableCollection(callables.values());
    }

    public Declaration resolveVariable(Scope from, String name) {
        for (Scope s = from; s != null; s = s.parent()) {
            Declaration d = s.getLocal(name);
            if (d != null) return d;
        }
        return global.getLocal(name);
    }
}
