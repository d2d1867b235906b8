package splc.sema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Scope {
    private final int id;
    private final ScopeKind kind;
    private final String owner;
    private final Scope parent;
    private final List<Scope> children = new ArrayList<>();
    private final Map<String, Declaration> declarations = new LinkedHashMap<>();

    Scope(int id, ScopeKind kind, String owner, Scope parent) {
        this.id = id;
        this.kind = kind;
        this.owner = owner;
        this.parent = parent;
        if (parent != null) parent.children.add(this);
    }

    public Declaration define(String name, Declaration.Kind declKind) {
        if (declarations.containsKey(name)) {
            throw new SemanticException("Duplicate declaration of '" + name + "' in " + this);
        }
        Declaration d = new Declaration(name, declKind, this);
        declarations.put(name, d);
        return d;
    }

    public Declaration getLocal(String name) {
        return declarations.get(name);
    }

    public int id() { return id; }

    public ScopeKind kind() { return kind; }

    public String owner() { return owner; }

    public Scope parent() { return parent; }

    public List<Scope> children() { return Collections.unmodifiableList(children); }

    public Collection<Declaration> declarations() {
        return Collections.unmodifiableCollection(declarations.values());
    }

    @Override
    public String toString() {
        return kind == ScopeKind.LOCAL || kind == ScopeKind.PROCEDURE || kind == ScopeKind.FUNCTION
                ? kind + "(" + owner + ")"
                : kind.toString();
    }
}
