package faxc.sema;

import faxc.diag.CodegenException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Стек лексических областей одного прохода генерации. Поиск идёт от
 * внутренней области к внешней, затем по глобальному реестру.
 */
public final class ScopeTracker {
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final GlobalSymbols globals;

    public ScopeTracker(GlobalSymbols globals) {
        this.globals = globals;
    }

    public void enter() { scopes.push(new Scope()); }

    public void exit() {
        if (scopes.isEmpty()) throw CodegenException.internal("Scope stack underflow: exit without matching enter");
        scopes.pop();
    }

    public int depth() { return scopes.size(); }

    /** Declares {@code name} in the innermost scope; a no-op at top level. */
    public void declare(String name) {
        Scope innermost = scopes.peek();
        if (innermost != null) innermost.define(Mangler.mangle(name));
    }

    public boolean isLocal(String name) {
        String mangled = Mangler.mangle(name);
        for (Scope s : scopes) {
            if (s.has(mangled)) return true;
        }
        return false;
    }

    public Resolution resolve(String name) {
        if (isLocal(name)) return Resolution.LOCAL;
        if (globals.contains(Mangler.mangle(name))) return Resolution.GLOBAL;
        return Resolution.UNQUALIFIED;
    }
}
