package faxc.codegen;

import faxc.ast.AstDocument;
import faxc.diag.CodegenException;
import faxc.sema.GlobalSymbols;
import faxc.sema.ScopeTracker;

/**
 * Mutable state of a single generation pass. A new context is created for
 * every pass and is never shared between threads.
 */
public final class GenContext {
    private final CodegenOptions options;
    private final GlobalSymbols globals;
    private final ScopeTracker scopes;
    private final SourceWriter out;
    private final AstDocument document;
    private Region region = Region.NAMESPACE_SCOPE;

    public GenContext(CodegenOptions options, GlobalSymbols globals, AstDocument document) {
        this.options = options;
        this.globals = globals;
        this.scopes = new ScopeTracker(globals);
        this.out = new SourceWriter(options.indentWidth());
        this.document = document;
    }

    public CodegenOptions options() { return options; }

    public GlobalSymbols globals() { return globals; }

    public ScopeTracker scopes() { return scopes; }

    public SourceWriter out() { return out; }

    public Region region() { return region; }

    /** Switches region and returns the previous one, to be restored by the caller. */
    public Region enterRegion(Region next) {
        Region prev = region;
        region = next;
        return prev;
    }

    public void restoreRegion(Region prev) { region = prev; }

    public String where(Object node) { return document.where(node); }

    public void checkUnwound() {
        if (scopes.depth() != 0) throw CodegenException.internal("Scope stack not unwound: depth " + scopes.depth());
        if (out.depth() != 0) throw CodegenException.internal("Indentation not unwound: depth " + out.depth());
    }
}
