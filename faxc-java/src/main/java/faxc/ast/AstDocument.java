package faxc.ast;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * A program together with the JSON path of every node it was read from.
 * Records compare structurally, so locations are keyed by identity.
 */
public final class AstDocument {
    private final Program program;
    private final Map<Object, String> locations;

    public AstDocument(Program program, IdentityHashMap<Object, String> locations) {
        this.program = program;
        this.locations = locations;
    }

    /** A document for a tree built in code, with no location information. */
    public static AstDocument of(Program program) {
        return new AstDocument(program, new IdentityHashMap<>());
    }

    public Program program() { return program; }

    public String where(Object node) {
        return locations.get(node);
    }
}
