package faxc.sema;

import faxc.ast.Program;
import faxc.ast.decl.*;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Registry of every top-level function, global variable and record type,
 * by mangled name. Built once per pass, before any text is emitted.
 */
public final class GlobalSymbols {
    private final Set<String> functions;
    private final Set<String> variables;
    private final Set<String> records;

    private GlobalSymbols(Set<String> functions, Set<String> variables, Set<String> records) {
        this.functions = Collections.unmodifiableSet(functions);
        this.variables = Collections.unmodifiableSet(variables);
        this.records = Collections.unmodifiableSet(records);
    }

    public static GlobalSymbols collect(Program program) {
        Set<String> functions = new LinkedHashSet<>();
        Set<String> variables = new LinkedHashSet<>();
        Set<String> records = new LinkedHashSet<>();

        for (Decl d : program.declarations()) {
            if (d instanceof FunctionDecl f) functions.add(Mangler.mangle(f.name()));
            else if (d instanceof StructDecl s) records.add(Mangler.mangle(s.name()));
            else if (d instanceof GlobalVarDecl g) variables.add(Mangler.mangle(g.variable().name()));
        }
        return new GlobalSymbols(functions, variables, records);
    }

    public boolean contains(String mangled) {
        return functions.contains(mangled) || variables.contains(mangled) || records.contains(mangled);
    }

    public boolean isFunction(String mangled) { return functions.contains(mangled); }

    public boolean isRecord(String mangled) { return records.contains(mangled); }

    public int size() { return functions.size() + variables.size() + records.size(); }
}
