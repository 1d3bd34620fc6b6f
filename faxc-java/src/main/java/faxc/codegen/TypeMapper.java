package faxc.codegen;

import faxc.ast.type.*;
import faxc.diag.CodegenException;
import faxc.sema.GlobalSymbols;
import faxc.sema.Mangler;

import java.util.Map;

/**
 * Translates type annotations into C++ type expressions. Each recursive call
 * strips exactly one wrapper, so mapping always terminates.
 */
public final class TypeMapper {
    public static final String INFERRED = "auto";

    private static final Map<String, String> PRIMITIVES = Map.of(
            "int", "int",
            "float", "float",
            "bool", "bool",
            "string", "std::string",
            "void", "void"
    );

    private final CodegenOptions options;
    private final GlobalSymbols globals;

    public TypeMapper(CodegenOptions options, GlobalSymbols globals) {
        this.options = options;
        this.globals = globals;
    }

    /** {@code null} (no annotation) maps to the inference placeholder. */
    public String map(TypeRef ref) {
        return map(ref, null);
    }

    /** Same as {@link #map(TypeRef)}; {@code location} names the owning node in errors. */
    public String map(TypeRef ref, String location) {
        if (ref == null) return INFERRED;
        return map(ref, false, location);
    }

    private String map(TypeRef ref, boolean insideWrapper, String location) {
        if (ref instanceof ArrayTypeRef a) {
            return options.inRuntime("Array") + "<" + map(a.element(), true, location) + ">";
        }
        if (ref instanceof PointerTypeRef p) {
            return options.inRuntime("Ptr") + "<" + map(p.target(), true, location) + ">";
        }
        if (ref instanceof ReferenceTypeRef r) {
            if (insideWrapper) {
                throw CodegenException.unsupported("Reference type nested inside another type: " + ref.spelling(), location);
            }
            return map(r.target(), true, location) + "&";
        }
        if (ref instanceof NamedTypeRef n) {
            return mapNamed(n.name());
        }
        throw CodegenException.unrecognized(ref.getClass().getSimpleName(), location);
    }

    private String mapNamed(String name) {
        if (INFERRED.equals(name)) return INFERRED;
        String primitive = PRIMITIVES.get(name);
        if (primitive != null) return primitive;

        String mangled = Mangler.mangle(name);
        // пользовательская запись живёт в namespace программы
        if (globals.isRecord(mangled)) return options.inProgram(mangled);
        return mangled;
    }
}
