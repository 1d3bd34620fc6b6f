package faxc.ast.decl;

import faxc.ast.stmt.BlockStmt;
import faxc.ast.type.NamedTypeRef;
import faxc.ast.type.TypeRef;

import java.util.List;

public record FunctionDecl(
        String name,
        TypeRef returnType,
        List<Param> params,
        BlockStmt body
) implements Decl {

    public record Param(String name, TypeRef type) {
        public static final String RECEIVER = "self";

        /** Receiver parameter: declared local, never written to the parameter list. */
        public boolean isReceiver() {
            if (RECEIVER.equals(name)) return true;
            return type instanceof NamedTypeRef n && RECEIVER.equals(n.name());
        }
    }
}
