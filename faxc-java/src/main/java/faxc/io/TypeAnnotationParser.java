package faxc.io;

import faxc.ast.type.*;
import faxc.diag.CodegenException;

import java.util.regex.Pattern;

/**
 * Parses annotation strings such as {@code int}, {@code Point[]},
 * {@code ptr<int>[]} or {@code ref<string>}. Forms are tried in order:
 * trailing {@code []}, {@code ptr<...>}, {@code ref<...>}, bare name.
 */
public final class TypeAnnotationParser {
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(::[A-Za-z_][A-Za-z0-9_]*)*");

    private TypeAnnotationParser() {}

    public static TypeRef parse(String text, String location) {
        String t = text.strip();
        if (t.endsWith("[]")) {
            return new ArrayTypeRef(parse(t.substring(0, t.length() - 2), location));
        }
        if (t.startsWith("ptr<") && t.endsWith(">")) {
            return new PointerTypeRef(parse(t.substring(4, t.length() - 1), location));
        }
        if (t.startsWith("ref<") && t.endsWith(">")) {
            return new ReferenceTypeRef(parse(t.substring(4, t.length() - 1), location));
        }
        if (!NAME.matcher(t).matches()) {
            throw CodegenException.malformed("Invalid type annotation '" + text + "'", location);
        }
        return new NamedTypeRef(t);
    }
}
