package faxc.sema;

/**
 * Escapes identifiers that collide with C++ reserved words by appending a
 * single trailing marker. Single pass only: {@code class_} is never checked
 * against the table again, so a reserved word that itself ends in the marker
 * is not handled.
 */
public final class Mangler {
    public static final char MARKER = '_';

    private Mangler() {}

    public static String mangle(String name) {
        return CppKeywords.isReserved(name) ? name + MARKER : name;
    }
}
