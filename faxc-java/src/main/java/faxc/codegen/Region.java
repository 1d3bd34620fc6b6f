package faxc.codegen;

/** Part of the translation unit that text is currently emitted into. */
public enum Region {
    /** Declaration headers and global initializers inside the program namespace. */
    NAMESPACE_SCOPE,
    /** Bodies of functions and record methods, inside the program namespace. */
    FUNCTION_BODY,
    /** The synthesized {@code main}, outside the program namespace. */
    ENTRY_POINT;

    /** Whether a reference to a program global must carry the namespace prefix here. */
    public boolean qualifiesGlobals() {
        return this != NAMESPACE_SCOPE;
    }
}
