package faxc.sema;

public enum Resolution {
    /** Declared in an active lexical scope. */
    LOCAL,
    /** Top-level function, variable or record of the program. */
    GLOBAL,
    /** Neither: provided by the runtime or the C++ standard library. */
    UNQUALIFIED
}
