package faxc.diag;

/**
 * Единственный тип ошибки прохода генерации. Прерывает проход целиком,
 * частичного вывода не бывает.
 */
public final class CodegenException extends RuntimeException {

    public enum Kind {
        MALFORMED_INPUT("malformed-input"),
        UNRECOGNIZED_NODE("unrecognized-node"),
        INTERNAL_CONSISTENCY("internal"),
        UNSUPPORTED_CONSTRUCT("unsupported-construct");

        private final String label;

        Kind(String label) { this.label = label; }

        public String label() { return label; }
    }

    private final Kind kind;
    private final String location; // JSON path, может быть null

    public CodegenException(Kind kind, String message, String location) {
        super(location == null ? message : message + " at " + location);
        this.kind = kind;
        this.location = location;
    }

    public static CodegenException malformed(String message, String location) {
        return new CodegenException(Kind.MALFORMED_INPUT, message, location);
    }

    public static CodegenException unrecognized(String nodeKind, String location) {
        return new CodegenException(Kind.UNRECOGNIZED_NODE, "Unrecognized node kind '" + nodeKind + "'", location);
    }

    public static CodegenException unsupported(String message, String location) {
        return new CodegenException(Kind.UNSUPPORTED_CONSTRUCT, message, location);
    }

    public static CodegenException internal(String message) {
        return new CodegenException(Kind.INTERNAL_CONSISTENCY, message, null);
    }

    public Kind kind() { return kind; }

    public String location() { return location; }

    /** One-line diagnostic as printed by the CLI. */
    public String describe() {
        return "error[" + kind.label() + "]: " + getMessage();
    }
}
