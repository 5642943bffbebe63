package dev.obsact.compiler;

/**
 * Classes of diagnostics a compile can produce.
 */
public enum ErrorKind {

    /** A character no token rule accepts. Reported and skipped. */
    ILLEGAL_CHARACTER(false),

    /** Unexpected or missing token, or a missing device/command section. */
    SYNTAX_ERROR(true),

    /** The source contained no tokens at all. */
    EMPTY_INPUT(true);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    /**
     * Whether a diagnostic of this kind prevents code from being generated.
     */
    public boolean isFatal() {
        return fatal;
    }
}
