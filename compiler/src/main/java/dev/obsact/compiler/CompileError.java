package dev.obsact.compiler;

import java.util.Objects;

/**
 * One line-numbered diagnostic produced while tokenizing or parsing.
 */
public record CompileError(ErrorKind kind, String message, int line) {

    public CompileError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static CompileError illegalCharacter(String character, int line) {
        return new CompileError(ErrorKind.ILLEGAL_CHARACTER, "illegal character '" + character + "'", line);
    }

    public static CompileError syntax(String message, int line) {
        return new CompileError(ErrorKind.SYNTAX_ERROR, message, line);
    }

    public static CompileError emptyInput() {
        return new CompileError(ErrorKind.EMPTY_INPUT, "no tokens to compile", 1);
    }

    public boolean isFatal() {
        return kind.isFatal();
    }

    /**
     * Renders the diagnostic the way the command line prints it, e.g.
     * {@code line 3: [SYNTAX_ERROR] missing '.' at the end of the command}.
     */
    public String format() {
        return "line " + line + ": [" + kind + "] " + message;
    }
}
