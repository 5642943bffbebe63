package dev.obsact.compiler;

/**
 * Raised when code generation is requested for a parse that did not produce a program.
 */
public class GenerationPreconditionException extends IllegalStateException {

    public GenerationPreconditionException(String message) {
        super(message);
    }
}
