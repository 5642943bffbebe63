package dev.obsact.compiler;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one compile: the generated program text, or the errors that prevented it.
 * <p>
 * A successful result may still carry non-fatal diagnostics such as skipped illegal characters.
 */
public final class CompilationResult {

    private final String output;
    private final List<CompileError> errors;

    private CompilationResult(String output, List<CompileError> errors) {
        this.output = output;
        this.errors = List.copyOf(errors);
    }

    static CompilationResult success(String output, List<CompileError> diagnostics) {
        return new CompilationResult(Objects.requireNonNull(output, "output"), diagnostics);
    }

    static CompilationResult failure(List<CompileError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("a failed compilation needs at least one error");
        }
        return new CompilationResult(null, errors);
    }

    public boolean succeeded() {
        return output != null;
    }

    /**
     * The generated program text.
     *
     * @throws GenerationPreconditionException if the compile failed
     */
    public String output() {
        if (output == null) {
            throw new GenerationPreconditionException("no code was generated: " + errors.size() + " error(s)");
        }
        return output;
    }

    /** Diagnostics in the order they were reported; lexical ones come first. */
    public List<CompileError> errors() {
        return errors;
    }
}
