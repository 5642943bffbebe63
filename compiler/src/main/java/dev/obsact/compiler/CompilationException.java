package dev.obsact.compiler;

import java.util.List;

/**
 * Thrown by {@link ObsActCompiler#compileOrThrow(String)} when the source does not compile.
 */
public class CompilationException extends Exception {

    private final List<CompileError> errors;

    public CompilationException(List<CompileError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public List<CompileError> getErrors() {
        return errors;
    }

    private static String describe(List<CompileError> errors) {
        if (errors.isEmpty()) {
            return "compilation failed";
        }
        return "compilation failed with " + errors.size() + " error(s), first: " + errors.get(0).format();
    }
}
