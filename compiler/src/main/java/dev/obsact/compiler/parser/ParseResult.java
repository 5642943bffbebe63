package dev.obsact.compiler.parser;

import dev.obsact.compiler.CompileError;
import dev.obsact.compiler.GenerationPreconditionException;
import dev.obsact.compiler.ast.Program;

import java.util.List;

/**
 * Either the parsed program or the fatal errors that prevented it. Non-fatal lexical
 * diagnostics may accompany a program.
 */
public final class ParseResult {

    private final Program program;
    private final List<CompileError> errors;

    private ParseResult(Program program, List<CompileError> errors) {
        this.program = program;
        this.errors = List.copyOf(errors);
    }

    static ParseResult success(Program program, List<CompileError> diagnostics) {
        for (CompileError diagnostic : diagnostics) {
            if (diagnostic.isFatal()) {
                throw new IllegalArgumentException("a parsed program cannot carry " + diagnostic.format());
            }
        }
        return new ParseResult(program, diagnostics);
    }

    static ParseResult failure(List<CompileError> errors) {
        return new ParseResult(null, errors);
    }

    public boolean succeeded() {
        return program != null;
    }

    /**
     * @throws GenerationPreconditionException when parsing failed
     */
    public Program requireProgram() {
        if (program == null) {
            throw new GenerationPreconditionException(
                    "cannot generate code from a failed parse (" + errors.size() + " error(s))");
        }
        return program;
    }

    public List<CompileError> errors() {
        return errors;
    }
}
