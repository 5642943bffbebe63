package dev.obsact.compiler.parser;

import dev.obsact.compiler.CompileError;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.List;

/**
 * Records every parser report as a {@link CompileError} instead of printing it.
 */
final class CollectingErrorListener extends BaseErrorListener {

    private final List<CompileError> errors;

    CollectingErrorListener(List<CompileError> errors) {
        this.errors = errors;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        errors.add(CompileError.syntax(msg, line));
    }
}
