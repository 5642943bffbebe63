package dev.obsact.compiler.parser;

import dev.obsact.antlr.ObsActParser;
import dev.obsact.compiler.CompileError;
import dev.obsact.compiler.ast.Program;
import dev.obsact.compiler.lexer.Tokenization;
import org.antlr.v4.runtime.CommonTokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses a scanned token list into a {@link Program}. Each call builds its own parser, error
 * strategy and error list, so nothing carries over between parses.
 */
public final class ProgramParser {

    private ProgramParser() {
    }

    public static ParseResult parse(Tokenization tokenization) {
        Objects.requireNonNull(tokenization, "tokenization");

        List<CompileError> diagnostics = new ArrayList<>(tokenization.errors());
        if (tokenization.isEmpty()) {
            diagnostics.add(CompileError.emptyInput());
            return ParseResult.failure(diagnostics);
        }

        List<CompileError> errors = new ArrayList<>();
        ObsActParser parser = new ObsActParser(new CommonTokenStream(tokenization.tokenSource()));
        parser.removeErrorListeners();
        parser.addErrorListener(new CollectingErrorListener(errors));
        parser.setErrorHandler(new SynchronizingErrorStrategy());

        ObsActParser.ProgramContext tree = parser.program();
        Program program = new ProgramBuilder(errors).build(tree);

        diagnostics.addAll(errors);
        if (program == null) {
            return ParseResult.failure(diagnostics);
        }
        return ParseResult.success(program, diagnostics);
    }
}
