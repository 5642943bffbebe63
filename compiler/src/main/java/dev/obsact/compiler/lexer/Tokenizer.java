package dev.obsact.compiler.lexer;

import dev.obsact.compiler.CompileError;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scans ObsAct source text into tokens. The whole input is scanned up front; illegal
 * characters are recorded and skipped one at a time, so scanning always reaches the end.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    public static Tokenization tokenize(String source) {
        Objects.requireNonNull(source, "source");

        List<CompileError> errors = new ArrayList<>();
        ReclassifyingLexer lexer = new ReclassifyingLexer(CharStreams.fromString(source), errors);

        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (token.getType() != Token.EOF);

        return new Tokenization(tokens, errors);
    }
}
