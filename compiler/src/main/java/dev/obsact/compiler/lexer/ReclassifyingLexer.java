package dev.obsact.compiler.lexer;

import dev.obsact.antlr.ObsActLexer;
import dev.obsact.compiler.CompileError;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.WritableToken;

import java.util.List;

/**
 * Generated lexer plus the two steps the grammar leaves to Java: keyword reclassification of
 * identifiers and recording (then skipping) illegal characters.
 */
final class ReclassifyingLexer extends ObsActLexer {

    private final List<CompileError> errors;

    ReclassifyingLexer(CharStream input, List<CompileError> errors) {
        super(input);
        this.errors = errors;
        removeErrorListeners();
    }

    @Override
    public Token nextToken() {
        while (true) {
            Token token = super.nextToken();
            switch (token.getType()) {
                case ILLEGAL_CHARACTER:
                    errors.add(CompileError.illegalCharacter(token.getText(), token.getLine()));
                    continue;
                case IDENTIFIER:
                    int kind = ReservedWords.classify(token.getText());
                    if (kind != IDENTIFIER) {
                        ((WritableToken) token).setType(kind);
                    }
                    return token;
                default:
                    return token;
            }
        }
    }
}
