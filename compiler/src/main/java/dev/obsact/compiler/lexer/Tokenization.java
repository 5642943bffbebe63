package dev.obsact.compiler.lexer;

import dev.obsact.compiler.CompileError;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenSource;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The fully scanned token list of one source text, ending with EOF, and the lexical errors
 * met on the way.
 */
public final class Tokenization {

    private final List<Token> tokens;
    private final List<CompileError> errors;

    Tokenization(List<Token> tokens, List<CompileError> errors) {
        this.tokens = List.copyOf(tokens);
        this.errors = List.copyOf(errors);
    }

    /** Tokens without the trailing EOF. */
    public List<SourceToken> tokens() {
        return tokens.stream()
                .filter(token -> token.getType() != Token.EOF)
                .map(SourceToken::of)
                .collect(Collectors.toList());
    }

    public List<CompileError> errors() {
        return errors;
    }

    /** True when the source produced nothing but EOF. */
    public boolean isEmpty() {
        return tokens.size() == 1;
    }

    /** A fresh source replaying the scanned tokens, EOF included. */
    public TokenSource tokenSource() {
        return new ListTokenSource(tokens);
    }
}
