package dev.obsact.compiler.lexer;

import dev.obsact.antlr.ObsActParser;
import org.antlr.v4.runtime.Token;

import java.math.BigInteger;

/**
 * Read-only view of one lexical unit: its kind, raw text and source line.
 */
public record SourceToken(int kind, String text, int line) {

    static SourceToken of(Token token) {
        return new SourceToken(token.getType(), token.getText(), token.getLine());
    }

    /**
     * The literal value, typed by kind: {@link BigInteger} for numbers, {@link Boolean} for
     * booleans, the unquoted text for messages and the raw text for everything else.
     */
    public Object value() {
        switch (kind) {
            case ObsActParser.NUMBER:
                return new BigInteger(text);
            case ObsActParser.BOOLEAN:
                return Boolean.valueOf(text);
            case ObsActParser.MESSAGE:
                return unquote(text);
            default:
                return text;
        }
    }

    public String kindName() {
        return ObsActParser.VOCABULARY.getSymbolicName(kind);
    }

    /** Strips the delimiting double quotes of a message literal. */
    public static String unquote(String message) {
        if (message.length() >= 2 && message.startsWith("\"") && message.endsWith("\"")) {
            return message.substring(1, message.length() - 1);
        }
        return message;
    }
}
