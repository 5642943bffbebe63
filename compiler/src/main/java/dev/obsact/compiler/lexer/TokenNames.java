package dev.obsact.compiler.lexer;

import dev.obsact.antlr.ObsActParser;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.Map;
import java.util.StringJoiner;

import static java.util.Map.entry;

/**
 * Human-readable names for token kinds, used in diagnostics.
 */
public final class TokenNames {

    private static final Map<Integer, String> NAMES = Map.ofEntries(
            entry(Token.EOF, "end of input"),
            entry(ObsActParser.DEVICE, "'device'"),
            entry(ObsActParser.SET, "'set'"),
            entry(ObsActParser.IF, "'if'"),
            entry(ObsActParser.THEN, "'then'"),
            entry(ObsActParser.ELSE, "'else'"),
            entry(ObsActParser.SEND, "'send'"),
            entry(ObsActParser.ALERT, "'alert'"),
            entry(ObsActParser.FOR, "'for'"),
            entry(ObsActParser.ALL, "'all'"),
            entry(ObsActParser.TURN_ON, "'turnOn'"),
            entry(ObsActParser.TURN_OFF, "'turnOff'"),
            entry(ObsActParser.BOOLEAN, "boolean"),
            entry(ObsActParser.AND, "'&&'"),
            entry(ObsActParser.OR, "'||'"),
            entry(ObsActParser.RELOP, "comparison operator"),
            entry(ObsActParser.NUMBER, "number"),
            entry(ObsActParser.MESSAGE, "quoted message"),
            entry(ObsActParser.IDENTIFIER, "name"));

    private TokenNames() {
    }

    public static String describe(int kind) {
        String name = NAMES.get(kind);
        if (name != null) {
            return name;
        }
        return ObsActParser.VOCABULARY.getDisplayName(kind);
    }

    /** Lists the kinds of a set as {@code 'then' or '&&' or '||'}. */
    public static String describe(IntervalSet kinds) {
        StringJoiner joiner = new StringJoiner(" or ");
        for (int kind : kinds.toList()) {
            joiner.add(describe(kind));
        }
        return joiner.toString();
    }

    /** Describes the token actually found, quoting its text. */
    public static String found(Token token) {
        if (token == null || token.getType() == Token.EOF) {
            return "end of input";
        }
        return "'" + token.getText() + "'";
    }
}
