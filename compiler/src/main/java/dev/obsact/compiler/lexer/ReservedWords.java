package dev.obsact.compiler.lexer;

import dev.obsact.antlr.ObsActParser;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Reserved-word table. Every keyword also matches the identifier pattern, so the lexer
 * matches the longest identifier first and then reclassifies it here.
 * <p>
 * Keyword kinds are declared in the grammar's {@code tokens} block, which ANTLR only emits on
 * {@link ObsActParser}; the lexer shares the parser's numbering for every other kind.
 */
public final class ReservedWords {

    private static final Map<String, Integer> KINDS = Map.ofEntries(
            entry("device", ObsActParser.DEVICE),
            entry("set", ObsActParser.SET),
            entry("if", ObsActParser.IF),
            entry("then", ObsActParser.THEN),
            entry("else", ObsActParser.ELSE),
            entry("send", ObsActParser.SEND),
            entry("alert", ObsActParser.ALERT),
            entry("for", ObsActParser.FOR),
            entry("all", ObsActParser.ALL),
            entry("turnOn", ObsActParser.TURN_ON),
            entry("turnOff", ObsActParser.TURN_OFF),
            entry("true", ObsActParser.BOOLEAN),
            entry("false", ObsActParser.BOOLEAN));

    private ReservedWords() {
    }

    /**
     * Returns the token kind for an identifier-shaped word: its keyword kind when reserved,
     * {@link ObsActParser#IDENTIFIER} otherwise.
     */
    public static int classify(String word) {
        return KINDS.getOrDefault(word, ObsActParser.IDENTIFIER);
    }
}
