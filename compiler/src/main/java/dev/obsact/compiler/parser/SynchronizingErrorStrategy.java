package dev.obsact.compiler.parser;

import dev.obsact.antlr.ObsActParser;
import dev.obsact.compiler.lexer.TokenNames;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.InputMismatchException;
import org.antlr.v4.runtime.NoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.misc.IntervalSet;

/**
 * Panic-mode recovery. A missing or unexpected token is reported once, then tokens are
 * discarded until one that can start a statement ({@code device set if turnOn turnOff send})
 * or the end of input, and parsing resumes there. No token is ever invented or silently
 * dropped, so every broken statement is reported.
 */
final class SynchronizingErrorStrategy extends DefaultErrorStrategy {

    static final IntervalSet SYNCHRONIZATION_SET = new IntervalSet(
            ObsActParser.DEVICE,
            ObsActParser.SET,
            ObsActParser.IF,
            ObsActParser.TURN_ON,
            ObsActParser.TURN_OFF,
            ObsActParser.SEND,
            Token.EOF);

    static {
        SYNCHRONIZATION_SET.setReadonly(true);
    }

    @Override
    public Token recoverInline(Parser recognizer) throws RecognitionException {
        throw new InputMismatchException(recognizer);
    }

    @Override
    public void sync(Parser recognizer) throws RecognitionException {
        if (inErrorRecoveryMode(recognizer)) {
            return;
        }
        ATNState state = recognizer.getInterpreter().atn.states.get(recognizer.getState());
        int la = recognizer.getInputStream().LA(1);
        IntervalSet next = recognizer.getATN().nextTokens(state);
        if (next.contains(la) || next.contains(Token.EPSILON)) {
            return;
        }
        switch (state.getStateType()) {
            case ATNState.STAR_LOOP_ENTRY:
            case ATNState.STAR_LOOP_BACK:
            case ATNState.PLUS_LOOP_BACK:
                reportUnwantedToken(recognizer);
                consumeUntil(recognizer, recognizer.getExpectedTokens().or(SYNCHRONIZATION_SET));
                break;
            default:
                // the rule's own prediction or match reports it
                break;
        }
    }

    @Override
    protected IntervalSet getErrorRecoverySet(Parser recognizer) {
        return SYNCHRONIZATION_SET;
    }

    @Override
    protected void reportInputMismatch(Parser recognizer, InputMismatchException e) {
        IntervalSet expected = e.getExpectedTokens();
        Token found = e.getOffendingToken();
        Token anchor = found;
        String message;
        if (expected.contains(ObsActParser.PERIOD)) {
            // the period belongs right after the previous token, which may be on an earlier line
            Token previous = recognizer.getInputStream().LT(-1);
            if (previous != null) {
                anchor = previous;
            }
            message = "missing '.' at the end of the command, found " + TokenNames.found(found);
        } else if (expected.contains(ObsActParser.COLON)) {
            message = "missing ':' after '" + precedingKeyword(recognizer) + "', found " + TokenNames.found(found);
        } else if (expected.contains(ObsActParser.ASSIGN)) {
            message = "missing '=' in 'set' command, found " + TokenNames.found(found);
        } else {
            message = "expected " + TokenNames.describe(expected) + " but found " + TokenNames.found(found);
        }
        recognizer.notifyErrorListeners(anchor, message, e);
    }

    @Override
    protected void reportNoViableAlternative(Parser recognizer, NoViableAltException e) {
        Token found = e.getOffendingToken();
        String message = "unexpected " + TokenNames.found(found) + " in " + ruleName(recognizer);
        recognizer.notifyErrorListeners(found, message, e);
    }

    @Override
    protected void reportUnwantedToken(Parser recognizer) {
        if (inErrorRecoveryMode(recognizer)) {
            return;
        }
        beginErrorCondition(recognizer);
        Token found = recognizer.getCurrentToken();
        String message = "unexpected " + TokenNames.found(found)
                + ", expected " + TokenNames.describe(recognizer.getExpectedTokens());
        recognizer.notifyErrorListeners(found, message, null);
    }

    private static String precedingKeyword(Parser recognizer) {
        ParserRuleContext context = recognizer.getContext();
        if (context instanceof ObsActParser.DeviceDeclContext) {
            return "device";
        }
        return "for all";
    }

    private static String ruleName(Parser recognizer) {
        int ruleIndex = recognizer.getContext().getRuleIndex();
        switch (ruleIndex) {
            case ObsActParser.RULE_deviceAction:
                return "action";
            case ObsActParser.RULE_literal:
                return "literal";
            case ObsActParser.RULE_statement:
                return "statement";
            case ObsActParser.RULE_deviceDecl:
            case ObsActParser.RULE_deviceBinding:
                return "device declaration";
            default:
                return recognizer.getRuleNames()[ruleIndex];
        }
    }
}
