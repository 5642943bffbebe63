package dev.obsact.compiler.lexer;

import dev.obsact.antlr.ObsActParser;
import dev.obsact.compiler.CompileError;
import dev.obsact.compiler.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Tokenizer")
class TokenizerTest {

    private static List<Integer> kinds(Tokenization tokenization) {
        return tokenization.tokens().stream().map(SourceToken::kind).collect(Collectors.toList());
    }

    @Test
    @DisplayName("reclassifies every reserved word after matching it as an identifier")
    void reclassifiesKeywords() {
        Tokenization tokens = Tokenizer.tokenize("device set if then else send alert for all turnOn turnOff");

        assertThat(kinds(tokens)).containsExactly(
                ObsActParser.DEVICE, ObsActParser.SET, ObsActParser.IF, ObsActParser.THEN, ObsActParser.ELSE,
                ObsActParser.SEND, ObsActParser.ALERT, ObsActParser.FOR, ObsActParser.ALL,
                ObsActParser.TURN_ON, ObsActParser.TURN_OFF);
        assertThat(tokens.errors()).isEmpty();
    }

    @Test
    @DisplayName("keeps the longest identifier match even when it starts with a keyword")
    void longerWordsStayIdentifiers() {
        Tokenization tokens = Tokenizer.tokenize("devices turnOnLed if2 sensor_1 truth");

        assertThat(kinds(tokens)).containsOnly(ObsActParser.IDENTIFIER).hasSize(5);
    }

    @Test
    @DisplayName("types literal values by token kind")
    void typesLiteralValues() {
        List<SourceToken> tokens = Tokenizer.tokenize("25 true false \"Hello, world\"").tokens();

        assertThat(tokens).extracting(SourceToken::value)
                .containsExactly(BigInteger.valueOf(25), Boolean.TRUE, Boolean.FALSE, "Hello, world");
        assertThat(tokens.get(1).kind()).isEqualTo(ObsActParser.BOOLEAN);
        assertThat(tokens.get(3).kind()).isEqualTo(ObsActParser.MESSAGE);
    }

    @Test
    @DisplayName("prefers two-character operators over their one-character prefixes")
    void operatorsUseLongestMatch() {
        List<SourceToken> tokens = Tokenizer.tokenize("== != <= >= < > = && ||").tokens();

        assertThat(tokens).extracting(SourceToken::text)
                .containsExactly("==", "!=", "<=", ">=", "<", ">", "=", "&&", "||");
        assertThat(tokens).extracting(SourceToken::kind).containsExactly(
                ObsActParser.RELOP, ObsActParser.RELOP, ObsActParser.RELOP, ObsActParser.RELOP,
                ObsActParser.RELOP, ObsActParser.RELOP, ObsActParser.ASSIGN, ObsActParser.AND, ObsActParser.OR);
    }

    @Test
    @DisplayName("recognizes punctuation")
    void punctuation() {
        List<SourceToken> tokens = Tokenizer.tokenize(": . , ( ) { }").tokens();

        assertThat(tokens).extracting(SourceToken::kindName)
                .containsExactly("COLON", "PERIOD", "COMMA", "LPAREN", "RPAREN", "LBRACE", "RBRACE");
    }

    @Test
    @DisplayName("counts lines across blank lines and ignores other whitespace")
    void countsLines() {
        List<SourceToken> tokens = Tokenizer.tokenize("device: a\r\n\n\tset x = 1.").tokens();

        assertThat(tokens.get(0).line()).isEqualTo(1);
        assertThat(tokens.get(3).text()).isEqualTo("set");
        assertThat(tokens.get(3).line()).isEqualTo(3);
    }

    @Test
    @DisplayName("reports an illegal character with its line and keeps scanning")
    void illegalCharacterIsSkipped() {
        Tokenization tokens = Tokenizer.tokenize("device: a\nset temp % = 25.");

        assertThat(tokens.errors()).singleElement().satisfies(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.ILLEGAL_CHARACTER);
            assertThat(error.line()).isEqualTo(2);
            assertThat(error.message()).contains("'%'");
        });
        assertThat(tokens.tokens()).extracting(SourceToken::text)
                .containsExactly("device", ":", "a", "set", "temp", "=", "25", ".");
    }

    @Test
    @DisplayName("skips exactly one character per illegal character")
    void eachIllegalCharacterIsReported() {
        Tokenization tokens = Tokenizer.tokenize("a & b ! c #$");

        assertThat(tokens.errors()).extracting(CompileError::message)
                .containsExactly("illegal character '&'", "illegal character '!'",
                        "illegal character '#'", "illegal character '$'");
        assertThat(tokens.tokens()).extracting(SourceToken::text).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("treats an unterminated quote as an illegal character")
    void unterminatedMessage() {
        Tokenization tokens = Tokenizer.tokenize("\"abc");

        assertThat(tokens.errors()).extracting(CompileError::message).containsExactly("illegal character '\"'");
        assertThat(tokens.tokens()).extracting(SourceToken::kind).containsExactly(ObsActParser.IDENTIFIER);
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @ValueSource(strings = {"", " ", "\n\n", " \t\r\n "})
    @DisplayName("produces no tokens for blank input")
    void blankInputIsEmpty(String source) {
        Tokenization tokens = Tokenizer.tokenize(source);

        assertThat(tokens.isEmpty()).isTrue();
        assertThat(tokens.tokens()).isEmpty();
        assertThat(tokens.errors()).isEmpty();
    }

    @Test
    @DisplayName("scans each input independently")
    void tokenizationsAreIndependent() {
        Tokenization first = Tokenizer.tokenize("set %");
        Tokenization second = Tokenizer.tokenize("set x");

        assertThat(first.errors()).hasSize(1);
        assertThat(second.errors()).isEmpty();
        assertThat(second.tokens()).hasSize(2);
    }
}
