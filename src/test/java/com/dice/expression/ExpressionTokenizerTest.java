package com.dice.expression;

import com.dice.ast.ComparisonOperator;
import com.dice.ast.ConditionalDice;
import com.dice.ast.DiceRoll;
import com.dice.ast.RerollDice;
import com.dice.ast.RerollType;
import com.dice.exception.TokenizationException;
import com.dice.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionTokenizer.
 */
class ExpressionTokenizerTest {

    private static List<Token> tokenize(String input) {
        return new ExpressionTokenizer(input, DiceLimits.defaults()).tokenize();
    }

    private static List<TokenType> types(String input) {
        return tokenize(input).stream().map(Token::type).toList();
    }

    @Test
    @DisplayName("Should tokenize a mixed expression")
    void shouldTokenizeMixedExpression() {
        assertEquals(List.of(
                TokenType.DICE, TokenType.OPERATOR, TokenType.CONDITIONAL_DICE, TokenType.OPERATOR,
                TokenType.LPAREN, TokenType.REROLL_DICE, TokenType.OPERATOR, TokenType.NUMBER,
                TokenType.RPAREN, TokenType.EOF
        ), types("3d6+4d6>3*(2d8r1-1)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"3d6+5", "(2d6+3)*2", "4d6>=5-d20/2", "2d6ro<2+3d8rr1", "10"})
    @DisplayName("Token texts should concatenate back to the input")
    void tokenTextsShouldRebuildInput(String input) {
        String rebuilt = tokenize(input).stream().map(Token::text).collect(Collectors.joining());
        assertEquals(input, rebuilt);
    }

    @Test
    @DisplayName("Should record token positions")
    void shouldRecordPositions() {
        List<Token> tokens = tokenize("12+3d6");

        assertEquals(0, tokens.get(0).position());
        assertEquals(2, tokens.get(1).position());
        assertEquals(3, tokens.get(2).position());
        assertEquals(6, tokens.get(3).position());
        assertEquals(TokenType.EOF, tokens.get(3).type());
    }

    @Test
    @DisplayName("Conditional dice should win over plain dice")
    void conditionalShouldWinOverDice() {
        List<Token> tokens = tokenize("4d6>3");

        assertEquals(2, tokens.size());
        assertEquals(new ConditionalDice(4, 6, ComparisonOperator.GREATER_THAN, 3), tokens.get(0).literal());
    }

    @Test
    @DisplayName("Reroll dice should win over plain dice")
    void rerollShouldWinOverDice() {
        assertEquals(new RerollDice(2, 6, RerollType.EXPLODING, ComparisonOperator.EQUAL, 1),
                tokenize("2d6r1").get(0).literal());
        assertEquals(new RerollDice(4, 6, RerollType.ONCE, ComparisonOperator.LESS_THAN, 2),
                tokenize("4d6ro<2").get(0).literal());
        assertEquals(new RerollDice(3, 10, RerollType.RECURSIVE, ComparisonOperator.GREATER_THAN_OR_EQUALS, 9),
                tokenize("3d10rr>=9").get(0).literal());
    }

    @Test
    @DisplayName("Should accept two-character comparison operators")
    void shouldAcceptTwoCharacterOperators() {
        assertEquals(ComparisonOperator.GREATER_THAN_OR_EQUALS,
                ((ConditionalDice) tokenize("5d10>=8").get(0).literal()).operator());
        assertEquals(ComparisonOperator.LESS_THAN_OR_EQUALS,
                ((ConditionalDice) tokenize("5d10<=2").get(0).literal()).operator());
        assertEquals(ComparisonOperator.DOUBLE_EQUAL,
                ((ConditionalDice) tokenize("3d6==6").get(0).literal()).operator());
    }

    @Test
    @DisplayName("Should default the dice count to one and accept upper-case D")
    void shouldHandleImplicitCountAndUpperCase() {
        assertEquals(new DiceRoll(1, 20), tokenize("d20").get(0).literal());
        assertEquals(new DiceRoll(2, 8), tokenize("2D8").get(0).literal());
    }

    @Test
    @DisplayName("Should parse number literals as longs")
    void shouldParseNumbers() {
        Token token = tokenize("42").get(0);

        assertEquals(TokenType.NUMBER, token.type());
        assertEquals(42L, token.literal());
    }

    @ParameterizedTest
    @ValueSource(strings = {"d", "3d", "3x6", "2d6#", "abc"})
    @DisplayName("Should reject unknown syntax")
    void shouldRejectUnknownSyntax(String input) {
        assertThrows(TokenizationException.class, () -> tokenize(input));
    }

    @Test
    @DisplayName("Should report where tokenization failed")
    void shouldReportFailurePosition() {
        TokenizationException e = assertThrows(TokenizationException.class, () -> tokenize("3d6+x"));

        assertEquals(4, e.getPosition());
        assertEquals("x", e.getFragment());
        assertTrue(e.getMessage().contains("position 4"));
    }

    @Test
    @DisplayName("Should reject dice outside the limits")
    void shouldRejectDiceOutsideLimits() {
        DiceLimits limits = new DiceLimits(100, 10, 20);

        assertThrows(ValidationException.class, () -> new ExpressionTokenizer("0d6", limits).tokenize());
        assertThrows(ValidationException.class, () -> new ExpressionTokenizer("3d0", limits).tokenize());
        assertThrows(ValidationException.class, () -> new ExpressionTokenizer("11d6", limits).tokenize());
        assertThrows(ValidationException.class, () -> new ExpressionTokenizer("1d21", limits).tokenize());
        assertThrows(ValidationException.class,
                () -> new ExpressionTokenizer("99999999999999999999d6", limits).tokenize());
        assertDoesNotThrow(() -> new ExpressionTokenizer("10d20", limits).tokenize());
    }

    @Test
    @DisplayName("Should reject thresholds beyond sides plus one")
    void shouldRejectOutOfRangeThreshold() {
        assertDoesNotThrow(() -> tokenize("1d6>7"));
        assertThrows(ValidationException.class, () -> tokenize("1d6>8"));
        assertThrows(ValidationException.class, () -> tokenize("1d6r9"));
    }
}
