package org.pragmatica.txt2tex.parser;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.pragmatica.txt2tex.ast.BinaryOperator;
import org.pragmatica.txt2tex.ast.Precedence.Associativity;
import org.pragmatica.txt2tex.error.ParseError;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.txt2tex.parser.Shapes.shape;

class PrecedencePropertyTest {

    @Property
    void twoOperatorChain_groupsByThePrecedenceTable(@ForAll BinaryOperator first, @ForAll BinaryOperator second) {
        var input = "a " + spelling(first) + " b " + spelling(second) + " c";
        var leftGrouped = "((a " + first + " b) " + second + " c)";
        var rightGrouped = "(a " + first + " (b " + second + " c))";

        if (first.precedence().bindsTighterThan(second.precedence())) {
            assertThat(shape(Parser.parseExpression(input))).isEqualTo(leftGrouped);
        }else if (second.precedence().bindsTighterThan(first.precedence())) {
            assertThat(shape(Parser.parseExpression(input))).isEqualTo(rightGrouped);
        }else if (first.associativity() == Associativity.NONE) {
            assertThatThrownBy(() -> Parser.parseExpression(input)).isInstanceOf(ParseError.class);
        }else if (first.associativity() == Associativity.LEFT) {
            assertThat(shape(Parser.parseExpression(input))).isEqualTo(leftGrouped);
        }else {
            assertThat(shape(Parser.parseExpression(input))).isEqualTo(rightGrouped);
        }
    }

    @Property
    void redundantParentheses_doNotChangeTheShape(@ForAll BinaryOperator first, @ForAll BinaryOperator second) {
        if (!first.precedence().bindsTighterThan(second.precedence())) {
            return;
        }
        var plain = "a " + spelling(first) + " b " + spelling(second) + " c";
        var parenthesized = "(a " + spelling(first) + " b) " + spelling(second) + " c";

        assertThat(shape(Parser.parseExpression(parenthesized))).isEqualTo(shape(Parser.parseExpression(plain)));
    }

    private static String spelling(BinaryOperator operator) {
        return switch (operator) {
            case IFF -> "<=>";
            case IMPLIES -> "=>";
            case OR -> "or";
            case AND -> "and";
            case EQUALS -> "=";
            case NOT_EQUAL -> "!=";
            case LESS -> "<";
            case GREATER -> ">";
            case LESS_EQUAL -> "<=";
            case GREATER_EQUAL -> ">=";
            case IN -> "in";
            case NOT_IN -> "notin";
            case SUBSET -> "subset";
            case PROPER_SUBSET -> "psubset";
            case RELATION -> "<->";
            case TOTAL_FUN -> "->";
            case PARTIAL_FUN -> "+->";
            case TOTAL_INJ -> ">->";
            case PARTIAL_INJ -> ">+>";
            case TOTAL_SURJ -> "-->>";
            case PARTIAL_SURJ -> "+->>";
            case BIJECTION -> ">->>";
            case FINITE_FUN -> "77->";
            case MAPLET -> "|->";
            case PLUS -> "+";
            case MINUS -> "-";
            case UNION -> "union";
            case SET_MINUS -> "\\";
            case OVERRIDE -> "++";
            case CONCAT -> "^";
            case BAG_UNION -> "uplus";
            case TIMES -> "*";
            case DIV -> "div";
            case MOD -> "mod";
            case INTERSECT -> "intersect";
            case CROSS -> "cross";
            case COMPOSE -> "o9";
            case CIRCLE -> "comp";
            case FILTER -> "filter";
            case DOM_RESTRICT -> "<|";
            case RAN_RESTRICT -> "|>";
            case DOM_SUBTRACT -> "<<|";
            case RAN_SUBTRACT -> "|>>";
        };
    }
}
