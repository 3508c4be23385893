package org.pragmatica.txt2tex.lexer;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class LexerPropertyTest {
    private static final List<String> LEXEMES = List.of(
        "x", "y'", "count", "s1", "42", "N", "∅",
        "and", "∧", "or", "∨", "not", "=>", "⇔", "<=>",
        "=", "!=", "≠", "<=", ">=", "<", ">", "∈", "notin", "subset",
        "+", "-", "*", "div", "mod", "union", "∩", "cross", "\\",
        "|->", "->", "+->", ">->", "<->", "<|", "|>", "++", "o9",
        "(", ")", "{", "}", ",", ";", ":", "|", ".", "#", "..",
        "forall", "exists", "lambda", "mu", "if", "then", "else");

    @Provide
    Arbitrary<List<String>> lexemes() {
        return Arbitraries.of(LEXEMES).list().ofMinSize(1).ofMaxSize(25);
    }

    @Property(tries = 300)
    void rejoinedLexemes_reproduceTheKindSequence(@ForAll("lexemes") List<String> lexemes) {
        var original = Lexer.tokenize(String.join("  ", lexemes));
        var rejoined = original.stream()
                               .filter(token -> token.kind() != TokenKind.EOF)
                               .map(Token::text)
                               .collect(Collectors.joining(" "));

        assertThat(kinds(Lexer.tokenize(rejoined))).isEqualTo(kinds(original));
    }

    @Property(tries = 100)
    void everyTokenizationEndsWithEof(@ForAll("lexemes") List<String> lexemes) {
        var tokens = Lexer.tokenize(String.join(" ", lexemes));

        assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.EOF);
        assertThat(tokens).filteredOn(token -> token.kind() == TokenKind.EOF).hasSize(1);
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream()
                     .map(Token::kind)
                     .collect(Collectors.toList());
    }
}
