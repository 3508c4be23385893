package org.pragmatica.txt2tex.generator;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;
import org.pragmatica.txt2tex.ast.BinaryOperator;
import org.pragmatica.txt2tex.ast.ClosureKind;
import org.pragmatica.txt2tex.ast.QuantifierKind;
import org.pragmatica.txt2tex.ast.UnaryOperator;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolTest {

    @Property
    void everySymbol_hasASpellingInBothDialects(@ForAll Symbol symbol) {
        assertThat(symbol.latex(NotationMode.FUZZ)).isNotBlank();
        assertThat(symbol.latex(NotationMode.STANDARD)).isNotBlank();
    }

    @Property
    void dialectSpecificSymbols_differBetweenDialects(@ForAll Symbol symbol) {
        if (symbol.isDialectSpecific()) {
            assertThat(symbol.latex(NotationMode.FUZZ)).isNotEqualTo(symbol.latex(NotationMode.STANDARD));
        }else {
            assertThat(symbol.latex(NotationMode.FUZZ)).isEqualTo(symbol.latex(NotationMode.STANDARD));
        }
    }

    @Property
    void everyOperator_mapsToASymbol(@ForAll BinaryOperator operator) {
        assertThat(Symbol.forOperator(operator)).isNotNull();
    }

    @Test
    void unaryOperatorsQuantifiersAndClosures_mapToSymbols() {
        assertThat(Arrays.stream(UnaryOperator.values()).map(Symbol::forOperator)).doesNotContainNull();
        assertThat(Arrays.stream(QuantifierKind.values()).map(Symbol::forQuantifier)).doesNotContainNull();
        assertThat(Arrays.stream(ClosureKind.values()).map(Symbol::forClosure)).doesNotContainNull();
    }

    @Test
    void standardDialect_usesAmsSymbols() {
        assertThat(Symbol.IMPLIES.latex(NotationMode.STANDARD)).isEqualTo("\\Rightarrow");
        assertThat(Symbol.NATURALS.latex(NotationMode.STANDARD)).isEqualTo("\\mathbb{N}");
        assertThat(Symbol.BULLET.latex(NotationMode.STANDARD)).isEqualTo("\\bullet");
    }

    @Test
    void fuzzDialect_usesFuzzMacros() {
        assertThat(Symbol.IMPLIES.latex(NotationMode.FUZZ)).isEqualTo("\\implies");
        assertThat(Symbol.NATURALS.latex(NotationMode.FUZZ)).isEqualTo("\\nat");
        assertThat(Symbol.BULLET.latex(NotationMode.FUZZ)).isEqualTo("\\spot");
    }

    @Test
    void template_takesTheOperand() {
        assertThat(Symbol.FIRST.apply(NotationMode.FUZZ, "p")).isEqualTo("first~p");
        assertThat(Symbol.SECOND.apply(NotationMode.STANDARD, "p")).isEqualTo("p.2");
    }

    @Test
    void toolkitNames_resolveWithUnicodeAliases() {
        assertThat(Symbol.forName("ℕ")).contains(Symbol.NATURALS);
        assertThat(Symbol.forName("dom")).contains(Symbol.DOM);
        assertThat(Symbol.forName("count")).isEmpty();
    }
}
