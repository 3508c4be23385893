package org.pragmatica.txt2tex.generator;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.txt2tex.generator.TextPipeline.Formula;
import org.pragmatica.txt2tex.generator.TextPipeline.Prose;
import org.pragmatica.txt2tex.generator.TextPipeline.Raw;
import org.pragmatica.txt2tex.generator.TextPipeline.Segment;
import org.pragmatica.txt2tex.generator.TextPipeline.Stage;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextPipelineTest {
    private final TextPipeline pipeline = new TextPipeline(NotationMode.STANDARD);

    private Stage stage(String name) {
        return pipeline.stages()
                       .stream()
                       .filter(stage -> stage.name().equals(name))
                       .findFirst()
                       .orElseThrow();
    }

    private List<Segment> run(String name, String text) {
        return stage(name).apply(List.of(new Prose(text)));
    }

    @Test
    void stages_runInFixedOrder() {
        assertThat(pipeline.stages()).extracting(Stage::name)
                                     .containsExactly("citation", "manual math", "set builder", "quantifier",
                                                      "logic group", "declaration", "relation", "application",
                                                      "script", "connective", "keyword");
    }

    @Nested
    class Stages {

        @Test
        void citation_becomesCitep() {
            assertThat(run("citation", "see [cite spivey92 p. 3] here"))
                .containsExactly(new Prose("see "), new Raw("\\citep[p. 3]{spivey92}"), new Prose(" here"));
            assertThat(run("citation", "[cite woodcock96]")).containsExactly(new Raw("\\citep{woodcock96}"));
        }

        @Test
        void manualMath_passesThroughVerbatim() {
            assertThat(run("manual math", "so $x^2$ is even"))
                .containsExactly(new Prose("so "), new Raw("$x^2$"), new Prose(" is even"));
        }

        @Test
        void relation_becomesFormula() {
            assertThat(run("relation", "so x <= y holds"))
                .containsExactly(new Prose("so "), new Formula("x \\leq y"), new Prose(" holds"));
        }

        @Test
        void declaration_usesTheDialectColon() {
            assertThat(run("declaration", "let n : N be"))
                .containsExactly(new Prose("let "), new Formula("n \\colon \\mathbb{N}"), new Prose(" be"));
        }

        @Test
        void connective_becomesSymbol() {
            assertThat(run("connective", "p => q"))
                .containsExactly(new Prose("p "), new Formula("\\Rightarrow"), new Prose(" q"));
        }

        @Test
        void keyword_becomesSymbol() {
            assertThat(run("keyword", "not equal to emptyset."))
                .containsExactly(new Prose("not equal to "), new Formula("\\emptyset"), new Prose("."));
            assertThat(run("keyword", "Prove exists1 x")).containsExactly(new Prose("Prove "),
                                                                          new Formula("\\exists_1"),
                                                                          new Prose(" x"));
        }

        @Test
        void keyword_needsWordBoundaries() {
            assertThat(run("keyword", "forallx and \\forall and elements"))
                .containsExactly(new Prose("forallx and \\forall and elements"));
        }

        @Test
        void application_becomesFormula() {
            assertThat(run("application", "then f(x) holds"))
                .containsExactly(new Prose("then "), new Formula("f(x)"), new Prose(" holds"));
        }

        @Test
        void unparsableCandidate_staysProse() {
            assertThat(run("set builder", "{ | }")).containsExactly(new Prose("{ | }"));
        }

        @Test
        void formulaSegments_areNotRewrittenAgain() {
            List<Segment> input = List.of(new Formula("x < y"), new Prose(" and a < b"));

            assertThat(stage("relation").apply(input))
                .containsExactly(new Formula("x < y"), new Prose(" and "), new Formula("a < b"));
        }
    }

    @Nested
    class Rendering {

        @Test
        void setBuilderFollowedByPeriod_leavesThePeriodAsProse() {
            assertThat(pipeline.render("The set { x : N | x > 0 }."))
                .isEqualTo("The set $\\{~ x \\colon \\mathbb{N} \\mid x > 0 ~\\}$.");
        }

        @Test
        void quantifier_stopsAtTheSentenceBreak() {
            assertThat(pipeline.render("Clearly forall x : N | x >= 0, as required."))
                .isEqualTo("Clearly $\\forall x \\colon \\mathbb{N} \\bullet x \\geq 0$, as required.");
        }

        @Test
        void bareKeywords_becomeSymbolsWhenNoFormulaParses() {
            assertThat(pipeline.render("There exists a natural number n such that n > 10."))
                .isEqualTo("There $\\exists$ a natural number n such that $n > 10$.");
            assertThat(pipeline.render("The set S is not equal to emptyset."))
                .isEqualTo("The set S is not equal to $\\emptyset$.");
            assertThat(pipeline.render("Prove that forall x elem N, x >= 0."))
                .isEqualTo("Prove that $\\forall$ x $\\in$ N, $x \\geq 0$.");
        }

        @Test
        void declaration_insideASentence() {
            assertThat(pipeline.render("Let x : N be given."))
                .isEqualTo("Let $x \\colon \\mathbb{N}$ be given.");
        }

        @Test
        void plainText_isEscaped() {
            assertThat(pipeline.render("50% of A & B")).isEqualTo("50\\% of A \\& B");
        }

        @Test
        void fuzzDialect_changesTheSymbols() {
            assertThat(new TextPipeline(NotationMode.FUZZ).render("hence p => q"))
                .isEqualTo("hence p $\\implies$ q");
        }
    }

    @Test
    void escape_coversLatexSpecials() {
        assertThat(TextPipeline.escape("a_b {c} $d ^ ~ \\"))
            .isEqualTo("a\\_b \\{c\\} \\$d \\^{} \\textasciitilde{} \\textbackslash{}");
    }
}
