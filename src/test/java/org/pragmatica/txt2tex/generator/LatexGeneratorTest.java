package org.pragmatica.txt2tex.generator;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.txt2tex.parser.Parser;

import static org.assertj.core.api.Assertions.assertThat;

class LatexGeneratorTest {
    private static final GeneratorConfig BODY_ONLY = GeneratorConfig.builder()
                                                                    .standalone(false)
                                                                    .build();

    private static String body(String input) {
        return LatexGenerator.generate(Parser.parse(input), BODY_ONLY).output();
    }

    private static String fuzzBody(String input) {
        return LatexGenerator.generate(Parser.parse(input), BODY_ONLY.withNotationMode(NotationMode.FUZZ)).output();
    }

    @Nested
    class Layout {

        @Test
        void standalone_hasPreambleAndDialectPackages() {
            var output = LatexGenerator.generate(Parser.parse("p")).output();

            assertThat(output).startsWith("\\documentclass[a4paper,10pt,fleqn]{article}\n")
                              .contains("\\usepackage{zed-cm}")
                              .contains("\\begin{document}")
                              .endsWith("\\end{document}\n");
        }

        @Test
        void fuzzDialect_loadsFuzz() {
            var config = GeneratorConfig.DEFAULT.withNotationMode(NotationMode.FUZZ);

            assertThat(LatexGenerator.generate(Parser.parse("p"), config).output())
                .contains("\\usepackage{fuzz}")
                .doesNotContain("zed-cm");
        }

        @Test
        void metadata_producesTitleBlock() {
            var output = LatexGenerator.generate(Parser.parse("TITLE: Sets\nAUTHOR: A. Student\np\n")).output();

            assertThat(output).contains("\\title{Sets}")
                              .contains("\\author{A. Student}")
                              .contains("\\maketitle");
        }

        @Test
        void bodyOnly_skipsThePreamble() {
            assertThat(body("p and q => r")).isEqualTo("\\[\np \\land q \\Rightarrow r\n\\]\n\n");
        }

        @Test
        void sectionsAndParts() {
            var output = body("=== Part one ===\n(a) p\n");

            assertThat(output).contains("\\section*{Part one}")
                              .contains("\\noindent\\textbf{(a)}");
        }

        @Test
        void subsectionParts_becomeHeadings() {
            assertThat(body("PARTS: subsection\n(a) p\n")).startsWith("\\subsection*{(a)}\n\n");
        }

        @Test
        void contents_setsItsDepth() {
            assertThat(body("CONTENTS: full\n")).isEqualTo("\\setcounter{tocdepth}{2}\n\\tableofcontents\n\n");
            assertThat(body("CONTENTS:\n")).startsWith("\\setcounter{tocdepth}{1}\n");
        }

        @Test
        void solutions_areListedInTheContents() {
            assertThat(body("** Solution 1 **\np\n"))
                .startsWith("\\subsection*{Solution 1}\n\\addcontentsline{toc}{subsection}{Solution 1}\n");
        }

        @Test
        void bibliography_closesTheBody() {
            assertThat(body("BIBLIOGRAPHY: refs.bib\np\n"))
                .endsWith("\\bibliographystyle{plainnat}\n\\bibliography{refs}\n\n");
            assertThat(body("BIBLIOGRAPHY_STYLE: alpha\nBIBLIOGRAPHY: refs\n"))
                .isEqualTo("\\bibliographystyle{alpha}\n\\bibliography{refs}\n\n");
        }

        @Test
        void bibliographyStyleAlone_isIgnored() {
            assertThat(body("BIBLIOGRAPHY_STYLE: alpha\np\n")).doesNotContain("bibliography");
        }

        @Test
        void textKinds() {
            assertThat(body("PURETEXT: 50% off\n")).isEqualTo("50\\% off\n\n");
            assertThat(body("LATEX: \\vspace{1em}\n")).isEqualTo("\\vspace{1em}\n\n");
            assertThat(body("TEXT: so x <= y\n")).isEqualTo("so $x \\leq y$\n\n");
        }
    }

    @Nested
    class ZedParagraphs {

        @Test
        void schema_hasWhereAndAlso() {
            var output = body("""
                schema State
                  count : N
                where
                  count <= 10

                  count >= 0
                end
                """);

            assertThat(output).isEqualTo("""
                \\begin{schema}{State}
                \\mathit{count} \\colon \\mathbb{N}
                \\where
                \\mathit{count} \\leq 10
                \\also
                \\mathit{count} \\geq 0
                \\end{schema}

                """);
        }

        @Test
        void axdef_inFuzz() {
            var output = fuzzBody("axdef\n  limit : N\nwhere\n  limit > 10\nend\n");

            assertThat(output).contains("\\begin{axdef}")
                              .contains("\\mathit{limit} : \\nat")
                              .contains("\\end{axdef}");
        }

        @Test
        void gendef_carriesItsParameters() {
            assertThat(body("gendef [X]\n  empty : P X\nend\n")).startsWith("\\begin{gendef}[X]\n");
        }

        @Test
        void freeType_usesDataBrackets() {
            assertThat(body("Tree ::= leaf | node<Tree, Tree>"))
                .contains("\\mathit{Tree} ::= \\mathit{leaf} | \\mathit{node} \\ldata \\mathit{Tree} \\cross "
                          + "\\mathit{Tree} \\rdata");
        }

        @Test
        void zedBlock_joinsItsLinesInOneEnvironment() {
            var output = body("zed\n  [ID]\n  Colour ::= red | green\n  Limit == 10\n  Limit > 0\nend\n");

            assertThat(output).isEqualTo("\\begin{zed}\n[\\mathit{ID}] \\\\\n"
                                         + "\\mathit{Colour} ::= \\mathit{red} | \\mathit{green} \\\\\n"
                                         + "\\mathit{Limit} == 10 \\\\\n\\mathit{Limit} > 0\n\\end{zed}\n\n");
        }

        @Test
        void syntaxBlock_alignsDefinitions() {
            var output = body("""
                syntax
                  OP ::= plus | minus
                  EXP ::= const<N>
                    | binop<EXP, OP, EXP>

                  VAL ::= num<N>
                end
                """);

            assertThat(output).isEqualTo("""
                \\begin{syntax}
                \\mathit{OP} & ::= & \\mathit{plus} | \\mathit{minus} \\\\
                \\mathit{EXP} & ::= & \\mathit{const} \\ldata \\mathbb{N} \\rdata \\\\
                & | & \\mathit{binop} \\ldata \\mathit{EXP} \\cross \\mathit{OP} \\cross \\mathit{EXP} \\rdata
                \\also
                \\mathit{VAL} & ::= & \\mathit{num} \\ldata \\mathbb{N} \\rdata
                \\end{syntax}

                """);
        }

        @Test
        void givenType_andAbbreviation() {
            assertThat(body("given PERSON")).isEqualTo("\\begin{zed}\n[\\mathit{PERSON}]\n\\end{zed}\n\n");
            assertThat(body("Pair[X] == X cross X")).contains("\\mathit{Pair}[X] == X \\cross X");
        }
    }

    @Nested
    class Derivations {

        @Test
        void truthTable_becomesTabular() {
            var output = body("TRUTH TABLE:\np | q | p and q\n-----\nT | T | T\nT | F | F\n");

            assertThat(output).contains("\\begin{tabular}{c|c|c}")
                              .contains("$p$ & $q$ & $p \\land q$ \\\\")
                              .contains("T & F & F \\\\");
        }

        @Test
        void equivalenceChain_usesArgue() {
            var output = body("EQUIV:\nnot (p and q)\n<=> not p or not q [De Morgan]\n");

            assertThat(output).contains("\\begin{argue}")
                              .contains("\\Leftrightarrow \\lnot p \\lor \\lnot q & [\\mathrm{De}\\ \\mathrm{Morgan}]");
        }

        @Test
        void inferenceRule_usesInfer() {
            assertThat(body("INFRULE:\np, q\n---\np and q [and intro]\n"))
                .contains("\\infer[\\land\\ \\mathrm{intro}]{p \\land q}{p & q}");
        }

        @Test
        void proof_nestsInfer() {
            var output = body("PROOF:\np and q [and intro]\n  p\n  q\n");

            assertThat(output).contains("\\infer[\\land\\ \\mathrm{intro}]{p \\land q}{p & q}");
        }

        @Test
        void dischargedAssumption_carriesItsLabel() {
            var output = body("PROOF:\n[1] p [assumption]\n  q [=> intro from 1]\n");

            assertThat(output).contains("[p]^{1}");
        }

        @Test
        void leadingCase_rendersAnEllipsisConclusion() {
            assertThat(body("PROOF:\ncase p:\n  r\ncase q:\n  r\n"))
                .contains("\\infer{\\ldots}{\\deduce{r}{[p]} & \\deduce{r}{[q]}}");
        }
    }

    @Nested
    class Warnings {

        @Test
        void unresolvedDischarge_isReported() {
            var result = LatexGenerator.generate(Parser.parse("PROOF:\n[1] p [assumption]\n  q [=> intro from 2]\n"));

            assertThat(result.hasWarnings()).isTrue();
            assertThat(result.warnings()).singleElement()
                .isInstanceOfSatisfying(GenerationWarning.UnresolvedDischarge.class,
                    warning -> assertThat(warning.label()).isEqualTo("2"));
        }

        @Test
        void citationBeyondIntRange_isAWarning() {
            var result = LatexGenerator.generate(Parser.parse("PROOF:\np => q [=> intro from 99999999999]\n  q [assumption]\n"));

            assertThat(result.output()).contains("\\mathrm{intro}\\ \\mathrm{from}\\ 99999999999");
            assertThat(result.warnings()).singleElement()
                .isInstanceOfSatisfying(GenerationWarning.UnresolvedDischarge.class,
                    warning -> assertThat(warning.label()).isEqualTo("99999999999"));
        }

        @Test
        void resolvedDischarge_isSilent() {
            var result = LatexGenerator.generate(Parser.parse("PROOF:\n[1] p [assumption]\n  q [=> intro from 1]\n"));

            assertThat(result.hasWarnings()).isFalse();
        }

        @Test
        void longOutputLine_isReported() {
            var config = GeneratorConfig.builder()
                                        .standalone(false)
                                        .overflowThreshold(10)
                                        .build();

            var result = LatexGenerator.generate(Parser.parse("p and q => r"), config);

            assertThat(result.warnings()).containsExactly(new GenerationWarning.LineOverflow(2, 23, 10));
        }

        @Test
        void warnings_doNotChangeTheOutput() {
            var document = Parser.parse("p and q => r");
            var strict = GeneratorConfig.builder()
                                        .standalone(false)
                                        .overflowThreshold(1)
                                        .build();

            assertThat(LatexGenerator.generate(document, strict).output())
                .isEqualTo(LatexGenerator.generate(document, BODY_ONLY).output());
        }
    }

    @Property
    void generation_isDeterministic(@ForAll NotationMode mode, @ForAll("documents") String source) {
        var document = Parser.parse(source);
        var config = GeneratorConfig.DEFAULT.withNotationMode(mode);

        assertThat(LatexGenerator.generate(document, config))
            .isEqualTo(LatexGenerator.generate(document, config));
    }

    @Property
    void dialects_produceDifferentOutput(@ForAll("documents") String source) {
        var document = Parser.parse(source);

        assertThat(LatexGenerator.generate(document, BODY_ONLY.withNotationMode(NotationMode.FUZZ)).output())
            .isNotEqualTo(LatexGenerator.generate(document, BODY_ONLY).output());
    }

    @Provide
    Arbitrary<String> documents() {
        return Arbitraries.of(
            "forall x : N | x >= 0",
            "p and q => r",
            "schema S\n  x : N\nwhere\n  x > 0\nend\n",
            "EQUIV:\np => q\n<=> not p or q [implication]\n",
            "PROOF:\n[1] p [assumption]\n  p => p [=> intro from 1]\n",
            "TEXT: for all x : N we have x >= 0\n",
            "{ x : Z | x > 0 . x * x }");
    }
}
