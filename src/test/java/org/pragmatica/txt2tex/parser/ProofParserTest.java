package org.pragmatica.txt2tex.parser;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.txt2tex.ast.DocumentItem;
import org.pragmatica.txt2tex.ast.ProofStep;
import org.pragmatica.txt2tex.error.ParseError;

import java.util.ArrayList;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.txt2tex.parser.Shapes.shape;

class ProofParserTest {

    private static DocumentItem.ProofTree proof(String input) {
        var items = Parser.parse(input).items();
        assertThat(items).hasSize(1);
        return (DocumentItem.ProofTree) items.get(0);
    }

    @Nested
    class Nesting {

        @Test
        void indentedLines_becomePremises() {
            var tree = proof("""
                PROOF:
                p and q [and intro]
                  p [premise]
                  q [premise]
                """);

            var root = tree.root();
            assertThat(root.id()).isZero();
            assertThat(shape(root.expression().orElseThrow())).isEqualTo("(p AND q)");
            assertThat(root.justification()).contains("and intro");
            assertThat(root.children()).hasSize(2);
        }

        @Test
        void deeperIndentation_nestsFurther() {
            var tree = proof("PROOF:\np\n  q\n    r\n");

            var q = (ProofStep.ProofNode) tree.root().children().get(0);
            assertThat(q.children()).singleElement()
                                    .isInstanceOfSatisfying(ProofStep.ProofNode.class,
                                        r -> assertThat(r.id()).isEqualTo(2));
        }

        @Test
        void idsFollowPreorder() {
            var tree = proof("""
                PROOF:
                a
                  b
                    c
                  d
                """);

            var ids = new ArrayList<Integer>();
            tree.root().forEachNode(node -> ids.add(node.id()));
            assertThat(ids).containsExactly(0, 1, 2, 3);
        }

        @Test
        void siblingMarker_isRecorded() {
            var tree = proof("PROOF:\np and q [and intro]\n  :: p [premise]\n  :: q [premise]\n");

            assertThat(tree.root().children())
                .allSatisfy(child -> assertThat(((ProofStep.ProofNode) child).sibling()).isTrue());
        }

        @Test
        void blankLineBeforeAnUnindentedLine_endsTheProof() {
            var items = Parser.parse("PROOF:\np\n  q\n\nr\n").items();

            assertThat(items).hasExactlyElementsOfTypes(DocumentItem.ProofTree.class,
                                                        DocumentItem.ExpressionItem.class);
        }

        @Test
        void blankLinesBeforeADeeperStep_areSkipped() {
            var tree = proof("""
                PROOF:
                p => q [=> intro from 1]
                  q [x]


                    [1] p [assumption]
                """);

            var q = (ProofStep.ProofNode) tree.root().children().get(0);
            assertThat(q.children()).singleElement()
                                    .isInstanceOfSatisfying(ProofStep.ProofNode.class, p -> {
                                        assertThat(p.label()).contains(1);
                                        assertThat(p.isAssumption()).isTrue();
                                    });
            assertThat(tree.labels()).isEqualTo(Map.of(1, 2));
        }
    }

    @Nested
    class Labels {

        @Test
        void assumptionLabel_isIndexedByNodeId() {
            var tree = proof("""
                PROOF:
                [1] p [assumption]
                  q [=> intro from 1]
                """);

            assertThat(tree.root().label()).contains(1);
            assertThat(tree.root().isAssumption()).isTrue();
            assertThat(tree.labels()).isEqualTo(Map.of(1, 0));
        }

        @Test
        void labelsDeeperInTheTree_areIndexedToo() {
            var tree = proof("""
                PROOF:
                p => q [=> intro from 1]
                  [1] p [assumption]
                  [2] r [assumption]
                """);

            assertThat(tree.labels()).isEqualTo(Map.of(1, 1, 2, 2));
        }

        @Test
        void duplicateLabel_isAnError() {
            assertThatThrownBy(() -> Parser.parse("PROOF:\nq\n  [1] p [assumption]\n  [1] r [assumption]\n"))
                .isInstanceOf(ParseError.class)
                .hasMessageContaining("Label [1] already introduced in this proof");
        }

        @Test
        void labelTooLong_isAnErrorAtTheLabel() {
            assertThatThrownBy(() -> Parser.parse("PROOF:\n[99999999999] p [assumption]\n"))
                .isInstanceOfSatisfying(ParseError.class, error -> {
                    assertThat(error.reason()).isEqualTo("Proof label [99999999999] must be a number of at most 9 digits");
                    assertThat(error.location().line()).isEqualTo(2);
                    assertThat(error.location().column()).isEqualTo(2);
                });
        }

        @Test
        void numericBracket_isNotAJustification() {
            var tree = proof("PROOF:\n[3] p\n");

            assertThat(tree.root().label()).contains(3);
            assertThat(tree.root().justification()).isEmpty();
        }
    }

    @Nested
    class CaseAnalysis {

        @Test
        void caseLines_groupIntoOneAnalysis() {
            var tree = proof("""
                PROOF:
                r [or elim]
                  p or q [premise]
                  case p:
                    r [from p]
                  case q:
                    r [from q]
                """);

            assertThat(tree.root().children()).hasSize(2);
            assertThat(tree.root().children().get(1))
                .isInstanceOfSatisfying(ProofStep.CaseAnalysis.class, analysis -> {
                    assertThat(analysis.branches()).hasSize(2);
                    assertThat(shape(analysis.branches().get(0).hypothesis())).isEqualTo("p");
                    assertThat(analysis.branches().get(1).steps()).hasSize(1);
                });
        }

        @Test
        void leadingCase_getsASyntheticConclusion() {
            var tree = proof("""
                PROOF:
                case p:
                  r
                case q:
                  r
                """);

            assertThat(tree.root().isSynthetic()).isTrue();
            assertThat(tree.root().children()).singleElement()
                                              .isInstanceOfSatisfying(ProofStep.CaseAnalysis.class,
                                                  analysis -> assertThat(analysis.branches()).hasSize(2));
        }
    }

    @Nested
    class Errors {

        @Test
        void secondConclusion_isAnError() {
            assertThatThrownBy(() -> Parser.parse("PROOF:\n  p\nq\n"))
                .isInstanceOf(ParseError.class)
                .hasMessageContaining("exactly one conclusion");
        }

        @Test
        void siblingMarkerOnConclusion_isAnError() {
            assertThatThrownBy(() -> Parser.parse("PROOF:\n:: p\n"))
                .isInstanceOf(ParseError.class)
                .hasMessageContaining("cannot carry a sibling marker");
        }

        @Test
        void strictIndentation_rejectsUnevenSteps() {
            var config = ParserConfig.builder()
                                     .strictIndentation(true)
                                     .build();

            assertThatThrownBy(() -> Parser.parse("PROOF:\np\n   q\n", config))
                .isInstanceOf(ParseError.class)
                .hasMessageContaining("Expected proof step at column 3 but found column 4");
        }

        @Test
        void tolerantIndentation_acceptsUnevenSteps() {
            var tree = proof("PROOF:\np\n   q\n");

            assertThat(tree.root().children()).hasSize(1);
        }

        @Test
        void emptyProof_isAnError() {
            assertThatThrownBy(() -> Parser.parse("PROOF:\n"))
                .isInstanceOf(ParseError.class);
        }
    }
}
